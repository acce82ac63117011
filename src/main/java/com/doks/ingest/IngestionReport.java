package com.doks.ingest;

public record IngestionReport(int sources, int batches, int documents) {
}
