package com.doks.search;

public record FoundItem(String id, float score, String source, String title, String link, String snippet) {
}
