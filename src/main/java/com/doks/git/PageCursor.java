package com.doks.git;

public record PageCursor(String endCursor, boolean hasNextPage) {
}
