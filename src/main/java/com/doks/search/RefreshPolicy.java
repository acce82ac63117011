package com.doks.search;

public enum RefreshPolicy {
    ON_COMMIT,
    PERIODIC
}
