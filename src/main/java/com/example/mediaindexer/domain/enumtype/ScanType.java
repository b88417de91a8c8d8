package com.example.mediaindexer.domain.enumtype;

public enum ScanType {
    FULL,
    INCREMENTAL,
    REFRESH_METADATA,
    ANALYZE
}
