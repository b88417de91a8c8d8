package com.example.mediaindexer.domain.enumtype;

public enum WatchStrategy {
    NATIVE,
    POLLING
}
