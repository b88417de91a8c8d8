package com.example.mediaindexer.domain.enumtype;

public enum IndexingChange {
    CREATED,
    UPDATED
}
