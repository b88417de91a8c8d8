package com.example.mediaindexer.domain.enumtype;

public enum ImageFetchPriority {
    POSTER,
    BACKDROP,
    PROFILE
}
