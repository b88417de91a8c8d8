package com.example.mediaindexer.domain.enumtype;

public enum MediaType {
    MOVIE,
    SERIES,
    SEASON,
    EPISODE
}
