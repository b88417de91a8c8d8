package com.example.mediaindexer.domain.enumtype;

public enum ProviderErrorKind {
    API_ERROR,
    NOT_FOUND,
    RATE_LIMITED,
    INVALID_API_KEY,
    NETWORK_ERROR,
    PARSE_ERROR
}
