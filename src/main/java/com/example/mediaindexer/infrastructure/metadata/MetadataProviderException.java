package com.example.mediaindexer.infrastructure.metadata;

import com.example.mediaindexer.domain.enumtype.ProviderErrorKind;

public class MetadataProviderException extends Exception {

    private final ProviderErrorKind kind;

    public MetadataProviderException(ProviderErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MetadataProviderException(ProviderErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }
}
