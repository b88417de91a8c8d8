package com.example.mediaindexer.common.exception;

import com.example.mediaindexer.domain.enumtype.MediaType;

/**
 * Raised by the reference store when no reference of the requested type exists for an id.
 */
public class MediaReferenceNotFoundException extends BusinessException {

    private final MediaType mediaType;
    private final String referenceId;

    public MediaReferenceNotFoundException(MediaType mediaType, String referenceId) {
        super("404", mediaType.name().toLowerCase() + " reference not found: " + referenceId);
        this.mediaType = mediaType;
        this.referenceId = referenceId;
    }

    public MediaType getMediaType() {
        return mediaType;
    }

    public String getReferenceId() {
        return referenceId;
    }
}
