package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.ScanReason;
import lombok.Builder;
import lombok.Value;

/**
 * One media file travelling through the analyze, enrich and index stages.
 */
@Value
@Builder(toBuilder = true)
public class MediaJob {

    Long scanId;

    Long libraryId;

    Long rootId;

    String path;

    /** Former location when the job comes from a move. */
    String previousPath;

    Long fileSize;

    Long mtimeMillis;

    String correlationId;

    String idempotencyKey;

    ScanOptions options;

    ScanReason reason;
}
