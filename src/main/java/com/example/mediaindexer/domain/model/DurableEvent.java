package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A normalized filesystem change as stored in the durable event log. {@code seq} is assigned by the
 * log on append and is null before that.
 */
@Value
@Builder(toBuilder = true)
public class DurableEvent {

    public static final int EVENT_VERSION = 1;

    Long seq;

    @Builder.Default
    int version = EVENT_VERSION;

    Long libraryId;

    Long rootId;

    FileChangeKind kind;

    String path;

    String oldPath;

    Long fileSize;

    Instant detectedAt;

    String correlationId;

    String idempotencyKey;
}
