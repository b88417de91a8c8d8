package com.example.mediaindexer.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MediaAnalyzed {

    public static final String PLACEHOLDER_STREAMS_JSON = "{\"placeholder\":true}";

    MediaFingerprint fingerprint;

    String streamsJson;

    Map<String, Object> context;

    boolean placeholder;

    /** Why extraction produced a placeholder; null when it succeeded or was skipped. */
    String probeError;
}
