package com.example.mediaindexer.application.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PipelineReceipt {

    Long libraryId;

    Long scanId;

    String correlationId;

    int processed;

    int skipped;

    int failed;

    int deleted;

    /** False when the scan stopped early because it was paused or cancelled. */
    boolean finished;

    public static PipelineReceipt empty(Long libraryId) {
        return PipelineReceipt.builder().libraryId(libraryId).finished(true).build();
    }
}
