package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.domain.model.MediaAnalyzed;
import com.example.mediaindexer.domain.model.MediaJob;
import com.example.mediaindexer.domain.model.MediaReadyForIndex;

/**
 * Second stage: resolves the logical entity and its artwork. Never fails on provider errors.
 */
public interface MetadataActor {

    MediaReadyForIndex enrich(MediaJob job, MediaAnalyzed analyzed);
}
