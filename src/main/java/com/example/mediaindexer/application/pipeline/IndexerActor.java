package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.domain.model.IndexingOutcome;
import com.example.mediaindexer.domain.model.MediaJob;
import com.example.mediaindexer.domain.model.MediaReadyForIndex;

/**
 * Third stage: writes the index row.
 */
public interface IndexerActor {

    IndexingOutcome index(MediaJob job, MediaReadyForIndex ready);
}
