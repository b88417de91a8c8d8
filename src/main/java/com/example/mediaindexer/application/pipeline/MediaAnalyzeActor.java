package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.domain.model.MediaAnalyzed;
import com.example.mediaindexer.domain.model.MediaJob;
import java.io.IOException;

/**
 * First stage: fingerprints the file and extracts its technical metadata.
 */
public interface MediaAnalyzeActor {

    /**
     * @throws IOException when the file itself cannot be read; a failing extraction is not an error
     */
    MediaAnalyzed analyze(MediaJob job) throws IOException;
}
