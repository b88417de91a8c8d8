package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.domain.model.ImageFetchJob;

/**
 * Artwork download. Best effort: failures are reported through the return value only.
 *
 * @see com.example.mediaindexer.infrastructure.image.HttpImageFetchActor
 */
public interface ImageFetchActor {

    /**
     * @return true when the image is in the local cache afterwards
     */
    boolean fetch(ImageFetchJob job);
}
