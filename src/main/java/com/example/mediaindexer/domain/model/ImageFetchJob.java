package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.ImageFetchPriority;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ImageFetchJob {

    Long libraryId;

    /** Provider image path or absolute URL. */
    String source;

    ImageKey key;

    ImageFetchPriority priority;
}
