package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.IndexingChange;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IndexingOutcome {

    boolean upserted;

    String mediaId;

    /** Hydrated logical entity, when one matched. */
    MediaReference media;

    IndexingChange change;
}
