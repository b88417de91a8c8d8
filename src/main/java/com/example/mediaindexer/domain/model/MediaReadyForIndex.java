package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.MediaType;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MediaReadyForIndex {

    MediaAnalyzed analyzed;

    /** Resolved logical entity; null when enrichment was skipped or degraded. */
    String logicalId;

    MediaType mediaType;

    /** References to store for the logical entity, parents first. */
    @Builder.Default
    List<MediaReference> references = Collections.emptyList();

    @Builder.Default
    List<ImageFetchJob> imageJobs = Collections.emptyList();

    String degradedReason;

    public static MediaReadyForIndex unresolved(MediaAnalyzed analyzed, String degradedReason) {
        return MediaReadyForIndex.builder()
                .analyzed(analyzed)
                .degradedReason(degradedReason)
                .build();
    }
}
