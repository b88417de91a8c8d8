package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.MediaType;
import lombok.Data;

/**
 * Canonical movie, series, season or episode record a file maps to.
 */
@Data
public class MediaReference {

    private String id;

    private MediaType mediaType;

    private String externalId;

    /** Series id for a season, season id for an episode. */
    private String parentId;

    private String title;

    private Integer year;

    private Integer seasonNumber;

    private Integer episodeNumber;

    private String overview;

    private String posterPath;

    private String backdropPath;
}
