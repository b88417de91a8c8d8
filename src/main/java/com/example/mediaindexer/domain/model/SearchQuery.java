package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.MediaType;
import lombok.Value;

@Value
public class SearchQuery {

    String title;

    Integer year;

    /** MOVIE or SERIES; null lets the provider search both. */
    MediaType mediaType;
}
