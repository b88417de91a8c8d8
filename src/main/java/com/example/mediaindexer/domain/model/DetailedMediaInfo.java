package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.MediaType;
import lombok.Data;

@Data
public class DetailedMediaInfo {

    private String externalId;

    private MediaType mediaType;

    private String title;

    private Integer year;

    private String overview;

    private String posterPath;

    private String backdropPath;
}
