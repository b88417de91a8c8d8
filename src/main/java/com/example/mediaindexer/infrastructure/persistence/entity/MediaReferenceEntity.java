package com.example.mediaindexer.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class MediaReferenceEntity {

    private String id;

    private String mediaType;

    private String externalId;

    private String parentId;

    private String title;

    private Integer releaseYear;

    private Integer seasonNumber;

    private Integer episodeNumber;

    private String overview;

    private String posterPath;

    private String backdropPath;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
