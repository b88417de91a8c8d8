package com.example.mediaindexer.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class FileWatchEventEntity {

    private Long id;

    private Integer version;

    private Long libraryId;

    private Long rootId;

    private String kind;

    private String path;

    private String oldPath;

    private Long fileSize;

    private LocalDateTime detectedAt;

    private String correlationId;

    private String idempotencyKey;

    private LocalDateTime createdAt;
}
