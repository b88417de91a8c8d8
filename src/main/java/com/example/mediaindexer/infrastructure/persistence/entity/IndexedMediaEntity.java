package com.example.mediaindexer.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class IndexedMediaEntity {

    private Long id;

    private String mediaId;

    private Long libraryId;

    private Long rootId;

    private String path;

    private String pathMd5;

    private String mediaType;

    private String logicalId;

    private String fingerprint;

    private Long fileSize;

    private Long fileMtime;

    private String streamsJson;

    private String idempotencyKey;

    private Long lastScanId;

    private Integer deleted;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
