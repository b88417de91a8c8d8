package com.example.mediaindexer.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ScanStateEntity {

    private Long id;

    private Long libraryId;

    private String scanType;

    private String status;

    private Integer totalFolders;

    private Integer processedFolders;

    private Integer totalFiles;

    private Integer processedFiles;

    private String currentPath;

    private Integer errorCount;

    private String errorsJson;

    private String optionsJson;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
