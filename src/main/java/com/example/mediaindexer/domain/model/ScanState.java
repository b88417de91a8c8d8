package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.ScanStatus;
import com.example.mediaindexer.domain.enumtype.ScanType;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ScanState {

    private Long id;

    private Long libraryId;

    private ScanType scanType;

    private ScanStatus status;

    private int totalFolders;

    private int processedFolders;

    private int totalFiles;

    private int processedFiles;

    private String currentPath;

    private int errorCount;

    private List<String> errors = new ArrayList<>();

    private LocalDateTime startedAt;

    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;

    private ScanOptions options = ScanOptions.defaults();
}
