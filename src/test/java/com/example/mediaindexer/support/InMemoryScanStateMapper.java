package com.example.mediaindexer.support;

import com.example.mediaindexer.infrastructure.persistence.entity.ScanStateEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.ScanStateMapper;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryScanStateMapper implements ScanStateMapper {

    private final Map<Long, ScanStateEntity> rows = new TreeMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public synchronized int insert(ScanStateEntity entity) {
        entity.setId(ids.incrementAndGet());
        rows.put(entity.getId(), copy(entity));
        return 1;
    }

    @Override
    public synchronized ScanStateEntity selectById(Long id) {
        ScanStateEntity entity = rows.get(id);
        return entity == null ? null : copy(entity);
    }

    @Override
    public synchronized int updateStatus(Long id, String expectedStatus, String status, LocalDateTime startedAt,
                                         LocalDateTime completedAt, LocalDateTime updatedAt) {
        ScanStateEntity entity = rows.get(id);
        if (entity == null || !expectedStatus.equals(entity.getStatus())) {
            return 0;
        }
        entity.setStatus(status);
        entity.setStartedAt(startedAt);
        entity.setCompletedAt(completedAt);
        entity.setUpdatedAt(updatedAt);
        return 1;
    }

    @Override
    public synchronized int updateProgress(Long id, int totalFolders, int processedFolders, int totalFiles,
                                           int processedFiles, String currentPath, LocalDateTime updatedAt) {
        ScanStateEntity entity = rows.get(id);
        if (entity == null) {
            return 0;
        }
        entity.setTotalFolders(totalFolders);
        entity.setProcessedFolders(processedFolders);
        entity.setTotalFiles(totalFiles);
        entity.setProcessedFiles(processedFiles);
        entity.setCurrentPath(currentPath);
        entity.setUpdatedAt(updatedAt);
        return 1;
    }

    @Override
    public synchronized int updateErrors(Long id, int errorCount, String errorsJson, LocalDateTime updatedAt) {
        ScanStateEntity entity = rows.get(id);
        if (entity == null) {
            return 0;
        }
        entity.setErrorCount(errorCount);
        entity.setErrorsJson(errorsJson);
        entity.setUpdatedAt(updatedAt);
        return 1;
    }

    @Override
    public synchronized List<ScanStateEntity> selectByStatuses(Long libraryId, List<String> statuses) {
        List<ScanStateEntity> result = new ArrayList<>();
        for (ScanStateEntity entity : rows.values()) {
            if (statuses.contains(entity.getStatus())
                    && (libraryId == null || libraryId.equals(entity.getLibraryId()))) {
                result.add(copy(entity));
            }
        }
        return result;
    }

    @Override
    public synchronized ScanStateEntity selectLatest(Long libraryId, String scanType, String status) {
        ScanStateEntity latest = null;
        for (ScanStateEntity entity : rows.values()) {
            if (libraryId.equals(entity.getLibraryId())
                    && (scanType == null || scanType.equals(entity.getScanType()))
                    && (status == null || status.equals(entity.getStatus()))) {
                latest = entity;
            }
        }
        return latest == null ? null : copy(latest);
    }

    /**
     * Overwrites a stored row, for arranging state a test cannot reach through the orchestrator.
     */
    public synchronized void put(ScanStateEntity entity) {
        rows.put(entity.getId(), copy(entity));
        ids.set(Math.max(ids.get(), entity.getId()));
    }

    private ScanStateEntity copy(ScanStateEntity source) {
        ScanStateEntity target = new ScanStateEntity();
        target.setId(source.getId());
        target.setLibraryId(source.getLibraryId());
        target.setScanType(source.getScanType());
        target.setStatus(source.getStatus());
        target.setTotalFolders(source.getTotalFolders());
        target.setProcessedFolders(source.getProcessedFolders());
        target.setTotalFiles(source.getTotalFiles());
        target.setProcessedFiles(source.getProcessedFiles());
        target.setCurrentPath(source.getCurrentPath());
        target.setErrorCount(source.getErrorCount());
        target.setErrorsJson(source.getErrorsJson());
        target.setOptionsJson(source.getOptionsJson());
        target.setStartedAt(source.getStartedAt());
        target.setCompletedAt(source.getCompletedAt());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}
