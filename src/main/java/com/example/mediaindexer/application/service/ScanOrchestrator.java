package com.example.mediaindexer.application.service;

import com.example.mediaindexer.common.config.AppScanProperties;
import com.example.mediaindexer.common.exception.BusinessException;
import com.example.mediaindexer.common.util.MeterSupport;
import com.example.mediaindexer.common.util.TextUtil;
import com.example.mediaindexer.domain.enumtype.ScanStatus;
import com.example.mediaindexer.domain.enumtype.ScanType;
import com.example.mediaindexer.domain.model.ScanOptions;
import com.example.mediaindexer.domain.model.ScanState;
import com.example.mediaindexer.infrastructure.persistence.entity.ScanStateEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.ScanStateMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Owns the scan lifecycle. The scan_state table is the source of truth; the active and paused id
 * sets kept here are a cache rebuilt by {@link #recoverInterruptedScans()}.
 *
 * <p>Lifecycle transitions are written with a status guard, so a transition racing another one
 * loses instead of overwriting it. Every lifecycle command throws {@link BusinessException} with
 * code 404 for an unknown scan and reports a rejected transition through its return value: false,
 * or null from {@link #resumeScan(Long)}. Progress and error writes touch only their own columns and are
 * last-write-wins.
 */
@Service
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    public static final String FATAL_PREFIX = "FATAL: ";

    private static final int MAX_ERROR_LENGTH = 1000;

    private static final List<String> NON_TERMINAL_STATUSES = Arrays.asList(
            ScanStatus.PENDING.name(), ScanStatus.RUNNING.name(), ScanStatus.PAUSED.name());

    private static final TypeReference<List<String>> ERROR_LIST_TYPE = new TypeReference<List<String>>() {
    };

    private final ScanStateMapper scanStateMapper;
    private final AppScanProperties appScanProperties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private final Set<Long> activeScans = ConcurrentHashMap.newKeySet();
    private final Set<Long> pausedScans = ConcurrentHashMap.newKeySet();

    public ScanOrchestrator(ScanStateMapper scanStateMapper,
                            AppScanProperties appScanProperties,
                            ObjectMapper objectMapper,
                            ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.scanStateMapper = scanStateMapper;
        this.appScanProperties = appScanProperties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public ScanState createScan(Long libraryId, ScanType scanType, ScanOptions options) {
        LocalDateTime now = LocalDateTime.now();
        ScanState state = new ScanState();
        state.setLibraryId(libraryId);
        state.setScanType(scanType);
        state.setStatus(ScanStatus.PENDING);
        state.setOptions(options == null ? ScanOptions.defaults() : options.copy());
        state.setUpdatedAt(now);

        ScanStateEntity entity = toEntity(state);
        entity.setCreatedAt(now);
        scanStateMapper.insert(entity);
        state.setId(entity.getId());
        activeScans.add(state.getId());

        log.info("SCAN_CREATED scanId={} libraryId={} type={} reason={} correlationId={}",
                state.getId(), libraryId, scanType, state.getOptions().getScanReason(),
                state.getOptions().getCorrelationId());
        MeterSupport.incrementCounter(meterRegistry, "media.scan.created", 1, "scan_type", scanType.name());
        return state;
    }

    public boolean startScan(Long scanId) {
        ScanState state = requireScan(scanId);
        ScanStatus from = state.getStatus();
        LocalDateTime now = LocalDateTime.now();
        if (!transition(state, ScanStatus.RUNNING, now, null)) {
            return false;
        }
        pausedScans.remove(scanId);
        activeScans.add(scanId);
        log.info("SCAN_STARTED scanId={} libraryId={} fromStatus={}", scanId, state.getLibraryId(), from);
        return true;
    }

    /**
     * Raises the processed counters. Values lower than the stored ones are ignored. Does nothing
     * when the scan no longer exists or has already finished.
     */
    public void updateScanProgress(Long scanId, Integer processedFolders, Integer processedFiles, String currentPath) {
        ScanState state = getScan(scanId);
        if (state == null || state.getStatus().isTerminal()) {
            log.debug("SCAN_PROGRESS_IGNORED scanId={} status={}", scanId, state == null ? null : state.getStatus());
            return;
        }
        if (processedFolders != null) {
            state.setProcessedFolders(Math.max(state.getProcessedFolders(), processedFolders));
        }
        if (processedFiles != null) {
            state.setProcessedFiles(Math.max(state.getProcessedFiles(), processedFiles));
        }
        if (currentPath != null) {
            state.setCurrentPath(TextUtil.truncate(currentPath, 1024));
        }
        writeProgress(state);
    }

    public void updateScanTotals(Long scanId, Integer totalFolders, Integer totalFiles) {
        ScanState state = getScan(scanId);
        if (state == null || state.getStatus().isTerminal()) {
            return;
        }
        if (totalFolders != null) {
            state.setTotalFolders(Math.max(state.getTotalFolders(), totalFolders));
        }
        if (totalFiles != null) {
            state.setTotalFiles(Math.max(state.getTotalFiles(), totalFiles));
        }
        writeProgress(state);
    }

    /**
     * Records a per-item error. The stored list keeps the most recent entries only; the error
     * count always increases. Never changes the status.
     */
    public void addScanError(Long scanId, String message) {
        ScanState state = getScan(scanId);
        if (state == null) {
            log.debug("SCAN_ERROR_IGNORED scanId={} reason=missing", scanId);
            return;
        }
        appendError(state, message);
        writeErrors(state);
    }

    public boolean completeScan(Long scanId) {
        ScanState state = requireScan(scanId);
        LocalDateTime now = LocalDateTime.now();
        if (!transition(state, ScanStatus.COMPLETED, now, now)) {
            return false;
        }
        activeScans.remove(scanId);
        pausedScans.remove(scanId);
        log.info("SCAN_COMPLETED scanId={} libraryId={} folders={}/{} files={}/{} errors={}",
                scanId, state.getLibraryId(), state.getProcessedFolders(), state.getTotalFolders(),
                state.getProcessedFiles(), state.getTotalFiles(), state.getErrorCount());
        MeterSupport.incrementCounter(meterRegistry, "media.scan.finished", 1,
                "scan_type", state.getScanType().name(), "status", ScanStatus.COMPLETED.name());
        if (state.getStartedAt() != null) {
            MeterSupport.recordDuration(meterRegistry, "media.scan.duration",
                    Duration.between(state.getStartedAt(), now).toNanos(), "scan_type", state.getScanType().name());
        }
        return true;
    }

    /**
     * Fails the scan and records the reason with the {@value #FATAL_PREFIX} marker that separates
     * operator-actionable failures from per-item errors.
     */
    public boolean failScan(Long scanId, String reason) {
        ScanState state = requireScan(scanId);
        LocalDateTime now = LocalDateTime.now();
        if (!transition(state, ScanStatus.FAILED, now, now)) {
            return false;
        }
        activeScans.remove(scanId);
        pausedScans.remove(scanId);
        appendError(state, FATAL_PREFIX + (reason == null ? "unknown failure" : reason));
        writeErrors(state);
        log.error("SCAN_FAILED scanId={} libraryId={} reason={}", scanId, state.getLibraryId(), reason);
        MeterSupport.incrementCounter(meterRegistry, "media.scan.finished", 1,
                "scan_type", state.getScanType().name(), "status", ScanStatus.FAILED.name());
        return true;
    }

    public boolean pauseScan(Long scanId) {
        ScanState state = requireScan(scanId);
        if (!transition(state, ScanStatus.PAUSED, LocalDateTime.now(), null)) {
            return false;
        }
        activeScans.remove(scanId);
        pausedScans.add(scanId);
        log.info("SCAN_PAUSED scanId={} libraryId={} processedFiles={}",
                scanId, state.getLibraryId(), state.getProcessedFiles());
        return true;
    }

    /**
     * Moves a paused scan back to running and returns it, so the caller continues from its
     * processed counters.
     *
     * @return the resumed scan, or null when the scan is not paused
     */
    public ScanState resumeScan(Long scanId) {
        ScanState state = requireScan(scanId);
        if (state.getStatus() != ScanStatus.PAUSED) {
            log.info("SCAN_TRANSITION_REJECTED scanId={} from={} to={}", scanId, state.getStatus(), ScanStatus.RUNNING);
            return null;
        }
        if (!transition(state, ScanStatus.RUNNING, LocalDateTime.now(), null)) {
            return null;
        }
        pausedScans.remove(scanId);
        activeScans.add(scanId);
        log.info("SCAN_RESUMED scanId={} libraryId={} processedFolders={} processedFiles={}",
                scanId, state.getLibraryId(), state.getProcessedFolders(), state.getProcessedFiles());
        return state;
    }

    public boolean cancelScan(Long scanId) {
        ScanState state = requireScan(scanId);
        LocalDateTime now = LocalDateTime.now();
        if (!transition(state, ScanStatus.CANCELLED, now, now)) {
            return false;
        }
        activeScans.remove(scanId);
        pausedScans.remove(scanId);
        log.info("SCAN_CANCELLED scanId={} libraryId={}", scanId, state.getLibraryId());
        MeterSupport.incrementCounter(meterRegistry, "media.scan.finished", 1,
                "scan_type", state.getScanType().name(), "status", ScanStatus.CANCELLED.name());
        return true;
    }

    /**
     * @param libraryId library filter, or null for every library
     * @return scans that are pending, running or paused
     */
    public List<ScanState> getActiveScans(Long libraryId) {
        List<ScanStateEntity> entities = scanStateMapper.selectByStatuses(libraryId, NON_TERMINAL_STATUSES);
        if (entities == null || entities.isEmpty()) {
            return Collections.emptyList();
        }
        return entities.stream().map(this::toState).collect(Collectors.toList());
    }

    public ScanState getLatestScan(Long libraryId, ScanType scanType) {
        ScanStateEntity entity = scanStateMapper.selectLatest(
                libraryId, scanType == null ? null : scanType.name(), null);
        return entity == null ? null : toState(entity);
    }

    public ScanState getLatestCompletedScan(Long libraryId) {
        ScanStateEntity entity = scanStateMapper.selectLatest(libraryId, null, ScanStatus.COMPLETED.name());
        return entity == null ? null : toState(entity);
    }

    public ScanState getScan(Long scanId) {
        if (scanId == null) {
            return null;
        }
        ScanStateEntity entity = scanStateMapper.selectById(scanId);
        return entity == null ? null : toState(entity);
    }

    /**
     * Demotes every scan left RUNNING by a previous process to PAUSED and rebuilds the in-memory
     * id sets from storage. Demoted scans are never resumed automatically.
     *
     * @return number of scans demoted
     */
    public int recoverInterruptedScans() {
        List<ScanStateEntity> running = scanStateMapper.selectByStatuses(
                null, Collections.singletonList(ScanStatus.RUNNING.name()));
        int recovered = 0;
        if (running != null) {
            LocalDateTime now = LocalDateTime.now();
            for (ScanStateEntity entity : running) {
                int rows = scanStateMapper.updateStatus(entity.getId(), ScanStatus.RUNNING.name(),
                        ScanStatus.PAUSED.name(), entity.getStartedAt(), null, now);
                if (rows > 0) {
                    recovered++;
                    log.warn("SCAN_RECOVERED_AS_PAUSED scanId={} libraryId={} processedFiles={}",
                            entity.getId(), entity.getLibraryId(), entity.getProcessedFiles());
                }
            }
        }

        activeScans.clear();
        pausedScans.clear();
        List<ScanStateEntity> open = scanStateMapper.selectByStatuses(null, NON_TERMINAL_STATUSES);
        if (open != null) {
            for (ScanStateEntity entity : open) {
                if (ScanStatus.PAUSED.name().equals(entity.getStatus())) {
                    pausedScans.add(entity.getId());
                } else {
                    activeScans.add(entity.getId());
                }
            }
        }
        log.info("SCAN_RECOVERY_DONE recovered={} active={} paused={}", recovered, activeScans.size(), pausedScans.size());
        MeterSupport.incrementCounter(meterRegistry, "media.scan.recovered", recovered);
        return recovered;
    }

    public boolean isScanActive(Long scanId) {
        return activeScans.contains(scanId);
    }

    public boolean isScanPaused(Long scanId) {
        return pausedScans.contains(scanId);
    }

    private boolean transition(ScanState state, ScanStatus target, LocalDateTime now, LocalDateTime completedAt) {
        ScanStatus from = state.getStatus();
        if (!from.canTransitionTo(target)) {
            log.info("SCAN_TRANSITION_REJECTED scanId={} from={} to={}", state.getId(), from, target);
            return false;
        }
        LocalDateTime startedAt = state.getStartedAt();
        if (target == ScanStatus.RUNNING && (from == ScanStatus.PENDING || startedAt == null)) {
            startedAt = now;
        }
        int rows = scanStateMapper.updateStatus(state.getId(), from.name(), target.name(), startedAt, completedAt, now);
        if (rows == 0) {
            log.warn("SCAN_TRANSITION_CONFLICT scanId={} expected={} to={}", state.getId(), from, target);
            return false;
        }
        state.setStatus(target);
        state.setStartedAt(startedAt);
        state.setCompletedAt(completedAt);
        state.setUpdatedAt(now);
        return true;
    }

    private void appendError(ScanState state, String message) {
        List<String> errors = state.getErrors() == null ? new ArrayList<>() : new ArrayList<>(state.getErrors());
        errors.add(TextUtil.truncate(message == null ? "unknown error" : message, MAX_ERROR_LENGTH));
        int limit = Math.max(1, appScanProperties.getMaxRecordedErrors());
        while (errors.size() > limit) {
            errors.remove(0);
        }
        state.setErrors(errors);
        state.setErrorCount(state.getErrorCount() + 1);
    }

    private void writeProgress(ScanState state) {
        LocalDateTime now = LocalDateTime.now();
        state.setUpdatedAt(now);
        scanStateMapper.updateProgress(state.getId(), state.getTotalFolders(), state.getProcessedFolders(),
                state.getTotalFiles(), state.getProcessedFiles(), state.getCurrentPath(), now);
    }

    private void writeErrors(ScanState state) {
        LocalDateTime now = LocalDateTime.now();
        state.setUpdatedAt(now);
        scanStateMapper.updateErrors(state.getId(), state.getErrorCount(), writeJson(state.getErrors()), now);
    }

    private ScanState requireScan(Long scanId) {
        ScanState state = getScan(scanId);
        if (state == null) {
            throw new BusinessException("404", "Scan not found: " + scanId);
        }
        return state;
    }

    private ScanStateEntity toEntity(ScanState state) {
        ScanStateEntity entity = new ScanStateEntity();
        entity.setId(state.getId());
        entity.setLibraryId(state.getLibraryId());
        entity.setScanType(state.getScanType().name());
        entity.setStatus(state.getStatus().name());
        entity.setTotalFolders(state.getTotalFolders());
        entity.setProcessedFolders(state.getProcessedFolders());
        entity.setTotalFiles(state.getTotalFiles());
        entity.setProcessedFiles(state.getProcessedFiles());
        entity.setCurrentPath(state.getCurrentPath());
        entity.setErrorCount(state.getErrorCount());
        entity.setErrorsJson(writeJson(state.getErrors()));
        entity.setOptionsJson(writeJson(state.getOptions()));
        entity.setStartedAt(state.getStartedAt());
        entity.setCompletedAt(state.getCompletedAt());
        entity.setUpdatedAt(state.getUpdatedAt());
        return entity;
    }

    private ScanState toState(ScanStateEntity entity) {
        ScanState state = new ScanState();
        state.setId(entity.getId());
        state.setLibraryId(entity.getLibraryId());
        state.setScanType(ScanType.valueOf(entity.getScanType()));
        state.setStatus(ScanStatus.valueOf(entity.getStatus()));
        state.setTotalFolders(nullToZero(entity.getTotalFolders()));
        state.setProcessedFolders(nullToZero(entity.getProcessedFolders()));
        state.setTotalFiles(nullToZero(entity.getTotalFiles()));
        state.setProcessedFiles(nullToZero(entity.getProcessedFiles()));
        state.setCurrentPath(entity.getCurrentPath());
        state.setErrorCount(nullToZero(entity.getErrorCount()));
        state.setErrors(readErrors(entity));
        state.setOptions(readOptions(entity));
        state.setStartedAt(entity.getStartedAt());
        state.setUpdatedAt(entity.getUpdatedAt());
        state.setCompletedAt(entity.getCompletedAt());
        return state;
    }

    private List<String> readErrors(ScanStateEntity entity) {
        if (!TextUtil.hasText(entity.getErrorsJson())) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(entity.getErrorsJson(), ERROR_LIST_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("SCAN_ERRORS_UNREADABLE scanId={} msg={}", entity.getId(), e.getOriginalMessage());
            return new ArrayList<>();
        }
    }

    private ScanOptions readOptions(ScanStateEntity entity) {
        if (!TextUtil.hasText(entity.getOptionsJson())) {
            return ScanOptions.defaults();
        }
        try {
            return objectMapper.readValue(entity.getOptionsJson(), ScanOptions.class);
        } catch (JsonProcessingException e) {
            log.warn("SCAN_OPTIONS_UNREADABLE scanId={} msg={}", entity.getId(), e.getOriginalMessage());
            return ScanOptions.defaults();
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Scan state serialization failed", e);
        }
    }

    private int nullToZero(Integer value) {
        return value == null ? 0 : value;
    }
}
