package com.example.mediaindexer.application.service;

import com.example.mediaindexer.application.pipeline.ActorMailbox;
import com.example.mediaindexer.application.pipeline.FolderScanCommand;
import com.example.mediaindexer.common.exception.BusinessException;
import com.example.mediaindexer.domain.enumtype.ScanReason;
import com.example.mediaindexer.domain.enumtype.ScanType;
import com.example.mediaindexer.domain.model.ScanOptions;
import com.example.mediaindexer.domain.model.ScanState;
import com.example.mediaindexer.infrastructure.persistence.entity.LibraryEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.LibraryMapper;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for user-requested scans. Creates the scan record and hands the walk to the
 * pipeline mailbox; the caller gets the pending scan back immediately.
 */
@Service
public class ScanControlService {

    private static final Logger log = LoggerFactory.getLogger(ScanControlService.class);

    private final ScanOrchestrator scanOrchestrator;
    private final LibraryMapper libraryMapper;
    private final ActorMailbox actorMailbox;

    public ScanControlService(ScanOrchestrator scanOrchestrator,
                              LibraryMapper libraryMapper,
                              ActorMailbox actorMailbox) {
        this.scanOrchestrator = scanOrchestrator;
        this.libraryMapper = libraryMapper;
        this.actorMailbox = actorMailbox;
    }

    /**
     * @throws BusinessException 404 when the library does not exist, 409 when a non-incremental
     *                           scan of the library is still active
     */
    public ScanState requestScan(Long libraryId, ScanType scanType, ScanOptions options) {
        if (libraryId == null || scanType == null) {
            throw new BusinessException("400", "libraryId and scanType are required");
        }
        LibraryEntity library = libraryMapper.selectById(libraryId);
        if (library == null) {
            throw new BusinessException("404", "Library not found: " + libraryId);
        }
        List<ScanState> active = scanOrchestrator.getActiveScans(libraryId);
        for (ScanState scan : active) {
            if (scan.getScanType() != ScanType.INCREMENTAL) {
                throw new BusinessException("409", "Library " + libraryId + " already has active scan " + scan.getId(),
                        "Wait for the running scan to finish or cancel it");
            }
        }

        ScanOptions effective = options == null ? ScanOptions.defaults() : options.copy();
        if (effective.getScanReason() == null) {
            effective.setScanReason(ScanReason.USER_REQUESTED);
        }
        if (effective.getCorrelationId() == null) {
            effective.setCorrelationId(UUID.randomUUID().toString());
        }
        ScanState scan = scanOrchestrator.createScan(libraryId, scanType, effective);
        send(scan);
        log.info("SCAN_REQUESTED scanId={} libraryId={} libraryName={} type={} rootId={}",
                scan.getId(), libraryId, library.getName(), scanType, effective.getRootId());
        return scan;
    }

    /**
     * Resumes a paused scan and queues its walk again.
     *
     * @throws BusinessException 404 when the scan does not exist, 409 when it is not paused
     */
    public ScanState resumeScan(Long scanId) {
        ScanState scan = scanOrchestrator.resumeScan(scanId);
        if (scan == null) {
            throw rejected(scanId, "resume");
        }
        send(scan);
        return scan;
    }

    /**
     * @throws BusinessException 404 when the scan does not exist, 409 when it is not running
     */
    public ScanState pauseScan(Long scanId) {
        if (!scanOrchestrator.pauseScan(scanId)) {
            throw rejected(scanId, "pause");
        }
        return scanOrchestrator.getScan(scanId);
    }

    /**
     * @throws BusinessException 404 when the scan does not exist, 409 when it already finished
     */
    public ScanState cancelScan(Long scanId) {
        if (!scanOrchestrator.cancelScan(scanId)) {
            throw rejected(scanId, "cancel");
        }
        return scanOrchestrator.getScan(scanId);
    }

    public ScanState getScan(Long scanId) {
        ScanState scan = scanOrchestrator.getScan(scanId);
        if (scan == null) {
            throw new BusinessException("404", "Scan not found: " + scanId);
        }
        return scan;
    }

    private BusinessException rejected(Long scanId, String action) {
        ScanState current = scanOrchestrator.getScan(scanId);
        String status = current == null ? "missing" : current.getStatus().name();
        return new BusinessException("409", "Cannot " + action + " scan " + scanId + " while it is " + status);
    }

    private void send(ScanState scan) {
        actorMailbox.send(FolderScanCommand.forScan(scan)).whenComplete((receipt, error) -> {
            if (error != null) {
                log.warn("SCAN_COMMAND_FAILED scanId={} libraryId={} msg={}",
                        scan.getId(), scan.getLibraryId(), error.getMessage());
                scanOrchestrator.failScan(scan.getId(), "pipeline rejected scan: " + error.getMessage());
            }
        });
    }
}
