package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.domain.enumtype.ScanReason;
import com.example.mediaindexer.domain.enumtype.ScanType;
import com.example.mediaindexer.domain.model.ScanOptions;
import com.example.mediaindexer.domain.model.ScanState;

/**
 * Walks one root, or every root of the library when {@code rootId} is null. With a {@code scanId}
 * the command drives that existing scan (fresh or resumed); without one it creates its own.
 */
public class FolderScanCommand extends PipelineCommand {

    private final Long rootId;
    private final Long scanId;
    private final ScanType scanType;
    private final ScanOptions options;
    private final ScanReason reason;

    public FolderScanCommand(Long libraryId, Long rootId, Long scanId, ScanType scanType, ScanOptions options,
                             ScanReason reason, String correlationId) {
        super(libraryId, correlationId);
        this.rootId = rootId;
        this.scanId = scanId;
        this.scanType = scanType;
        this.options = options;
        this.reason = reason;
    }

    public static FolderScanCommand maintenanceSweep(Long libraryId, Long rootId, String correlationId) {
        ScanOptions options = ScanOptions.defaults();
        options.setRootId(rootId);
        options.setCorrelationId(correlationId);
        options.setScanReason(ScanReason.MAINTENANCE_SWEEP);
        return new FolderScanCommand(libraryId, rootId, null, ScanType.FULL, options,
                ScanReason.MAINTENANCE_SWEEP, correlationId);
    }

    /**
     * Drives a scan that was already created (pending) or resumed (running).
     */
    public static FolderScanCommand forScan(ScanState scan) {
        ScanOptions options = scan.getOptions() == null ? ScanOptions.defaults() : scan.getOptions();
        ScanReason reason = options.getScanReason() == null ? ScanReason.USER_REQUESTED : options.getScanReason();
        return new FolderScanCommand(scan.getLibraryId(), options.getRootId(), scan.getId(), scan.getScanType(),
                options, reason, options.getCorrelationId());
    }

    public Long getRootId() {
        return rootId;
    }

    public Long getScanId() {
        return scanId;
    }

    public ScanType getScanType() {
        return scanType;
    }

    public ScanOptions getOptions() {
        return options;
    }

    public ScanReason getReason() {
        return reason;
    }

    @Override
    public PipelineReceipt dispatchTo(PipelineCommandHandler handler) {
        return handler.handleFolderScan(this);
    }

    @Override
    public String toString() {
        return "FolderScanCommand{libraryId=" + getLibraryId() + ", rootId=" + rootId + ", scanId=" + scanId
                + ", scanType=" + scanType + ", reason=" + reason + ", correlationId=" + getCorrelationId() + "}";
    }
}
