package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.ScanReason;
import lombok.Data;

@Data
public class ScanOptions {

    private boolean forceRefresh = false;

    private boolean skipFileMetadata = false;

    private boolean skipMetadataProvider = false;

    private boolean retryFailed = true;

    private int maxRetries = 3;

    private int batchSize = 100;

    private int concurrentWorkers = 4;

    /** Limits a scan to one root; null means every root of the library. */
    private Long rootId;

    private String correlationId;

    private ScanReason scanReason;

    public static ScanOptions defaults() {
        return new ScanOptions();
    }

    public ScanOptions copy() {
        ScanOptions copy = new ScanOptions();
        copy.setForceRefresh(forceRefresh);
        copy.setSkipFileMetadata(skipFileMetadata);
        copy.setSkipMetadataProvider(skipMetadataProvider);
        copy.setRetryFailed(retryFailed);
        copy.setMaxRetries(maxRetries);
        copy.setBatchSize(batchSize);
        copy.setConcurrentWorkers(concurrentWorkers);
        copy.setRootId(rootId);
        copy.setCorrelationId(correlationId);
        copy.setScanReason(scanReason);
        return copy;
    }
}
