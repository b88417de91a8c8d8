package com.example.mediaindexer.domain.enumtype;

/**
 * Why a scan or pipeline command was issued.
 */
public enum ScanReason {
    HOT_CHANGE,
    USER_REQUESTED,
    BULK_SEED,
    MAINTENANCE_SWEEP,
    WATCHER_OVERFLOW
}
