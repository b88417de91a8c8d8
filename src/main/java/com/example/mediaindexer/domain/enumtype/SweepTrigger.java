package com.example.mediaindexer.domain.enumtype;

/**
 * What caused a root to be queued for a maintenance sweep.
 */
public enum SweepTrigger {
    STALE,
    OVERFLOW,
    WATCHER_ERROR,
    PERSIST_FAILED,
    DISPATCH_FAILED,
    PIPELINE_FAILED
}
