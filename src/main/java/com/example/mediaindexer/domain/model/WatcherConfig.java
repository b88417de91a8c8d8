package com.example.mediaindexer.domain.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Watcher tuning captured once when the watcher service is built. Never changes afterwards.
 */
@Value
@Builder
public class WatcherConfig {

    long debounceWindowMs;

    int maxBatchEvents;

    long pollIntervalMs;

    long pollMaxIntervalMs;

    int pollBusyThreshold;

    int pollMaxDepth;

    int overflowBatchCapacity;

    Set<String> ignoredExtensions;

    long maintenanceTickIntervalMs;

    long moveDetectionWindowMs;

    long idempotencyBucketMs;

    int persistMaxAttempts;

    int dispatchMaxAttempts;

    long retryBackoffMs;

    long drainTimeoutMs;

    boolean forcePolling;

    Set<String> networkFilesystemTypes;

    public boolean isIgnored(Path path) {
        if (path == null || ignoredExtensions == null || ignoredExtensions.isEmpty()) {
            return false;
        }
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return ignoredExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
