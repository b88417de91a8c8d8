package com.example.mediaindexer.common.config;

import com.example.mediaindexer.domain.model.WatcherConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.watch")
public class AppWatchProperties {

    private long debounceWindowMs = 250;

    private int maxBatchEvents = 1024;

    private long pollIntervalMs = 5000;

    /**
     * Upper bound for the polling interval once a root keeps producing large diffs.
     */
    private long pollMaxIntervalMs = 60000;

    /**
     * Changes per poll tick at or above which the tick counts as busy.
     */
    private int pollBusyThreshold = 500;

    private int pollMaxDepth = 32;

    private int overflowBatchCapacity = 4096;

    private List<String> ignoredExtensions = new ArrayList<>(Arrays.asList("part", "tmp", "crdownload", "swp"));

    private long maintenanceTickIntervalMs = 60000;

    /**
     * A library whose last completed scan is older than this gets a maintenance sweep.
     */
    private long maintenanceStaleAfterMinutes = 1440;

    private long moveDetectionWindowMs = 2000;

    private long idempotencyBucketMs = 60000;

    private int persistMaxAttempts = 3;

    private int dispatchMaxAttempts = 3;

    private long retryBackoffMs = 200;

    private int replayBatchSize = 256;

    /**
     * Persisted events younger than this are left to the live path and not replayed yet.
     */
    private long replayGraceMs = 30000;

    private long drainTimeoutMs = 10000;

    /**
     * Use the polling watcher for every root, even where native notifications work.
     */
    private boolean forcePolling = false;

    private List<String> networkFilesystemTypes = new ArrayList<>(Arrays.asList(
            "nfs", "nfs4", "cifs", "smbfs", "smb2", "smb3", "fuse.sshfs", "9p", "afpfs", "webdav", "davfs"));

    public Set<String> normalizedIgnoredExtensions() {
        return normalize(ignoredExtensions, true);
    }

    public Set<String> normalizedNetworkFilesystemTypes() {
        return normalize(networkFilesystemTypes, false);
    }

    public WatcherConfig toWatcherConfig() {
        return WatcherConfig.builder()
                .debounceWindowMs(Math.max(1L, debounceWindowMs))
                .maxBatchEvents(Math.max(1, maxBatchEvents))
                .pollIntervalMs(Math.max(10L, pollIntervalMs))
                .pollMaxIntervalMs(Math.max(pollIntervalMs, pollMaxIntervalMs))
                .pollBusyThreshold(Math.max(1, pollBusyThreshold))
                .pollMaxDepth(Math.max(1, pollMaxDepth))
                .overflowBatchCapacity(Math.max(1, overflowBatchCapacity))
                .ignoredExtensions(Collections.unmodifiableSet(normalizedIgnoredExtensions()))
                .maintenanceTickIntervalMs(maintenanceTickIntervalMs)
                .moveDetectionWindowMs(Math.max(0L, moveDetectionWindowMs))
                .idempotencyBucketMs(Math.max(1L, idempotencyBucketMs))
                .persistMaxAttempts(Math.max(1, persistMaxAttempts))
                .dispatchMaxAttempts(Math.max(1, dispatchMaxAttempts))
                .retryBackoffMs(Math.max(0L, retryBackoffMs))
                .drainTimeoutMs(Math.max(0L, drainTimeoutMs))
                .forcePolling(forcePolling)
                .networkFilesystemTypes(Collections.unmodifiableSet(normalizedNetworkFilesystemTypes()))
                .build();
    }

    private static Set<String> normalize(Collection<String> values, boolean stripDot) {
        if (values == null) {
            return new LinkedHashSet<>();
        }
        return values.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT))
                .map(item -> stripDot ? item.replaceFirst("^\\.", "") : item)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
