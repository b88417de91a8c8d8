package com.example.mediaindexer.application.watch;

import com.example.mediaindexer.common.util.HashUtil;
import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import java.time.Instant;

/**
 * Deterministic keys that collapse duplicate deliveries of the same change. Two reports of the
 * same change within one time bucket produce the same key.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String forChange(Long libraryId, Long rootId, FileChangeKind kind, String pathKey,
                                   Instant detectedAt, long bucketMs) {
        return HashUtil.shortSha256("fs", String.valueOf(libraryId), String.valueOf(rootId), kind.name(),
                pathKey, String.valueOf(bucket(detectedAt, bucketMs)));
    }

    public static String forOverflow(Long libraryId, Long rootId, Instant detectedAt, long bucketMs) {
        return HashUtil.shortSha256("fs-overflow", String.valueOf(libraryId), String.valueOf(rootId),
                String.valueOf(bucket(detectedAt, bucketMs)));
    }

    /**
     * Key for a file reached by a folder walk rather than a change event. Same path, size and
     * mtime give the same key.
     */
    public static String forScanItem(Long libraryId, String path, Long fileSize, Long mtimeMillis) {
        return HashUtil.shortSha256("scan", String.valueOf(libraryId), path,
                String.valueOf(fileSize), String.valueOf(mtimeMillis));
    }

    static long bucket(Instant detectedAt, long bucketMs) {
        long millis = detectedAt == null ? 0L : detectedAt.toEpochMilli();
        return Math.floorDiv(millis, Math.max(1L, bucketMs));
    }
}
