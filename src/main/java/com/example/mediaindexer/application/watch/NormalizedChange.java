package com.example.mediaindexer.application.watch;

import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import java.nio.file.Path;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A raw change after path resolution and filtering, before it gets its idempotency key.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedChange {

    FileChangeKind kind;

    Path path;

    Path oldPath;

    Long fileSize;

    String fileKey;

    Instant detectedAt;
}
