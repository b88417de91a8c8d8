package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import java.nio.file.Path;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A change as reported by a root watcher, before normalization.
 */
@Value
@Builder
public class RawFileChange {

    Long rootId;

    FileChangeKind kind;

    Path path;

    Path oldPath;

    Long fileSize;

    /** Filesystem file key (inode and device on POSIX) when the watcher could read it. */
    String fileKey;

    Instant detectedAt;

    /** Set by seeding jobs that want their correlation carried through. */
    String correlationId;
}
