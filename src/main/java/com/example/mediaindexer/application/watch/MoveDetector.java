package com.example.mediaindexer.application.watch;

import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Pairs a delete with a later create of the same file into one move.
 *
 * <p>A pair matches when both sizes are known and equal, the file keys are equal where both are
 * known, the paths differ and the create follows the delete within the window. A create takes the
 * earliest open delete that matches. The move replaces the create at its position and the delete
 * is dropped. Anything unmatched passes through unchanged.
 */
public final class MoveDetector {

    private MoveDetector() {
    }

    public static List<NormalizedChange> pair(List<NormalizedChange> changes, long windowMs) {
        if (changes == null || changes.size() < 2) {
            return changes == null ? new ArrayList<>() : new ArrayList<>(changes);
        }
        List<NormalizedChange> result = new ArrayList<>(changes);
        boolean[] consumed = new boolean[changes.size()];
        List<Integer> openDeletes = new ArrayList<>();

        for (int i = 0; i < changes.size(); i++) {
            NormalizedChange change = changes.get(i);
            if (change.getKind() == FileChangeKind.DELETE) {
                openDeletes.add(i);
                continue;
            }
            if (change.getKind() != FileChangeKind.CREATE) {
                continue;
            }
            Iterator<Integer> it = openDeletes.iterator();
            while (it.hasNext()) {
                int deleteIdx = it.next();
                NormalizedChange delete = changes.get(deleteIdx);
                if (matches(delete, change, windowMs)) {
                    it.remove();
                    consumed[deleteIdx] = true;
                    result.set(i, change.toBuilder()
                            .kind(FileChangeKind.MOVE)
                            .oldPath(delete.getPath())
                            .build());
                    break;
                }
            }
        }

        List<NormalizedChange> paired = new ArrayList<>(result.size());
        for (int i = 0; i < result.size(); i++) {
            if (!consumed[i]) {
                paired.add(result.get(i));
            }
        }
        return paired;
    }

    static boolean matches(NormalizedChange delete, NormalizedChange create, long windowMs) {
        if (delete.getFileSize() == null || create.getFileSize() == null) {
            return false;
        }
        if (!delete.getFileSize().equals(create.getFileSize())) {
            return false;
        }
        if (delete.getFileKey() != null && create.getFileKey() != null
                && !delete.getFileKey().equals(create.getFileKey())) {
            return false;
        }
        if (Objects.equals(delete.getPath(), create.getPath())) {
            return false;
        }
        if (delete.getDetectedAt() == null || create.getDetectedAt() == null) {
            return true;
        }
        long gapMs = Duration.between(delete.getDetectedAt(), create.getDetectedAt()).toMillis();
        return gapMs >= 0 && gapMs <= windowMs;
    }
}
