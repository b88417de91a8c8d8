package com.example.mediaindexer.application.watch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class MoveDetectorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void deleteThenCreateWithSameSizeShouldBecomeMove() {
        List<NormalizedChange> paired = MoveDetector.pair(Arrays.asList(
                change(FileChangeKind.DELETE, "/m/old/Alien.mkv", 700L, "ino-1", 0),
                change(FileChangeKind.CREATE, "/m/new/Alien.mkv", 700L, "ino-1", 300)), 2000);

        assertEquals(1, paired.size());
        assertEquals(FileChangeKind.MOVE, paired.get(0).getKind());
        assertEquals(path("/m/new/Alien.mkv"), paired.get(0).getPath());
        assertEquals(path("/m/old/Alien.mkv"), paired.get(0).getOldPath());
    }

    @Test
    void differentFileKeysShouldStayIndependent() {
        List<NormalizedChange> paired = MoveDetector.pair(Arrays.asList(
                change(FileChangeKind.DELETE, "/m/a.mkv", 700L, "ino-1", 0),
                change(FileChangeKind.CREATE, "/m/b.mkv", 700L, "ino-2", 10)), 2000);

        assertEquals(2, paired.size());
        assertEquals(FileChangeKind.DELETE, paired.get(0).getKind());
        assertEquals(FileChangeKind.CREATE, paired.get(1).getKind());
    }

    @Test
    void createOutsideWindowShouldStayIndependent() {
        List<NormalizedChange> paired = MoveDetector.pair(Arrays.asList(
                change(FileChangeKind.DELETE, "/m/a.mkv", 700L, null, 0),
                change(FileChangeKind.CREATE, "/m/b.mkv", 700L, null, 5000)), 2000);

        assertEquals(2, paired.size());
        assertNull(paired.get(1).getOldPath());
    }

    @Test
    void unknownSizeShouldNeverPair() {
        List<NormalizedChange> paired = MoveDetector.pair(Arrays.asList(
                change(FileChangeKind.DELETE, "/m/a.mkv", null, null, 0),
                change(FileChangeKind.CREATE, "/m/b.mkv", 700L, null, 10)), 2000);

        assertEquals(2, paired.size());
    }

    @Test
    void createShouldTakeEarliestMatchingDelete() {
        List<NormalizedChange> paired = MoveDetector.pair(Arrays.asList(
                change(FileChangeKind.DELETE, "/m/first.mkv", 700L, null, 0),
                change(FileChangeKind.DELETE, "/m/second.mkv", 700L, null, 100),
                change(FileChangeKind.CREATE, "/m/target.mkv", 700L, null, 200)), 2000);

        assertEquals(2, paired.size());
        assertEquals(path("/m/second.mkv"), paired.get(0).getPath());
        assertEquals(FileChangeKind.DELETE, paired.get(0).getKind());
        assertEquals(FileChangeKind.MOVE, paired.get(1).getKind());
        assertEquals(path("/m/first.mkv"), paired.get(1).getOldPath());
    }

    private NormalizedChange change(FileChangeKind kind, String path, Long size, String fileKey, long offsetMs) {
        return NormalizedChange.builder()
                .kind(kind)
                .path(path(path))
                .fileSize(size)
                .fileKey(fileKey)
                .detectedAt(T0.plusMillis(offsetMs))
                .build();
    }

    private Path path(String value) {
        return Paths.get(value);
    }
}
