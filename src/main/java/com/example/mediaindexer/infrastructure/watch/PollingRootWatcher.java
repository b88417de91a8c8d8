package com.example.mediaindexer.infrastructure.watch;

import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import com.example.mediaindexer.domain.enumtype.WatchStrategy;
import com.example.mediaindexer.domain.model.RawFileChange;
import com.example.mediaindexer.domain.model.WatcherConfig;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a root by walking it on an interval and diffing consecutive snapshots.
 *
 * <p>The interval starts at {@code pollIntervalMs}. After two consecutive ticks that each found at
 * least {@code pollBusyThreshold} changes it doubles, up to {@code pollMaxIntervalMs}. The first
 * quieter tick puts it back to the base interval.
 */
public class PollingRootWatcher implements RootWatcher {

    private static final Logger log = LoggerFactory.getLogger(PollingRootWatcher.class);

    private static final int BUSY_TICKS_BEFORE_BACKOFF = 2;

    private final Long rootId;
    private final Path root;
    private final WatcherConfig config;
    private final RawEventSink sink;

    private Map<Path, Entry> snapshot = Collections.emptyMap();
    private long currentIntervalMs;
    private int busyTicks;
    private volatile boolean running;
    private volatile Thread runner;

    public PollingRootWatcher(Long rootId, Path root, WatcherConfig config, RawEventSink sink) {
        this.rootId = rootId;
        this.root = root.toAbsolutePath().normalize();
        this.config = config;
        this.sink = sink;
        this.currentIntervalMs = config.getPollIntervalMs();
    }

    @Override
    public Long getRootId() {
        return rootId;
    }

    @Override
    public Path getRootPath() {
        return root;
    }

    @Override
    public WatchStrategy getStrategy() {
        return WatchStrategy.POLLING;
    }

    @Override
    public synchronized void open() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Root is not a directory: " + root);
        }
        snapshot = walk();
        running = true;
        log.info("WATCH_POLLING_OPENED rootId={} root={} files={} intervalMs={}",
                rootId, root, snapshot.size(), currentIntervalMs);
    }

    @Override
    public void run() {
        runner = Thread.currentThread();
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                Thread.sleep(getCurrentIntervalMs());
                if (!running) {
                    break;
                }
                try {
                    pollOnce();
                } catch (IOException e) {
                    log.warn("WATCH_POLL_FAILED rootId={} root={} msg={}", rootId, root, e.getMessage());
                    sink.overflow(rootId, "poll failed: " + e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("WATCH_POLLING_FAILED rootId={} root={}", rootId, root, e);
            sink.overflow(rootId, "watcher error: " + e.getMessage());
        } finally {
            runner = null;
        }
    }

    @Override
    public void close() {
        running = false;
        Thread thread = runner;
        if (thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Walks the root once, reports the differences against the previous walk and adjusts the
     * interval.
     *
     * @return number of changes reported
     */
    public synchronized int pollOnce() throws IOException {
        Map<Path, Entry> current = walk();
        Instant now = Instant.now();
        List<RawFileChange> deletes = new ArrayList<>();
        List<RawFileChange> others = new ArrayList<>();

        for (Map.Entry<Path, Entry> item : snapshot.entrySet()) {
            if (!current.containsKey(item.getKey())) {
                Entry gone = item.getValue();
                deletes.add(change(FileChangeKind.DELETE, item.getKey(), null, gone, now));
            }
        }
        for (Map.Entry<Path, Entry> item : current.entrySet()) {
            Entry previous = snapshot.get(item.getKey());
            Entry entry = item.getValue();
            if (previous == null) {
                RawFileChange moved = pairMove(deletes, item.getKey(), entry, now);
                others.add(moved != null ? moved : change(FileChangeKind.CREATE, item.getKey(), null, entry, now));
            } else if (previous.mtime != entry.mtime || previous.size != entry.size) {
                others.add(change(FileChangeKind.MODIFY, item.getKey(), null, entry, now));
            }
        }
        snapshot = current;

        int changes = deletes.size() + others.size();
        for (RawFileChange delete : deletes) {
            sink.accept(delete);
        }
        for (RawFileChange other : others) {
            sink.accept(other);
        }
        adjustInterval(changes);
        return changes;
    }

    public synchronized long getCurrentIntervalMs() {
        return currentIntervalMs;
    }

    private void adjustInterval(int changes) {
        if (changes >= config.getPollBusyThreshold()) {
            busyTicks++;
            if (busyTicks >= BUSY_TICKS_BEFORE_BACKOFF) {
                long next = Math.min(config.getPollMaxIntervalMs(), currentIntervalMs * 2);
                if (next != currentIntervalMs) {
                    log.info("WATCH_POLL_BACKOFF rootId={} changes={} intervalMs={}", rootId, changes, next);
                }
                currentIntervalMs = next;
            }
            return;
        }
        busyTicks = 0;
        if (currentIntervalMs != config.getPollIntervalMs()) {
            log.info("WATCH_POLL_RESET rootId={} intervalMs={}", rootId, config.getPollIntervalMs());
        }
        currentIntervalMs = config.getPollIntervalMs();
    }

    // a file key that vanished and reappeared under another name is a rename
    private RawFileChange pairMove(List<RawFileChange> deletes, Path path, Entry entry, Instant now) {
        if (entry.fileKey == null) {
            return null;
        }
        Iterator<RawFileChange> it = deletes.iterator();
        while (it.hasNext()) {
            RawFileChange delete = it.next();
            if (entry.fileKey.equals(delete.getFileKey())) {
                it.remove();
                return change(FileChangeKind.MOVE, path, delete.getPath(), entry, now);
            }
        }
        return null;
    }

    private RawFileChange change(FileChangeKind kind, Path path, Path oldPath, Entry entry, Instant now) {
        return RawFileChange.builder()
                .rootId(rootId)
                .kind(kind)
                .path(path)
                .oldPath(oldPath)
                .fileSize(entry.size)
                .fileKey(entry.fileKey)
                .detectedAt(now)
                .build();
    }

    private Map<Path, Entry> walk() throws IOException {
        Map<Path, Entry> files = new HashMap<>();
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), config.getPollMaxDepth(),
                new SimpleFileVisitor<Path>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile()) {
                            files.put(file, new Entry(attrs.lastModifiedTime().toMillis(), attrs.size(),
                                    NativeRootWatcher.fileKey(attrs)));
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        log.debug("WATCH_VISIT_FAILED rootId={} path={} msg={}", rootId, file, exc.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
        return files;
    }

    private static final class Entry {
        private final long mtime;
        private final long size;
        private final String fileKey;

        private Entry(long mtime, long size, String fileKey) {
            this.mtime = mtime;
            this.size = size;
            this.fileKey = fileKey;
        }
    }
}
