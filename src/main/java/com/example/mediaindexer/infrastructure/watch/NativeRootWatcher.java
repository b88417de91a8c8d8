package com.example.mediaindexer.infrastructure.watch;

import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import com.example.mediaindexer.domain.enumtype.WatchStrategy;
import com.example.mediaindexer.domain.model.RawFileChange;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive watcher over the platform {@link WatchService}. Directories created later are
 * registered as they appear, and the files already inside them are reported as created.
 */
public class NativeRootWatcher implements RootWatcher {

    private static final Logger log = LoggerFactory.getLogger(NativeRootWatcher.class);

    private final Long rootId;
    private final Path root;
    private final RawEventSink sink;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    // last size and file key seen per file, used to describe deletes
    private final Map<Path, FileState> known = new ConcurrentHashMap<>();
    private volatile WatchService watchService;

    public NativeRootWatcher(Long rootId, Path root, RawEventSink sink) {
        this.rootId = rootId;
        this.root = root.toAbsolutePath().normalize();
        this.sink = sink;
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
        return WatchStrategy.NATIVE;
    }

    @Override
    public void open() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Root is not a directory: " + root);
        }
        WatchService service = FileSystems.getDefault().newWatchService();
        try {
            registerTree(service, root, false);
        } catch (IOException e) {
            service.close();
            throw e;
        }
        this.watchService = service;
        log.info("WATCH_NATIVE_OPENED rootId={} root={} dirs={} files={}", rootId, root, keys.size(), known.size());
    }

    @Override
    public void run() {
        WatchService service = watchService;
        if (service == null) {
            return;
        }
        try {
            while (!Thread.currentThread().isInterrupted()) {
                WatchKey key = service.take();
                Path dir = keys.get(key);
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        sink.overflow(rootId, "native overflow");
                        continue;
                    }
                    if (dir != null && event.context() instanceof Path) {
                        handle(service, event.kind(), dir.resolve((Path) event.context()));
                    }
                }
                if (!key.reset()) {
                    keys.remove(key);
                    if (root.equals(dir)) {
                        log.warn("WATCH_ROOT_GONE rootId={} root={}", rootId, root);
                        sink.overflow(rootId, "root no longer accessible");
                        return;
                    }
                }
            }
        } catch (ClosedWatchServiceException e) {
            log.debug("WATCH_NATIVE_CLOSED rootId={}", rootId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("WATCH_NATIVE_FAILED rootId={} root={}", rootId, root, e);
            sink.overflow(rootId, "watcher error: " + e.getMessage());
        }
    }

    @Override
    public void close() {
        WatchService service = watchService;
        watchService = null;
        if (service == null) {
            return;
        }
        try {
            service.close();
        } catch (IOException e) {
            log.warn("WATCH_NATIVE_CLOSE_FAILED rootId={} msg={}", rootId, e.getMessage());
        }
        keys.clear();
        known.clear();
    }

    private void handle(WatchService service, WatchEvent.Kind<?> kind, Path path) {
        if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            FileState state = known.remove(path);
            removeUnder(path);
            emit(FileChangeKind.DELETE, path, state == null ? null : state.size, state == null ? null : state.fileKey);
            return;
        }
        if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
                try {
                    registerTree(service, path, true);
                } catch (IOException e) {
                    log.warn("WATCH_REGISTER_FAILED rootId={} dir={} msg={}", rootId, path, e.getMessage());
                    sink.overflow(rootId, "directory registration failed");
                }
            }
            return;
        }
        FileState state = readState(path);
        if (state == null) {
            return;
        }
        known.put(path, state);
        FileChangeKind changeKind = kind == StandardWatchEventKinds.ENTRY_CREATE
                ? FileChangeKind.CREATE : FileChangeKind.MODIFY;
        emit(changeKind, path, state.size, state.fileKey);
    }

    private void registerTree(WatchService service, Path start, boolean reportFiles) throws IOException {
        List<Path> created = new ArrayList<>();
        Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                WatchKey key = dir.register(service,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
                keys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    known.put(file, new FileState(attrs.size(), fileKey(attrs)));
                    created.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("WATCH_VISIT_FAILED rootId={} path={} msg={}", rootId, file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        if (reportFiles) {
            for (Path file : created) {
                FileState state = known.get(file);
                emit(FileChangeKind.CREATE, file, state == null ? null : state.size,
                        state == null ? null : state.fileKey);
            }
        }
    }

    private void removeUnder(Path dir) {
        known.keySet().removeIf(path -> path.startsWith(dir));
        keys.values().removeIf(path -> path.startsWith(dir));
    }

    private void emit(FileChangeKind kind, Path path, Long size, String fileKey) {
        sink.accept(RawFileChange.builder()
                .rootId(rootId)
                .kind(kind)
                .path(path)
                .fileSize(size)
                .fileKey(fileKey)
                .detectedAt(Instant.now())
                .build());
    }

    private FileState readState(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (!attrs.isRegularFile()) {
                return null;
            }
            return new FileState(attrs.size(), fileKey(attrs));
        } catch (IOException e) {
            // gone again before we could look at it; the delete event follows
            return null;
        }
    }

    static String fileKey(BasicFileAttributes attrs) {
        Object key = attrs.fileKey();
        return key == null ? null : key.toString();
    }

    private static final class FileState {
        private final long size;
        private final String fileKey;

        private FileState(long size, String fileKey) {
            this.size = size;
            this.fileKey = fileKey;
        }
    }
}
