package com.example.mediaindexer.infrastructure.watch;

import com.example.mediaindexer.domain.enumtype.WatchStrategy;
import com.example.mediaindexer.domain.model.WatcherConfig;
import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chooses how a root is watched. Network and FUSE mounts rarely deliver native notifications, so
 * they are polled.
 */
@Component
public class WatchStrategyDetector {

    private static final Logger log = LoggerFactory.getLogger(WatchStrategyDetector.class);

    public WatchStrategy detect(Path root, WatcherConfig config) {
        if (config.isForcePolling()) {
            return WatchStrategy.POLLING;
        }
        String type;
        try {
            FileStore store = Files.getFileStore(root);
            type = store.type() == null ? "" : store.type().toLowerCase(Locale.ROOT);
        } catch (IOException e) {
            log.warn("WATCH_FILESTORE_UNKNOWN root={} msg={}", root, e.getMessage());
            return WatchStrategy.POLLING;
        }
        if (config.getNetworkFilesystemTypes() != null && config.getNetworkFilesystemTypes().contains(type)) {
            log.info("WATCH_NETWORK_FILESYSTEM root={} type={}", root, type);
            return WatchStrategy.POLLING;
        }
        return WatchStrategy.NATIVE;
    }

    /**
     * Creates and opens the watcher for a root. A root whose native watcher cannot be opened is
     * polled instead.
     */
    public RootWatcher open(Long rootId, Path root, WatcherConfig config, RawEventSink sink) throws IOException {
        if (detect(root, config) == WatchStrategy.POLLING) {
            return openPolling(rootId, root, config, sink);
        }
        RootWatcher watcher = new NativeRootWatcher(rootId, root, sink);
        try {
            watcher.open();
            return watcher;
        } catch (IOException e) {
            watcher.close();
            log.warn("WATCH_NATIVE_UNAVAILABLE rootId={} root={} msg={}", rootId, root, e.getMessage());
            return openPolling(rootId, root, config, sink);
        }
    }

    private RootWatcher openPolling(Long rootId, Path root, WatcherConfig config, RawEventSink sink)
            throws IOException {
        RootWatcher watcher = new PollingRootWatcher(rootId, root, config, sink);
        watcher.open();
        return watcher;
    }
}
