package com.example.mediaindexer.infrastructure.watch;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.mediaindexer.common.config.AppWatchProperties;
import com.example.mediaindexer.domain.enumtype.WatchStrategy;
import com.example.mediaindexer.domain.model.RawFileChange;
import com.example.mediaindexer.domain.model.WatcherConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WatchStrategyDetectorTest {

    @TempDir
    Path root;

    private final WatchStrategyDetector detector = new WatchStrategyDetector();

    @Test
    void forcedPollingWins() {
        AppWatchProperties properties = new AppWatchProperties();
        properties.setForcePolling(true);

        assertEquals(WatchStrategy.POLLING, detector.detect(root, properties.toWatcherConfig()));
    }

    @Test
    void networkFilesystemIsPolled() throws Exception {
        String type = Files.getFileStore(root).type().toLowerCase(Locale.ROOT);
        AppWatchProperties properties = new AppWatchProperties();
        properties.setNetworkFilesystemTypes(Collections.singletonList(type));

        assertEquals(WatchStrategy.POLLING, detector.detect(root, properties.toWatcherConfig()));
    }

    @Test
    void openedPollingWatcherReportsItsStrategy() throws Exception {
        AppWatchProperties properties = new AppWatchProperties();
        properties.setForcePolling(true);
        WatcherConfig config = properties.toWatcherConfig();

        RootWatcher watcher = detector.open(1L, root, config, new RawEventSink() {
            @Override
            public void accept(RawFileChange change) {
            }

            @Override
            public void overflow(Long rootId, String reason) {
            }
        });
        try {
            assertEquals(WatchStrategy.POLLING, watcher.getStrategy());
        } finally {
            watcher.close();
        }
    }
}
