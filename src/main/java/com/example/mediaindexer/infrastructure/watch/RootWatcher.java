package com.example.mediaindexer.infrastructure.watch;

import com.example.mediaindexer.domain.enumtype.WatchStrategy;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Watches one library root and reports raw changes to a {@link RawEventSink}. {@link #open()} sets
 * the watcher up on the caller's thread; {@link #run()} is the blocking watch loop and returns once
 * the watcher is closed.
 */
public interface RootWatcher extends Runnable {

    Long getRootId();

    Path getRootPath();

    WatchStrategy getStrategy();

    void open() throws IOException;

    void close();
}
