package com.example.mediaindexer.application.watch;

import com.example.mediaindexer.domain.model.WatchedLibrary;
import com.example.mediaindexer.infrastructure.watch.RootWatcher;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles of one registered library: its running root watchers, its flush task and the
 * maintenance correlation currently open on it.
 */
public class LibraryWatch {

    private static final Logger log = LoggerFactory.getLogger(LibraryWatch.class);

    private final WatchedLibrary library;
    private final List<RootWatcher> watchers;
    private final FlushCoalescer coalescer;
    private final AtomicReference<String> maintenanceCorrelation;

    public LibraryWatch(WatchedLibrary library, List<RootWatcher> watchers, FlushCoalescer coalescer,
                        AtomicReference<String> maintenanceCorrelation) {
        this.library = library;
        this.watchers = Collections.unmodifiableList(watchers);
        this.coalescer = coalescer;
        this.maintenanceCorrelation = maintenanceCorrelation;
    }

    public WatchedLibrary getLibrary() {
        return library;
    }

    public List<RootWatcher> getWatchers() {
        return watchers;
    }

    public FlushCoalescer getCoalescer() {
        return coalescer;
    }

    public String getMaintenanceCorrelation() {
        return maintenanceCorrelation.get();
    }

    public void openMaintenanceCorrelation(String correlationId) {
        maintenanceCorrelation.set(correlationId);
    }

    public void closeMaintenanceCorrelation(String correlationId) {
        maintenanceCorrelation.compareAndSet(correlationId, null);
    }

    /**
     * Stops detection first so nothing new arrives, then lets the flush task persist and dispatch
     * whatever it still holds.
     *
     * @return true when the flush task finished within the timeout
     */
    public boolean stop(long drainTimeoutMs) {
        for (RootWatcher watcher : watchers) {
            try {
                watcher.close();
            } catch (RuntimeException e) {
                log.warn("WATCH_ROOT_CLOSE_FAILED libraryId={} rootId={} msg={}",
                        library.getId(), watcher.getRootId(), e.getMessage());
            }
        }
        coalescer.stop();
        try {
            return coalescer.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
