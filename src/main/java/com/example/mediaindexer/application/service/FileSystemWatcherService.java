package com.example.mediaindexer.application.service;

import com.example.mediaindexer.application.pipeline.ActorMailbox;
import com.example.mediaindexer.application.pipeline.BatchDispatcher;
import com.example.mediaindexer.application.watch.FlushCoalescer;
import com.example.mediaindexer.application.watch.LibraryWatch;
import com.example.mediaindexer.application.watch.SweepTracker;
import com.example.mediaindexer.common.config.AppWatchProperties;
import com.example.mediaindexer.common.exception.BusinessException;
import com.example.mediaindexer.common.util.MeterSupport;
import com.example.mediaindexer.common.util.TextUtil;
import com.example.mediaindexer.domain.model.LibraryRoot;
import com.example.mediaindexer.domain.model.RawFileChange;
import com.example.mediaindexer.domain.model.WatchedLibrary;
import com.example.mediaindexer.domain.model.WatcherConfig;
import com.example.mediaindexer.infrastructure.watch.RawEventSink;
import com.example.mediaindexer.infrastructure.watch.RootWatcher;
import com.example.mediaindexer.infrastructure.watch.WatchStrategyDetector;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Registry of watched libraries. Each registered library runs one detection task per root and one
 * flush task, all on the watch executor.
 */
@Service
public class FileSystemWatcherService {

    private static final Logger log = LoggerFactory.getLogger(FileSystemWatcherService.class);

    private final DurableEventLog durableEventLog;
    private final BatchDispatcher batchDispatcher;
    private final ActorMailbox actorMailbox;
    private final SweepTracker sweepTracker;
    private final WatchStrategyDetector watchStrategyDetector;
    private final ExecutorService watchTaskExecutor;
    private final ObjectProvider<MeterRegistry> meterRegistryProvider;
    private final WatcherConfig watcherConfig;
    private final Map<Long, LibraryWatch> registry = new ConcurrentHashMap<>();

    public FileSystemWatcherService(DurableEventLog durableEventLog,
                                    BatchDispatcher batchDispatcher,
                                    ActorMailbox actorMailbox,
                                    SweepTracker sweepTracker,
                                    WatchStrategyDetector watchStrategyDetector,
                                    AppWatchProperties appWatchProperties,
                                    @Qualifier("watchTaskExecutor") ExecutorService watchTaskExecutor,
                                    ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.durableEventLog = durableEventLog;
        this.batchDispatcher = batchDispatcher;
        this.actorMailbox = actorMailbox;
        this.sweepTracker = sweepTracker;
        this.watchStrategyDetector = watchStrategyDetector;
        this.watchTaskExecutor = watchTaskExecutor;
        this.meterRegistryProvider = meterRegistryProvider;
        this.watcherConfig = appWatchProperties.toWatcherConfig();
    }

    /**
     * Starts watching every root of the library. Calling it again for a registered library does
     * nothing. Roots that cannot be watched are logged and skipped.
     *
     * @throws BusinessException with code {@code WATCH_INIT_FAILED} when no root could be watched
     */
    public synchronized void registerLibrary(WatchedLibrary library) {
        if (library == null || library.getId() == null) {
            throw new BusinessException("400", "Library is required");
        }
        Long libraryId = library.getId();
        if (registry.containsKey(libraryId)) {
            log.debug("WATCH_ALREADY_REGISTERED libraryId={}", libraryId);
            return;
        }
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable();
        AtomicReference<String> maintenanceCorrelation = new AtomicReference<>();
        RelaySink relay = new RelaySink();

        List<RootWatcher> opened = new ArrayList<>();
        Map<Long, Path> rootPaths = new LinkedHashMap<>();
        List<LibraryRoot> roots = library.getRoots() == null ? new ArrayList<>() : library.getRoots();
        for (LibraryRoot root : roots) {
            if (!TextUtil.hasText(root.getPath())) {
                log.warn("WATCH_ROOT_SKIPPED libraryId={} rootId={} reason=empty path", libraryId, root.getId());
                continue;
            }
            try {
                Path path = Paths.get(root.getPath()).toAbsolutePath().normalize();
                RootWatcher watcher = watchStrategyDetector.open(root.getId(), path, watcherConfig, relay);
                opened.add(watcher);
                rootPaths.put(root.getId(), path);
                log.info("WATCH_ROOT_STARTED libraryId={} rootId={} root={} strategy={}",
                        libraryId, root.getId(), path, watcher.getStrategy());
            } catch (IOException | InvalidPathException e) {
                log.warn("WATCH_ROOT_FAILED libraryId={} rootId={} path={} msg={}",
                        libraryId, root.getId(), root.getPath(), e.getMessage());
                MeterSupport.incrementCounter(meterRegistry, "media.watch.root.failed", 1);
            }
        }
        if (opened.isEmpty()) {
            log.error("WATCH_INIT_FAILED libraryId={} roots={}", libraryId, roots.size());
            throw new BusinessException("WATCH_INIT_FAILED", "No root of library " + libraryId + " could be watched");
        }

        FlushCoalescer coalescer = new FlushCoalescer(libraryId, rootPaths, watcherConfig, durableEventLog,
                batchDispatcher, actorMailbox, sweepTracker, maintenanceCorrelation::get, meterRegistry);
        relay.target = coalescer;
        List<RootWatcher> started = new ArrayList<>();
        try {
            watchTaskExecutor.execute(coalescer);
            for (RootWatcher watcher : opened) {
                watchTaskExecutor.execute(watcher);
                started.add(watcher);
            }
        } catch (RejectedExecutionException e) {
            for (RootWatcher watcher : opened) {
                watcher.close();
            }
            coalescer.stop();
            throw new BusinessException("WATCH_INIT_FAILED", "Watch executor rejected library " + libraryId, e);
        }
        registry.put(libraryId, new LibraryWatch(library, started, coalescer, maintenanceCorrelation));
        log.info("WATCH_LIBRARY_REGISTERED libraryId={} name={} roots={}/{}",
                libraryId, library.getName(), started.size(), roots.size());
    }

    /**
     * Stops watching the library. Changes already received are persisted and dispatched before the
     * flush task exits.
     */
    public void unregisterLibrary(Long libraryId) {
        LibraryWatch watch;
        synchronized (this) {
            watch = registry.remove(libraryId);
        }
        if (watch == null) {
            return;
        }
        boolean drained = watch.stop(watcherConfig.getDrainTimeoutMs());
        sweepTracker.forgetLibrary(libraryId);
        if (drained) {
            log.info("WATCH_LIBRARY_UNREGISTERED libraryId={}", libraryId);
        } else {
            log.warn("WATCH_DRAIN_TIMEOUT libraryId={} timeoutMs={}", libraryId, watcherConfig.getDrainTimeoutMs());
        }
    }

    @PreDestroy
    public void shutdown() {
        for (Long libraryId : new ArrayList<>(registry.keySet())) {
            unregisterLibrary(libraryId);
        }
    }

    public boolean isRegistered(Long libraryId) {
        return registry.containsKey(libraryId);
    }

    public Set<Long> registeredLibraryIds() {
        return new TreeSet<>(registry.keySet());
    }

    public WatchedLibrary getRegisteredLibrary(Long libraryId) {
        LibraryWatch watch = registry.get(libraryId);
        return watch == null ? null : watch.getLibrary();
    }

    public int activeRootCount(Long libraryId) {
        LibraryWatch watch = registry.get(libraryId);
        return watch == null ? 0 : watch.getWatchers().size();
    }

    public void openMaintenanceCorrelation(Long libraryId, String correlationId) {
        LibraryWatch watch = registry.get(libraryId);
        if (watch != null) {
            watch.openMaintenanceCorrelation(correlationId);
        }
    }

    public void closeMaintenanceCorrelation(Long libraryId, String correlationId) {
        LibraryWatch watch = registry.get(libraryId);
        if (watch != null) {
            watch.closeMaintenanceCorrelation(correlationId);
        }
    }

    public WatcherConfig getWatcherConfig() {
        return watcherConfig;
    }

    /**
     * Watchers are opened before the flush task exists; the relay forwards to it once it does.
     * Nothing is delivered before {@link #registerLibrary} sets the target because watchers only
     * start running afterwards.
     */
    private static final class RelaySink implements RawEventSink {

        private volatile FlushCoalescer target;

        @Override
        public void accept(RawFileChange change) {
            FlushCoalescer coalescer = target;
            if (coalescer != null) {
                coalescer.accept(change);
            }
        }

        @Override
        public void overflow(Long rootId, String reason) {
            FlushCoalescer coalescer = target;
            if (coalescer != null) {
                coalescer.overflow(rootId, reason);
            }
        }
    }
}
