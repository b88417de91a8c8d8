package com.example.mediaindexer.application.job;

import com.example.mediaindexer.application.pipeline.ActorMailbox;
import com.example.mediaindexer.application.pipeline.BatchDispatcher;
import com.example.mediaindexer.application.pipeline.FolderScanCommand;
import com.example.mediaindexer.application.pipeline.PipelineReceipt;
import com.example.mediaindexer.application.service.DurableEventLog;
import com.example.mediaindexer.application.service.FileSystemWatcherService;
import com.example.mediaindexer.application.service.ScanOrchestrator;
import com.example.mediaindexer.application.watch.SweepTracker;
import com.example.mediaindexer.common.config.AppWatchProperties;
import com.example.mediaindexer.common.util.MeterSupport;
import com.example.mediaindexer.domain.enumtype.ScanReason;
import com.example.mediaindexer.domain.enumtype.ScanStatus;
import com.example.mediaindexer.domain.enumtype.SweepTrigger;
import com.example.mediaindexer.domain.model.DurableEvent;
import com.example.mediaindexer.domain.model.LibraryRoot;
import com.example.mediaindexer.domain.model.ScanState;
import com.example.mediaindexer.domain.model.WatchedLibrary;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic safety net behind the live watchers. Each tick, per registered library:
 * <ol>
 *     <li>marks every root stale when the library has gone too long without a completed scan;</li>
 *     <li>queues a maintenance sweep for each stale root;</li>
 *     <li>replays persisted events the pipeline has not acknowledged yet.</li>
 * </ol>
 * Everything one tick sends for a library shares a single correlation id, which the library's
 * live flushes also adopt while the tick runs.
 */
@Component
public class MaintenanceSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceSweepScheduler.class);

    private final FileSystemWatcherService fileSystemWatcherService;
    private final SweepTracker sweepTracker;
    private final ScanOrchestrator scanOrchestrator;
    private final DurableEventLog durableEventLog;
    private final BatchDispatcher batchDispatcher;
    private final ActorMailbox actorMailbox;
    private final AppWatchProperties appWatchProperties;
    private final ObjectProvider<MeterRegistry> meterRegistryProvider;
    private final ConcurrentMap<Long, ConcurrentMap<Long, Instant>> replayedAt = new ConcurrentHashMap<>();
    private Clock clock = Clock.systemDefaultZone();

    public MaintenanceSweepScheduler(FileSystemWatcherService fileSystemWatcherService,
                                     SweepTracker sweepTracker,
                                     ScanOrchestrator scanOrchestrator,
                                     DurableEventLog durableEventLog,
                                     BatchDispatcher batchDispatcher,
                                     ActorMailbox actorMailbox,
                                     AppWatchProperties appWatchProperties,
                                     ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.fileSystemWatcherService = fileSystemWatcherService;
        this.sweepTracker = sweepTracker;
        this.scanOrchestrator = scanOrchestrator;
        this.durableEventLog = durableEventLog;
        this.batchDispatcher = batchDispatcher;
        this.actorMailbox = actorMailbox;
        this.appWatchProperties = appWatchProperties;
        this.meterRegistryProvider = meterRegistryProvider;
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.watch.maintenance-tick-interval-ms:60000}",
            initialDelayString = "${app.watch.maintenance-tick-interval-ms:60000}")
    public void tick() {
        for (Long libraryId : fileSystemWatcherService.registeredLibraryIds()) {
            WatchedLibrary library = fileSystemWatcherService.getRegisteredLibrary(libraryId);
            if (library == null) {
                continue;
            }
            try {
                tickLibrary(library);
            } catch (Exception e) {
                log.error("MAINTENANCE_TICK_FAILED libraryId={}", libraryId, e);
                MeterSupport.incrementCounter(meterRegistry(), "media.watch.maintenance.failed", 1);
            }
        }
    }

    void tickLibrary(WatchedLibrary library) {
        Long libraryId = library.getId();
        String correlationId = UUID.randomUUID().toString();
        fileSystemWatcherService.openMaintenanceCorrelation(libraryId, correlationId);
        try {
            if (isLibraryStale(libraryId)) {
                List<Long> rootIds = new ArrayList<>();
                for (LibraryRoot root : library.getRoots()) {
                    rootIds.add(root.getId());
                }
                sweepTracker.markLibraryStale(libraryId, rootIds, SweepTrigger.STALE);
            }
            int swept = sweepStaleRoots(library, correlationId);
            int replayed = replay(libraryId);
            if (swept > 0 || replayed > 0) {
                log.info("MAINTENANCE_TICK libraryId={} sweptRoots={} replayedEvents={} correlationId={}",
                        libraryId, swept, replayed, correlationId);
            }
        } finally {
            fileSystemWatcherService.closeMaintenanceCorrelation(libraryId, correlationId);
        }
    }

    /**
     * A library is stale when no scan is pending or running and its last completed scan is missing
     * or older than the configured age. Paused scans do not count: they wait for an explicit resume.
     */
    boolean isLibraryStale(Long libraryId) {
        for (ScanState active : scanOrchestrator.getActiveScans(libraryId)) {
            if (active.getStatus() != ScanStatus.PAUSED) {
                return false;
            }
        }
        ScanState completed = scanOrchestrator.getLatestCompletedScan(libraryId);
        if (completed == null || completed.getCompletedAt() == null) {
            return true;
        }
        LocalDateTime threshold = LocalDateTime.now(clock)
                .minusMinutes(appWatchProperties.getMaintenanceStaleAfterMinutes());
        return completed.getCompletedAt().isBefore(threshold);
    }

    private int sweepStaleRoots(WatchedLibrary library, String correlationId) {
        int swept = 0;
        for (Map.Entry<Long, SweepTrigger> entry : sweepTracker.staleRoots(library.getId()).entrySet()) {
            Long rootId = entry.getKey();
            if (library.findRoot(rootId) == null) {
                sweepTracker.clearRoot(library.getId(), rootId, entry.getValue());
                continue;
            }
            CompletableFuture<PipelineReceipt> future = actorMailbox.send(
                    FolderScanCommand.maintenanceSweep(library.getId(), rootId, correlationId));
            if (future.isCompletedExceptionally()) {
                log.warn("MAINTENANCE_SWEEP_REJECTED libraryId={} rootId={} trigger={}",
                        library.getId(), rootId, entry.getValue());
                continue;
            }
            sweepTracker.clearRoot(library.getId(), rootId, entry.getValue());
            swept++;
            log.info("MAINTENANCE_SWEEP_QUEUED libraryId={} rootId={} trigger={} correlationId={}",
                    library.getId(), rootId, entry.getValue(), correlationId);
            MeterSupport.incrementCounter(meterRegistry(), "media.watch.maintenance.sweeps", 1,
                    "trigger", entry.getValue().name());
        }
        return swept;
    }

    /**
     * Re-dispatches unacknowledged events older than the replay grace period, grouped into
     * batches of consecutive events sharing root and correlation id. An event replayed less than
     * a grace period ago is left to its in-flight batch.
     */
    private int replay(Long libraryId) {
        long cursor = durableEventLog.cursor(libraryId);
        Instant now = clock.instant();
        Instant detectedBefore = now.minusMillis(appWatchProperties.getReplayGraceMs());
        ConcurrentMap<Long, Instant> replayed = replayedAt.computeIfAbsent(libraryId, id -> new ConcurrentHashMap<>());
        replayed.keySet().removeIf(seq -> seq <= cursor);
        List<DurableEvent> events = durableEventLog.fetchAfter(libraryId, cursor, detectedBefore,
                appWatchProperties.getReplayBatchSize());
        if (events.isEmpty()) {
            return 0;
        }

        int sent = 0;
        List<DurableEvent> group = new ArrayList<>();
        for (DurableEvent event : events) {
            Instant last = replayed.get(event.getSeq());
            if (last != null && last.isAfter(detectedBefore)) {
                continue;
            }
            if (!group.isEmpty() && !sameGroup(group.get(0), event)) {
                if (!dispatchReplay(libraryId, group)) {
                    return sent;
                }
                sent += group.size();
                group = new ArrayList<>();
            }
            group.add(event);
        }
        if (!group.isEmpty() && dispatchReplay(libraryId, group)) {
            sent += group.size();
        }
        return sent;
    }

    private boolean dispatchReplay(Long libraryId, List<DurableEvent> group) {
        DurableEvent first = group.get(0);
        DurableEvent last = group.get(group.size() - 1);
        CompletableFuture<PipelineReceipt> future = batchDispatcher.dispatchBatch(actorMailbox, libraryId,
                first.getRootId(), group, ScanReason.MAINTENANCE_SWEEP);
        if (future.isCompletedExceptionally()) {
            log.warn("MAINTENANCE_REPLAY_REJECTED libraryId={} rootId={} firstSeq={}",
                    libraryId, first.getRootId(), first.getSeq());
            return false;
        }
        Instant now = clock.instant();
        ConcurrentMap<Long, Instant> replayed = replayedAt.computeIfAbsent(libraryId, id -> new ConcurrentHashMap<>());
        for (DurableEvent event : group) {
            replayed.put(event.getSeq(), now);
        }
        log.info("MAINTENANCE_REPLAY libraryId={} rootId={} events={} firstSeq={} lastSeq={} correlationId={}",
                libraryId, first.getRootId(), group.size(), first.getSeq(), last.getSeq(), first.getCorrelationId());
        MeterSupport.incrementCounter(meterRegistry(), "media.watch.maintenance.replayed", group.size());
        return true;
    }

    private boolean sameGroup(DurableEvent head, DurableEvent event) {
        return Objects.equals(head.getRootId(), event.getRootId())
                && Objects.equals(head.getCorrelationId(), event.getCorrelationId());
    }

    private MeterRegistry meterRegistry() {
        return meterRegistryProvider.getIfAvailable();
    }
}
