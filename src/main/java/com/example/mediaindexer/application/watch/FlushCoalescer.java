package com.example.mediaindexer.application.watch;

import com.example.mediaindexer.application.pipeline.ActorMailbox;
import com.example.mediaindexer.application.pipeline.BatchDispatcher;
import com.example.mediaindexer.application.pipeline.PipelineReceipt;
import com.example.mediaindexer.application.service.DurableEventLog;
import com.example.mediaindexer.common.util.MeterSupport;
import com.example.mediaindexer.common.util.TextUtil;
import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import com.example.mediaindexer.domain.enumtype.ScanReason;
import com.example.mediaindexer.domain.enumtype.SweepTrigger;
import com.example.mediaindexer.domain.model.DurableEvent;
import com.example.mediaindexer.domain.model.RawFileChange;
import com.example.mediaindexer.domain.model.WatcherConfig;
import com.example.mediaindexer.infrastructure.watch.RawEventSink;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-library flush task. Watchers push raw changes into a bounded queue; the task run by
 * {@link #run()} is the only reader of that queue and the only owner of the pending buffer.
 *
 * <p>The task blocks while nothing is pending. Once something is pending it waits for the
 * debounce window to pass without new changes, then flushes every root. A root whose pending list
 * reaches the batch limit is flushed at once. Overflow skips the debounce: the root's pending
 * changes are flushed, then a synthetic overflow event is persisted and dispatched and the root
 * is queued for a maintenance sweep.
 *
 * <p>Each flushed batch is persisted to the {@link DurableEventLog} before it is dispatched.
 */
public class FlushCoalescer implements RawEventSink, Runnable {

    private static final Logger log = LoggerFactory.getLogger(FlushCoalescer.class);

    private static final RawFileChange WAKE = RawFileChange.builder().build();
    private static final RawFileChange STOP = RawFileChange.builder().build();

    private final Long libraryId;
    private final Map<Long, Path> rootPaths;
    private final WatcherConfig config;
    private final DurableEventLog eventLog;
    private final BatchDispatcher batchDispatcher;
    private final ActorMailbox mailbox;
    private final SweepTracker sweepTracker;
    private final Supplier<String> maintenanceCorrelation;
    private final MeterRegistry meterRegistry;

    private final BlockingQueue<RawFileChange> queue;
    private final Set<Long> overflowedRoots = ConcurrentHashMap.newKeySet();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean running = true;

    // flush thread only
    private final Map<Long, List<RawFileChange>> pending = new LinkedHashMap<>();
    private long lastEventNanos;

    public FlushCoalescer(Long libraryId,
                          Map<Long, Path> rootPaths,
                          WatcherConfig config,
                          DurableEventLog eventLog,
                          BatchDispatcher batchDispatcher,
                          ActorMailbox mailbox,
                          SweepTracker sweepTracker,
                          Supplier<String> maintenanceCorrelation,
                          MeterRegistry meterRegistry) {
        this.libraryId = libraryId;
        Map<Long, Path> normalizedRoots = new LinkedHashMap<>();
        for (Map.Entry<Long, Path> entry : rootPaths.entrySet()) {
            normalizedRoots.put(entry.getKey(), entry.getValue().toAbsolutePath().normalize());
        }
        this.rootPaths = Collections.unmodifiableMap(normalizedRoots);
        this.config = config;
        this.eventLog = eventLog;
        this.batchDispatcher = batchDispatcher;
        this.mailbox = mailbox;
        this.sweepTracker = sweepTracker;
        this.maintenanceCorrelation = maintenanceCorrelation;
        this.meterRegistry = meterRegistry;
        this.queue = new ArrayBlockingQueue<>(config.getOverflowBatchCapacity());
    }

    @Override
    public void accept(RawFileChange change) {
        if (change == null) {
            return;
        }
        if (!queue.offer(change)) {
            if (overflowedRoots.add(change.getRootId())) {
                log.warn("WATCH_QUEUE_FULL libraryId={} rootId={} capacity={}",
                        libraryId, change.getRootId(), config.getOverflowBatchCapacity());
            }
            MeterSupport.incrementCounter(meterRegistry, "media.watch.queue.overflow", 1);
        }
    }

    @Override
    public void overflow(Long rootId, String reason) {
        log.warn("WATCH_OVERFLOW libraryId={} rootId={} reason={}", libraryId, rootId, reason);
        overflowedRoots.add(rootId);
        queue.offer(WAKE);
    }

    @Override
    public void run() {
        log.info("WATCH_FLUSH_TASK_STARTED libraryId={} roots={} debounceMs={} maxBatch={}",
                libraryId, rootPaths.keySet(), config.getDebounceWindowMs(), config.getMaxBatchEvents());
        try {
            while (running) {
                RawFileChange next = awaitNext();
                if (next == STOP) {
                    break;
                }
                if (next != null && next != WAKE) {
                    buffer(next);
                }
                handleOverflows();
                if (next == null) {
                    flushAll();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("WATCH_FLUSH_TASK_INTERRUPTED libraryId={}", libraryId);
        } catch (RuntimeException e) {
            log.error("WATCH_FLUSH_TASK_FAILED libraryId={}", libraryId, e);
            sweepTracker.markLibraryStale(libraryId, rootPaths.keySet(), SweepTrigger.WATCHER_ERROR);
        } finally {
            drain();
            finished.countDown();
        }
    }

    /**
     * Asks the task to finish. Everything already queued or pending is flushed before it exits.
     */
    public void stop() {
        running = false;
        queue.offer(STOP);
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    public Long getLibraryId() {
        return libraryId;
    }

    private RawFileChange awaitNext() throws InterruptedException {
        if (pending.isEmpty()) {
            return queue.take();
        }
        long debounceNanos = TimeUnit.MILLISECONDS.toNanos(config.getDebounceWindowMs());
        long remaining = debounceNanos - (System.nanoTime() - lastEventNanos);
        if (remaining <= 0) {
            return null;
        }
        return queue.poll(remaining, TimeUnit.NANOSECONDS);
    }

    private void buffer(RawFileChange change) {
        if (!rootPaths.containsKey(change.getRootId())) {
            log.debug("WATCH_EVENT_UNKNOWN_ROOT libraryId={} rootId={} path={}",
                    libraryId, change.getRootId(), change.getPath());
            return;
        }
        if (change.getKind() == FileChangeKind.OVERFLOW) {
            overflowedRoots.add(change.getRootId());
            return;
        }
        List<RawFileChange> rootPending = pending.computeIfAbsent(change.getRootId(), key -> new ArrayList<>());
        rootPending.add(change);
        lastEventNanos = System.nanoTime();
        if (rootPending.size() >= config.getMaxBatchEvents()) {
            flushRoot(change.getRootId());
        }
    }

    private void handleOverflows() {
        if (overflowedRoots.isEmpty()) {
            return;
        }
        for (Long rootId : new ArrayList<>(overflowedRoots)) {
            overflowedRoots.remove(rootId);
            if (!rootPaths.containsKey(rootId)) {
                continue;
            }
            flushRoot(rootId);
            emitOverflow(rootId);
        }
    }

    private void emitOverflow(Long rootId) {
        Instant now = Instant.now();
        DurableEvent overflow = DurableEvent.builder()
                .libraryId(libraryId)
                .rootId(rootId)
                .kind(FileChangeKind.OVERFLOW)
                .path(rootPaths.get(rootId).toString())
                .detectedAt(now)
                .correlationId(resolveCorrelation(null))
                .idempotencyKey(IdempotencyKeys.forOverflow(libraryId, rootId, now, config.getIdempotencyBucketMs()))
                .build();
        MeterSupport.incrementCounter(meterRegistry, "media.watch.overflow", 1);
        sweepTracker.markRootStale(libraryId, rootId, SweepTrigger.OVERFLOW);
        persistAndDispatch(rootId, Collections.singletonList(overflow), ScanReason.WATCHER_OVERFLOW);
    }

    private void flushAll() {
        for (Long rootId : new ArrayList<>(pending.keySet())) {
            flushRoot(rootId);
        }
    }

    private void flushRoot(Long rootId) {
        List<RawFileChange> raw = pending.remove(rootId);
        if (raw == null || raw.isEmpty()) {
            return;
        }
        List<DurableEvent> events = normalize(rootId, raw);
        if (events.isEmpty()) {
            log.debug("WATCH_FLUSH_EMPTY libraryId={} rootId={} raw={}", libraryId, rootId, raw.size());
            return;
        }
        persistAndDispatch(rootId, events, ScanReason.HOT_CHANGE);
    }

    List<DurableEvent> normalize(Long rootId, List<RawFileChange> raw) {
        Path root = rootPaths.get(rootId);
        String carriedCorrelation = null;
        int ignored = 0;
        List<NormalizedChange> changes = new ArrayList<>(raw.size());
        for (RawFileChange change : raw) {
            if (carriedCorrelation == null && TextUtil.hasText(change.getCorrelationId())) {
                carriedCorrelation = change.getCorrelationId();
            }
            Path path = resolveInside(root, change.getPath());
            if (path == null) {
                log.debug("WATCH_EVENT_OUTSIDE_ROOT libraryId={} rootId={} path={}", libraryId, rootId, change.getPath());
                continue;
            }
            if (config.isIgnored(path)) {
                ignored++;
                continue;
            }
            changes.add(NormalizedChange.builder()
                    .kind(change.getKind())
                    .path(path)
                    .oldPath(resolveInside(root, change.getOldPath()))
                    .fileSize(change.getFileSize())
                    .fileKey(change.getFileKey())
                    .detectedAt(change.getDetectedAt() == null ? Instant.now() : change.getDetectedAt())
                    .build());
        }
        if (ignored > 0) {
            MeterSupport.incrementCounter(meterRegistry, "media.watch.events.ignored", ignored);
        }

        List<NormalizedChange> paired = MoveDetector.pair(changes, config.getMoveDetectionWindowMs());
        String correlationId = resolveCorrelation(carriedCorrelation);
        Map<String, DurableEvent> byKey = new LinkedHashMap<>();
        for (NormalizedChange change : paired) {
            FileChangeKind kind = change.getKind();
            if (kind == FileChangeKind.MOVE && change.getOldPath() == null) {
                kind = FileChangeKind.CREATE;
            }
            String path = change.getPath().toString();
            String oldPath = change.getOldPath() == null ? null : change.getOldPath().toString();
            String pathKey = kind == FileChangeKind.MOVE ? oldPath + "->" + path : path;
            String key = IdempotencyKeys.forChange(libraryId, rootId, kind, pathKey,
                    change.getDetectedAt(), config.getIdempotencyBucketMs());
            DurableEvent event = DurableEvent.builder()
                    .libraryId(libraryId)
                    .rootId(rootId)
                    .kind(kind)
                    .path(path)
                    .oldPath(kind == FileChangeKind.MOVE ? oldPath : null)
                    .fileSize(change.getFileSize())
                    .detectedAt(change.getDetectedAt())
                    .correlationId(correlationId)
                    .idempotencyKey(key)
                    .build();
            DurableEvent duplicate = byKey.get(key);
            if (duplicate != null) {
                byKey.put(key, duplicate.toBuilder().fileSize(event.getFileSize()).build());
            } else {
                byKey.put(key, event);
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private void persistAndDispatch(Long rootId, List<DurableEvent> events, ScanReason reason) {
        List<DurableEvent> persisted = persist(rootId, events);
        if (persisted != null) {
            dispatch(rootId, persisted, reason);
        }
    }

    private List<DurableEvent> persist(Long rootId, List<DurableEvent> events) {
        int maxAttempts = config.getPersistMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                List<DurableEvent> persisted = eventLog.append(events);
                MeterSupport.incrementCounter(meterRegistry, "media.watch.events.persisted", persisted.size());
                return persisted;
            } catch (RuntimeException e) {
                log.warn("WATCH_PERSIST_FAILED libraryId={} rootId={} attempt={}/{} events={} msg={}",
                        libraryId, rootId, attempt, maxAttempts, events.size(), e.getMessage());
                if (attempt < maxAttempts && !backoff(attempt)) {
                    break;
                }
            }
        }
        log.error("WATCH_PERSIST_GAVE_UP libraryId={} rootId={} events={}", libraryId, rootId, events.size());
        MeterSupport.incrementCounter(meterRegistry, "media.watch.persist.failed", 1);
        sweepTracker.markRootStale(libraryId, rootId, SweepTrigger.PERSIST_FAILED);
        return null;
    }

    private void dispatch(Long rootId, List<DurableEvent> events, ScanReason reason) {
        int maxAttempts = config.getDispatchMaxAttempts();
        long firstSeq = events.get(0).getSeq() == null ? 0L : events.get(0).getSeq();
        long lastSeq = events.get(events.size() - 1).getSeq() == null ? 0L : events.get(events.size() - 1).getSeq();
        String correlationId = events.get(0).getCorrelationId();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Throwable failure;
            try {
                CompletableFuture<PipelineReceipt> future =
                        batchDispatcher.dispatchBatch(mailbox, libraryId, rootId, events, reason);
                failure = immediateFailure(future);
                if (failure == null) {
                    future.whenComplete((receipt, error) -> {
                        if (error != null) {
                            log.warn("WATCH_BATCH_PROCESSING_FAILED libraryId={} rootId={} lastSeq={} msg={}",
                                    libraryId, rootId, lastSeq, error.getMessage());
                        }
                    });
                    log.info("WATCH_FLUSH libraryId={} rootId={} events={} firstSeq={} lastSeq={} reason={} "
                                    + "correlationId={}",
                            libraryId, rootId, events.size(), firstSeq, lastSeq, reason, correlationId);
                    MeterSupport.incrementCounter(meterRegistry, "media.watch.batches.dispatched", 1);
                    return;
                }
            } catch (RuntimeException e) {
                failure = e;
            }
            log.warn("WATCH_DISPATCH_FAILED libraryId={} rootId={} attempt={}/{} lastSeq={} msg={}",
                    libraryId, rootId, attempt, maxAttempts, lastSeq, failure.getMessage());
            if (attempt < maxAttempts && !backoff(attempt)) {
                break;
            }
        }
        log.error("WATCH_DISPATCH_GAVE_UP libraryId={} rootId={} events={} firstSeq={} lastSeq={}",
                libraryId, rootId, events.size(), firstSeq, lastSeq);
        MeterSupport.incrementCounter(meterRegistry, "media.watch.dispatch.failed", 1);
        sweepTracker.markLibraryStale(libraryId, rootPaths.keySet(), SweepTrigger.DISPATCH_FAILED);
    }

    private Throwable immediateFailure(CompletableFuture<PipelineReceipt> future) {
        if (future == null) {
            return new IllegalStateException("mailbox returned no future");
        }
        if (!future.isCompletedExceptionally()) {
            return null;
        }
        try {
            future.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() == null ? e : e.getCause();
        } catch (CancellationException e) {
            return e;
        }
    }

    private boolean backoff(int attempt) {
        long sleepMs = config.getRetryBackoffMs() * attempt;
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void drain() {
        List<RawFileChange> rest = new ArrayList<>();
        queue.drainTo(rest);
        int drained = 0;
        for (RawFileChange change : rest) {
            if (change != STOP && change != WAKE) {
                buffer(change);
                drained++;
            }
        }
        handleOverflows();
        flushAll();
        log.info("WATCH_FLUSH_TASK_STOPPED libraryId={} drained={}", libraryId, drained);
    }

    private String resolveCorrelation(String carried) {
        if (TextUtil.hasText(carried)) {
            return carried;
        }
        String maintenance = maintenanceCorrelation == null ? null : maintenanceCorrelation.get();
        if (TextUtil.hasText(maintenance)) {
            return maintenance;
        }
        return UUID.randomUUID().toString();
    }

    private Path resolveInside(Path root, Path path) {
        if (path == null) {
            return null;
        }
        Path absolute = (path.isAbsolute() ? path : root.resolve(path)).toAbsolutePath().normalize();
        return absolute.startsWith(root) ? absolute : null;
    }
}
