package com.example.mediaindexer.application.service;

import com.example.mediaindexer.application.pipeline.FolderScanCommand;
import com.example.mediaindexer.application.pipeline.FsEventsCommand;
import com.example.mediaindexer.application.pipeline.ImageFetchActor;
import com.example.mediaindexer.application.pipeline.IndexerActor;
import com.example.mediaindexer.application.pipeline.MediaAnalyzeActor;
import com.example.mediaindexer.application.pipeline.MetadataActor;
import com.example.mediaindexer.application.pipeline.PipelineCommandHandler;
import com.example.mediaindexer.application.pipeline.PipelineReceipt;
import com.example.mediaindexer.application.watch.IdempotencyKeys;
import com.example.mediaindexer.application.watch.SweepTracker;
import com.example.mediaindexer.common.config.AppScanProperties;
import com.example.mediaindexer.common.exception.BusinessException;
import com.example.mediaindexer.common.util.HashUtil;
import com.example.mediaindexer.common.util.MeterSupport;
import com.example.mediaindexer.common.util.TextUtil;
import com.example.mediaindexer.domain.enumtype.ScanReason;
import com.example.mediaindexer.domain.enumtype.ScanStatus;
import com.example.mediaindexer.domain.enumtype.ScanType;
import com.example.mediaindexer.domain.enumtype.SweepTrigger;
import com.example.mediaindexer.domain.model.DurableEvent;
import com.example.mediaindexer.domain.model.ImageFetchJob;
import com.example.mediaindexer.domain.model.MediaAnalyzed;
import com.example.mediaindexer.domain.model.MediaJob;
import com.example.mediaindexer.domain.model.MediaReadyForIndex;
import com.example.mediaindexer.domain.model.ScanOptions;
import com.example.mediaindexer.domain.model.ScanState;
import com.example.mediaindexer.infrastructure.persistence.entity.IndexedMediaEntity;
import com.example.mediaindexer.infrastructure.persistence.entity.LibraryRootEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.IndexedMediaMapper;
import com.example.mediaindexer.infrastructure.persistence.mapper.LibraryMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Executes pipeline commands taken from the mailbox. Every command runs as a scan: live batches
 * get their own incremental scan, folder walks run the scan they were created for.
 *
 * <p>Each media file goes through analyze, enrich and index; artwork is handed to the image
 * executor without waiting. Per-item failures are retried and then recorded on the scan. Only
 * persistence failures abort the command and fail the scan.
 */
@Service
public class LibraryPipelineDriver implements PipelineCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(LibraryPipelineDriver.class);

    private final ScanOrchestrator scanOrchestrator;
    private final DurableEventLog durableEventLog;
    private final SweepTracker sweepTracker;
    private final LibraryMapper libraryMapper;
    private final IndexedMediaMapper indexedMediaMapper;
    private final MediaAnalyzeActor mediaAnalyzeActor;
    private final MetadataActor metadataActor;
    private final IndexerActor indexerActor;
    private final ImageFetchActor imageFetchActor;
    private final ExecutorService pipelineWorkerExecutor;
    private final ExecutorService imageFetchExecutor;
    private final ObjectProvider<MeterRegistry> meterRegistryProvider;
    private final Set<String> mediaExtensions;

    public LibraryPipelineDriver(ScanOrchestrator scanOrchestrator,
                                 DurableEventLog durableEventLog,
                                 SweepTracker sweepTracker,
                                 LibraryMapper libraryMapper,
                                 IndexedMediaMapper indexedMediaMapper,
                                 MediaAnalyzeActor mediaAnalyzeActor,
                                 MetadataActor metadataActor,
                                 IndexerActor indexerActor,
                                 ImageFetchActor imageFetchActor,
                                 AppScanProperties appScanProperties,
                                 @Qualifier("pipelineWorkerExecutor") ExecutorService pipelineWorkerExecutor,
                                 @Qualifier("imageFetchExecutor") ExecutorService imageFetchExecutor,
                                 ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.scanOrchestrator = scanOrchestrator;
        this.durableEventLog = durableEventLog;
        this.sweepTracker = sweepTracker;
        this.libraryMapper = libraryMapper;
        this.indexedMediaMapper = indexedMediaMapper;
        this.mediaAnalyzeActor = mediaAnalyzeActor;
        this.metadataActor = metadataActor;
        this.indexerActor = indexerActor;
        this.imageFetchActor = imageFetchActor;
        this.pipelineWorkerExecutor = pipelineWorkerExecutor;
        this.imageFetchExecutor = imageFetchExecutor;
        this.meterRegistryProvider = meterRegistryProvider;
        this.mediaExtensions = appScanProperties.normalizedMediaExtensions();
    }

    @Override
    public PipelineReceipt handleFsEvents(FsEventsCommand command) {
        Long libraryId = command.getLibraryId();
        ScanOptions options = ScanOptions.defaults();
        options.setRootId(command.getRootId());
        options.setCorrelationId(command.getCorrelationId());
        options.setScanReason(command.getReason() == null ? ScanReason.HOT_CHANGE : command.getReason());
        ScanState scan = scanOrchestrator.createScan(libraryId, ScanType.INCREMENTAL, options);
        Long scanId = scan.getId();
        scanOrchestrator.startScan(scanId);
        long startNanos = System.nanoTime();

        try {
            Counters counters = new Counters();
            List<MediaJob> jobs = new ArrayList<>();
            boolean overflow = false;
            for (DurableEvent event : command.getEvents()) {
                switch (event.getKind()) {
                    case CREATE:
                    case MODIFY:
                        addEventJob(jobs, counters, scan, event, null);
                        break;
                    case MOVE:
                        if (TextUtil.hasText(event.getOldPath())) {
                            counters.deleted += markDeleted(libraryId, event.getOldPath());
                        }
                        addEventJob(jobs, counters, scan, event, event.getOldPath());
                        break;
                    case DELETE:
                        counters.deleted += markDeleted(libraryId, event.getPath());
                        break;
                    case OVERFLOW:
                        overflow = true;
                        break;
                    default:
                        log.warn("PIPELINE_EVENT_UNKNOWN scanId={} kind={}", scanId, event.getKind());
                }
            }
            if (overflow) {
                // events were lost; the next maintenance tick walks the root and reconciles it
                sweepTracker.markRootStale(libraryId, command.getRootId(), SweepTrigger.OVERFLOW);
                log.info("PIPELINE_OVERFLOW_DEFERRED scanId={} libraryId={} rootId={}",
                        scanId, libraryId, command.getRootId());
            }
            scanOrchestrator.updateScanTotals(scanId, null, jobs.size());
            boolean finished = processItems(scan, jobs, counters, 0);

            boolean completed = finished && scanOrchestrator.completeScan(scanId);
            if (completed) {
                durableEventLog.acknowledge(libraryId, command.seqs());
            }
            log.info("PIPELINE_FS_BATCH_DONE scanId={} libraryId={} rootId={} events={} processed={} skipped={} "
                            + "failed={} deleted={} completed={} maxSeq={} correlationId={}",
                    scanId, libraryId, command.getRootId(), command.getEvents().size(), counters.processed,
                    counters.skipped, counters.failed, counters.deleted, completed, command.maxSeq(),
                    command.getCorrelationId());
            MeterSupport.recordDuration(meterRegistry(), "media.pipeline.batch.duration",
                    System.nanoTime() - startNanos, "command", "fs_events");
            return receipt(libraryId, scanId, command.getCorrelationId(), counters, completed);
        } catch (RuntimeException e) {
            abort(scanId, libraryId, Collections.singletonList(command.getRootId()), e);
            throw e;
        }
    }

    @Override
    public PipelineReceipt handleFolderScan(FolderScanCommand command) {
        Long libraryId = command.getLibraryId();
        ScanState scan;
        int alreadyProcessed = 0;
        if (command.getScanId() != null) {
            scan = scanOrchestrator.getScan(command.getScanId());
            if (scan == null) {
                throw new BusinessException("404", "Scan not found: " + command.getScanId());
            }
            if (scan.getStatus() == ScanStatus.PENDING) {
                scanOrchestrator.startScan(scan.getId());
            } else if (scan.getStatus() == ScanStatus.RUNNING) {
                alreadyProcessed = scan.getProcessedFiles();
            } else {
                log.info("PIPELINE_SCAN_NOT_RUNNABLE scanId={} status={}", scan.getId(), scan.getStatus());
                return PipelineReceipt.builder()
                        .libraryId(libraryId)
                        .scanId(scan.getId())
                        .correlationId(command.getCorrelationId())
                        .finished(false)
                        .build();
            }
        } else {
            ScanOptions options = command.getOptions() == null ? ScanOptions.defaults() : command.getOptions().copy();
            options.setRootId(command.getRootId());
            options.setCorrelationId(command.getCorrelationId());
            options.setScanReason(command.getReason());
            scan = scanOrchestrator.createScan(libraryId, command.getScanType(), options);
            scanOrchestrator.startScan(scan.getId());
        }
        Long scanId = scan.getId();
        long startNanos = System.nanoTime();

        List<LibraryRootEntity> roots = resolveRoots(libraryId, command.getRootId());
        List<Long> rootIds = new ArrayList<>();
        for (LibraryRootEntity root : roots) {
            rootIds.add(root.getId());
        }
        try {
            Counters counters = new Counters();
            if (roots.isEmpty()) {
                scanOrchestrator.addScanError(scanId, "No enabled root for library " + libraryId
                        + (command.getRootId() == null ? "" : " and root " + command.getRootId()));
            }
            List<MediaJob> jobs = new ArrayList<>();
            List<RootWalk> walks = new ArrayList<>(roots.size());
            for (LibraryRootEntity root : roots) {
                RootWalk walk = walkRoot(scan, root.getId(), Paths.get(root.getPath()), counters);
                walks.add(walk);
                jobs.addAll(walk.jobs);
            }
            scanOrchestrator.updateScanTotals(scanId, counters.folders, jobs.size());
            int skip = Math.min(alreadyProcessed, jobs.size());
            if (skip > 0) {
                log.info("PIPELINE_SCAN_RESUME scanId={} skipping={} of={}", scanId, skip, jobs.size());
            }
            boolean finished = processItems(scan, jobs.subList(skip, jobs.size()), counters, skip);
            boolean completed = false;
            if (finished) {
                for (RootWalk walk : walks) {
                    counters.deleted += removeVanished(scan, walk);
                }
                scanOrchestrator.updateScanProgress(scanId, counters.folders, null, null);
                completed = scanOrchestrator.completeScan(scanId);
            }
            log.info("PIPELINE_FOLDER_SCAN_DONE scanId={} libraryId={} rootId={} type={} reason={} files={} "
                            + "processed={} skipped={} failed={} deleted={} completed={} correlationId={}",
                    scanId, libraryId, command.getRootId(), scan.getScanType(), command.getReason(), jobs.size(),
                    counters.processed, counters.skipped, counters.failed, counters.deleted, completed,
                    command.getCorrelationId());
            MeterSupport.recordDuration(meterRegistry(), "media.pipeline.batch.duration",
                    System.nanoTime() - startNanos, "command", "folder_scan");
            return receipt(libraryId, scanId, command.getCorrelationId(), counters, completed);
        } catch (RuntimeException e) {
            abort(scanId, libraryId, rootIds, e);
            throw e;
        }
    }

    /**
     * Runs the jobs in chunks of {@code batchSize}. Scan status is read before every chunk and the
     * loop stops once the scan is no longer running.
     *
     * @param offset files of this scan already processed before these jobs
     * @return false when the scan was paused or cancelled before all jobs ran
     */
    private boolean processItems(ScanState scan, List<MediaJob> jobs, Counters counters, int offset) {
        ScanOptions options = scan.getOptions() == null ? ScanOptions.defaults() : scan.getOptions();
        int batchSize = Math.max(1, options.getBatchSize());
        int maxInFlight = Math.max(1, options.getConcurrentWorkers());
        int done = 0;
        for (int start = 0; start < jobs.size(); start += batchSize) {
            if (stopRequested(scan.getId())) {
                return false;
            }
            List<MediaJob> chunk = jobs.subList(start, Math.min(jobs.size(), start + batchSize));
            runChunk(scan, chunk, maxInFlight, counters);
            done += chunk.size();
            scanOrchestrator.updateScanProgress(scan.getId(), null, offset + done,
                    chunk.get(chunk.size() - 1).getPath());
        }
        return true;
    }

    private boolean stopRequested(Long scanId) {
        ScanState current = scanOrchestrator.getScan(scanId);
        if (current == null || current.getStatus() != ScanStatus.RUNNING) {
            log.info("PIPELINE_SCAN_STOPPED scanId={} status={}", scanId, current == null ? null : current.getStatus());
            return true;
        }
        return false;
    }

    private void runChunk(ScanState scan, List<MediaJob> chunk, int maxInFlight, Counters counters) {
        CompletionService<ItemOutcome> completionService = new ExecutorCompletionService<>(pipelineWorkerExecutor);
        Iterator<MediaJob> iterator = chunk.iterator();
        int inFlight = 0;
        while (iterator.hasNext() || inFlight > 0) {
            while (inFlight < maxInFlight && iterator.hasNext()) {
                MediaJob job = iterator.next();
                try {
                    completionService.submit(() -> processItem(scan, job));
                    inFlight++;
                } catch (RejectedExecutionException e) {
                    // worker queue full: run on the mailbox thread instead
                    apply(scan, processItem(scan, job), counters);
                }
            }
            if (inFlight == 0) {
                continue;
            }
            try {
                Future<ItemOutcome> future = completionService.take();
                inFlight--;
                apply(scan, future.get(), counters);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Pipeline item processing interrupted", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("Pipeline item processing failed", cause);
            }
        }
    }

    /**
     * Runs one file through the stages, retrying failed attempts. Persistence failures are not
     * retried here; they propagate and fail the scan.
     */
    ItemOutcome processItem(ScanState scan, MediaJob job) {
        ScanOptions options = job.getOptions() == null ? ScanOptions.defaults() : job.getOptions();
        if (isUnchanged(scan, job, options)) {
            return ItemOutcome.skipped(job);
        }
        int attempts = options.isRetryFailed() ? 1 + Math.max(0, options.getMaxRetries()) : 1;
        Exception lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return runStages(job);
            } catch (DataAccessException e) {
                throw e;
            } catch (Exception e) {
                lastError = e;
                log.debug("PIPELINE_ITEM_ATTEMPT_FAILED scanId={} path={} attempt={}/{} msg={}",
                        job.getScanId(), job.getPath(), attempt, attempts, e.getMessage());
            }
        }
        return ItemOutcome.failed(job, lastError);
    }

    private ItemOutcome runStages(MediaJob job) throws IOException {
        MediaAnalyzed analyzed = mediaAnalyzeActor.analyze(job);
        MediaReadyForIndex ready = metadataActor.enrich(job, analyzed);
        indexerActor.index(job, ready);
        for (ImageFetchJob imageJob : ready.getImageJobs()) {
            submitImage(imageJob);
        }
        List<String> notes = new ArrayList<>(2);
        if (analyzed.getProbeError() != null) {
            notes.add(job.getPath() + ": " + analyzed.getProbeError());
        }
        if (ready.getDegradedReason() != null) {
            notes.add(job.getPath() + ": " + ready.getDegradedReason());
        }
        return ItemOutcome.processed(job, notes);
    }

    private void submitImage(ImageFetchJob imageJob) {
        try {
            imageFetchExecutor.execute(() -> imageFetchActor.fetch(imageJob));
        } catch (RejectedExecutionException e) {
            log.warn("IMAGE_FETCH_REJECTED mediaId={} type={}", imageJob.getKey().getMediaId(),
                    imageJob.getKey().getImageType());
            MeterSupport.incrementCounter(meterRegistry(), "media.pipeline.image.rejected", 1);
        }
    }

    private boolean isUnchanged(ScanState scan, MediaJob job, ScanOptions options) {
        if (options.isForceRefresh() || scan.getScanType() == ScanType.REFRESH_METADATA
                || scan.getScanType() == ScanType.ANALYZE || TextUtil.hasText(job.getPreviousPath())) {
            return false;
        }
        IndexedMediaEntity existing = indexedMediaMapper.selectByLibraryAndPathMd5(
                job.getLibraryId(), HashUtil.md5Hex(job.getPath()));
        return existing != null
                && !Objects.equals(existing.getDeleted(), 1)
                && Objects.equals(existing.getFileSize(), job.getFileSize())
                && Objects.equals(existing.getFileMtime(), job.getMtimeMillis());
    }

    private void apply(ScanState scan, ItemOutcome outcome, Counters counters) {
        switch (outcome.status) {
            case PROCESSED:
                counters.processed++;
                break;
            case SKIPPED:
                counters.skipped++;
                break;
            default:
                counters.failed++;
                String message = outcome.error == null ? "unknown error"
                        : outcome.error.getClass().getSimpleName() + ": " + outcome.error.getMessage();
                log.warn("PIPELINE_ITEM_FAILED scanId={} path={} msg={}", scan.getId(), outcome.job.getPath(), message);
                scanOrchestrator.addScanError(scan.getId(), outcome.job.getPath() + ": " + message);
                MeterSupport.incrementCounter(meterRegistry(), "media.pipeline.item.failed", 1);
        }
        for (String note : outcome.notes) {
            scanOrchestrator.addScanError(scan.getId(), note);
        }
    }

    private void addEventJob(List<MediaJob> jobs, Counters counters, ScanState scan, DurableEvent event,
                             String previousPath) {
        Path path = Paths.get(event.getPath());
        if (!isMediaFile(path)) {
            return;
        }
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            // removed again after the event; its delete follows in a later batch
            counters.skipped++;
            return;
        } catch (IOException e) {
            scanOrchestrator.addScanError(scan.getId(), event.getPath() + ": " + e.getMessage());
            counters.failed++;
            return;
        }
        if (!attrs.isRegularFile()) {
            return;
        }
        jobs.add(MediaJob.builder()
                .scanId(scan.getId())
                .libraryId(event.getLibraryId())
                .rootId(event.getRootId())
                .path(event.getPath())
                .previousPath(previousPath)
                .fileSize(attrs.size())
                .mtimeMillis(attrs.lastModifiedTime().toMillis())
                .correlationId(event.getCorrelationId())
                .idempotencyKey(event.getIdempotencyKey())
                .options(scan.getOptions())
                .reason(scan.getOptions().getScanReason())
                .build());
    }

    /**
     * Lists the media files under a root. The walk is incomplete when the root or any entry below
     * it could not be read.
     */
    private RootWalk walkRoot(ScanState scan, Long rootId, Path root, Counters counters) {
        List<MediaJob> jobs = new ArrayList<>();
        Path start = root.toAbsolutePath().normalize();
        boolean[] complete = {true};
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    counters.folders++;
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isMediaFile(file)) {
                        String path = file.toString();
                        jobs.add(MediaJob.builder()
                                .scanId(scan.getId())
                                .libraryId(scan.getLibraryId())
                                .rootId(rootId)
                                .path(path)
                                .fileSize(attrs.size())
                                .mtimeMillis(attrs.lastModifiedTime().toMillis())
                                .correlationId(scan.getOptions().getCorrelationId())
                                .idempotencyKey(IdempotencyKeys.forScanItem(scan.getLibraryId(), path,
                                        attrs.size(), attrs.lastModifiedTime().toMillis()))
                                .options(scan.getOptions())
                                .reason(scan.getOptions().getScanReason())
                                .build());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    complete[0] = false;
                    scanOrchestrator.addScanError(scan.getId(), file + ": " + exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("PIPELINE_ROOT_WALK_FAILED scanId={} rootId={} root={} msg={}",
                    scan.getId(), rootId, start, e.getMessage());
            scanOrchestrator.addScanError(scan.getId(), start + ": " + e.getMessage());
            complete[0] = false;
        }
        jobs.sort(Comparator.comparing(MediaJob::getPath));
        return new RootWalk(rootId, start, jobs, complete[0]);
    }

    /**
     * Marks indexed files under a fully walked root that the walk no longer found as deleted.
     * Incomplete walks leave the index alone.
     */
    private int removeVanished(ScanState scan, RootWalk walk) {
        if (!walk.complete) {
            log.warn("PIPELINE_RECONCILE_SKIPPED scanId={} rootId={} root={}", scan.getId(), walk.rootId, walk.root);
            return 0;
        }
        Set<String> seen = new HashSet<>();
        for (MediaJob job : walk.jobs) {
            seen.add(job.getPath());
        }
        String root = walk.root.toString();
        String prefix = root.endsWith(File.separator) ? root : root + File.separator;
        int removed = 0;
        for (IndexedMediaEntity entity : indexedMediaMapper.selectLiveByPrefix(scan.getLibraryId(), prefix)) {
            if (!seen.contains(entity.getPath())) {
                removed += indexedMediaMapper.markDeleted(scan.getLibraryId(), entity.getPathMd5());
            }
        }
        if (removed > 0) {
            log.info("PIPELINE_VANISHED_REMOVED scanId={} libraryId={} rootId={} removed={}",
                    scan.getId(), scan.getLibraryId(), walk.rootId, removed);
        }
        return removed;
    }

    private List<LibraryRootEntity> resolveRoots(Long libraryId, Long rootId) {
        List<LibraryRootEntity> roots = libraryMapper.selectRootsByLibraryId(libraryId);
        if (roots == null) {
            return Collections.emptyList();
        }
        List<LibraryRootEntity> result = new ArrayList<>();
        for (LibraryRootEntity root : roots) {
            boolean enabled = root.getEnabled() == null || root.getEnabled() != 0;
            if (enabled && TextUtil.hasText(root.getPath()) && (rootId == null || rootId.equals(root.getId()))) {
                result.add(root);
            }
        }
        result.sort(Comparator.comparing(LibraryRootEntity::getPath));
        return result;
    }

    private int markDeleted(Long libraryId, String path) {
        int rows = indexedMediaMapper.markDeleted(libraryId, HashUtil.md5Hex(path));
        String prefix = path.endsWith(File.separator) ? path : path + File.separator;
        rows += indexedMediaMapper.markDeletedByPrefix(libraryId, prefix);
        return rows;
    }

    private boolean isMediaFile(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1
                && mediaExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private void abort(Long scanId, Long libraryId, List<Long> rootIds, RuntimeException cause) {
        log.error("PIPELINE_COMMAND_FAILED scanId={} libraryId={} roots={}", scanId, libraryId, rootIds, cause);
        MeterSupport.incrementCounter(meterRegistry(), "media.pipeline.command.failed", 1);
        try {
            scanOrchestrator.failScan(scanId, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (RuntimeException e) {
            log.error("PIPELINE_FAIL_SCAN_FAILED scanId={} msg={}", scanId, e.getMessage());
            cause.addSuppressed(e);
        }
        sweepTracker.markLibraryStale(libraryId, rootIds, SweepTrigger.PIPELINE_FAILED);
    }

    private PipelineReceipt receipt(Long libraryId, Long scanId, String correlationId, Counters counters,
                                    boolean finished) {
        return PipelineReceipt.builder()
                .libraryId(libraryId)
                .scanId(scanId)
                .correlationId(correlationId)
                .processed(counters.processed)
                .skipped(counters.skipped)
                .failed(counters.failed)
                .deleted(counters.deleted)
                .finished(finished)
                .build();
    }

    private MeterRegistry meterRegistry() {
        return meterRegistryProvider.getIfAvailable();
    }

    private static final class RootWalk {
        private final Long rootId;
        private final Path root;
        private final List<MediaJob> jobs;
        private final boolean complete;

        private RootWalk(Long rootId, Path root, List<MediaJob> jobs, boolean complete) {
            this.rootId = rootId;
            this.root = root;
            this.jobs = jobs;
            this.complete = complete;
        }
    }

    private static final class Counters {
        private int folders;
        private int processed;
        private int skipped;
        private int failed;
        private int deleted;
    }

    private enum ItemStatus {
        PROCESSED,
        SKIPPED,
        FAILED
    }

    static final class ItemOutcome {
        private final MediaJob job;
        private final ItemStatus status;
        private final Exception error;
        private final List<String> notes;

        private ItemOutcome(MediaJob job, ItemStatus status, Exception error, List<String> notes) {
            this.job = job;
            this.status = status;
            this.error = error;
            this.notes = notes;
        }

        static ItemOutcome processed(MediaJob job, List<String> notes) {
            return new ItemOutcome(job, ItemStatus.PROCESSED, null, notes);
        }

        static ItemOutcome skipped(MediaJob job) {
            return new ItemOutcome(job, ItemStatus.SKIPPED, null, Collections.emptyList());
        }

        static ItemOutcome failed(MediaJob job, Exception error) {
            return new ItemOutcome(job, ItemStatus.FAILED, error, Collections.emptyList());
        }
    }
}
