package com.example.mediaindexer.application.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mediaindexer.application.pipeline.ActorMailbox;
import com.example.mediaindexer.application.pipeline.BatchDispatcher;
import com.example.mediaindexer.application.pipeline.FolderScanCommand;
import com.example.mediaindexer.application.pipeline.FsEventsCommand;
import com.example.mediaindexer.application.pipeline.PipelineCommand;
import com.example.mediaindexer.application.pipeline.PipelineReceipt;
import com.example.mediaindexer.application.service.DurableEventLog;
import com.example.mediaindexer.application.service.FileSystemWatcherService;
import com.example.mediaindexer.application.service.ScanOrchestrator;
import com.example.mediaindexer.application.watch.SweepTracker;
import com.example.mediaindexer.common.config.AppScanProperties;
import com.example.mediaindexer.common.config.AppWatchProperties;
import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import com.example.mediaindexer.domain.enumtype.LibraryType;
import com.example.mediaindexer.domain.enumtype.ScanReason;
import com.example.mediaindexer.domain.enumtype.ScanStatus;
import com.example.mediaindexer.domain.enumtype.ScanType;
import com.example.mediaindexer.domain.enumtype.SweepTrigger;
import com.example.mediaindexer.domain.model.DurableEvent;
import com.example.mediaindexer.domain.model.LibraryRoot;
import com.example.mediaindexer.domain.model.ScanOptions;
import com.example.mediaindexer.domain.model.ScanState;
import com.example.mediaindexer.domain.model.WatchedLibrary;
import com.example.mediaindexer.support.InMemoryFileWatchCursorMapper;
import com.example.mediaindexer.support.InMemoryFileWatchEventMapper;
import com.example.mediaindexer.support.InMemoryScanStateMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class MaintenanceSweepSchedulerTest {

    private static final Long LIBRARY_ID = 1L;

    private FileSystemWatcherService fileSystemWatcherService;
    private SweepTracker sweepTracker;
    private ScanOrchestrator scanOrchestrator;
    private DurableEventLog durableEventLog;
    private AppWatchProperties appWatchProperties;
    private SimpleMeterRegistry meterRegistry;
    private List<PipelineCommand> sent;
    private boolean rejectCommands;
    private MaintenanceSweepScheduler scheduler;
    private WatchedLibrary library;

    @BeforeEach
    void setUp() {
        fileSystemWatcherService = mock(FileSystemWatcherService.class);
        sweepTracker = new SweepTracker();
        meterRegistry = new SimpleMeterRegistry();
        scanOrchestrator = new ScanOrchestrator(new InMemoryScanStateMapper(), new AppScanProperties(),
                new ObjectMapper(), beanProvider(meterRegistry));
        durableEventLog = new DurableEventLog(new InMemoryFileWatchEventMapper(), new InMemoryFileWatchCursorMapper());
        appWatchProperties = new AppWatchProperties();
        appWatchProperties.setReplayGraceMs(30000);
        sent = new ArrayList<>();
        ActorMailbox mailbox = command -> {
            if (rejectCommands) {
                CompletableFuture<PipelineReceipt> rejected = new CompletableFuture<>();
                rejected.completeExceptionally(new IllegalStateException("mailbox full"));
                return rejected;
            }
            sent.add(command);
            return new CompletableFuture<>();
        };
        scheduler = new MaintenanceSweepScheduler(fileSystemWatcherService, sweepTracker, scanOrchestrator,
                durableEventLog, new BatchDispatcher(), mailbox, appWatchProperties, beanProvider(meterRegistry));
        library = new WatchedLibrary(LIBRARY_ID, "Movies", LibraryType.MOVIES, Arrays.asList(
                new LibraryRoot(10L, "/media/movies"), new LibraryRoot(11L, "/media/more-movies")));
    }

    @Test
    void overflowedRootShouldGetMaintenanceSweepUnderTickCorrelation() {
        completeRecentScan();
        sweepTracker.markRootStale(LIBRARY_ID, 10L, SweepTrigger.OVERFLOW);

        scheduler.tickLibrary(library);

        assertEquals(1, sent.size());
        FolderScanCommand command = (FolderScanCommand) sent.get(0);
        assertEquals(10L, command.getRootId().longValue());
        assertEquals(ScanReason.MAINTENANCE_SWEEP, command.getReason());
        assertEquals(ScanType.FULL, command.getScanType());
        assertEquals(10L, command.getOptions().getRootId().longValue());
        assertFalse(sweepTracker.isStale(LIBRARY_ID, 10L));
        assertEquals(1.0, meterRegistry.get("media.watch.maintenance.sweeps").tag("trigger", "OVERFLOW")
                .counter().count());

        ArgumentCaptor<String> opened = ArgumentCaptor.forClass(String.class);
        verify(fileSystemWatcherService).openMaintenanceCorrelation(eq(LIBRARY_ID), opened.capture());
        verify(fileSystemWatcherService).closeMaintenanceCorrelation(LIBRARY_ID, opened.getValue());
        assertEquals(opened.getValue(), command.getCorrelationId());
    }

    @Test
    void libraryWithoutCompletedScanShouldSweepEveryRoot() {
        scheduler.tickLibrary(library);

        assertEquals(2, sent.size());
        assertEquals(10L, ((FolderScanCommand) sent.get(0)).getRootId().longValue());
        assertEquals(11L, ((FolderScanCommand) sent.get(1)).getRootId().longValue());
        assertEquals(sent.get(0).getCorrelationId(), sent.get(1).getCorrelationId());
        assertTrue(sweepTracker.staleRoots(LIBRARY_ID).isEmpty());
    }

    @Test
    void stalenessShouldFollowLastCompletedScanAge() {
        completeRecentScan();
        assertFalse(scheduler.isLibraryStale(LIBRARY_ID));

        scheduler.setClock(Clock.offset(Clock.systemDefaultZone(), Duration.ofDays(2)));
        assertTrue(scheduler.isLibraryStale(LIBRARY_ID));
    }

    @Test
    void activeScanShouldSuppressStaleness() {
        ScanState running = scanOrchestrator.createScan(LIBRARY_ID, ScanType.FULL, ScanOptions.defaults());
        scanOrchestrator.startScan(running.getId());

        assertFalse(scheduler.isLibraryStale(LIBRARY_ID));
        scheduler.tickLibrary(library);
        assertTrue(sent.isEmpty());
    }

    @Test
    void pausedScanShouldNotSuppressStaleness() {
        ScanState interrupted = scanOrchestrator.createScan(LIBRARY_ID, ScanType.FULL, ScanOptions.defaults());
        scanOrchestrator.startScan(interrupted.getId());
        assertEquals(1, scanOrchestrator.recoverInterruptedScans());
        assertEquals(ScanStatus.PAUSED, scanOrchestrator.getScan(interrupted.getId()).getStatus());

        assertTrue(scheduler.isLibraryStale(LIBRARY_ID));
        scheduler.tickLibrary(library);
        assertEquals(2, sent.size());
        assertTrue(sent.get(0) instanceof FolderScanCommand);
    }

    @Test
    void rejectedSweepShouldKeepRootStale() {
        completeRecentScan();
        sweepTracker.markRootStale(LIBRARY_ID, 11L, SweepTrigger.WATCHER_ERROR);
        rejectCommands = true;

        scheduler.tickLibrary(library);

        assertTrue(sweepTracker.isStale(LIBRARY_ID, 11L));
        rejectCommands = false;
        scheduler.tickLibrary(library);
        assertEquals(1, sent.size());
        assertFalse(sweepTracker.isStale(LIBRARY_ID, 11L));
    }

    @Test
    void staleRootOutsideLibraryShouldBeDropped() {
        completeRecentScan();
        sweepTracker.markRootStale(LIBRARY_ID, 99L, SweepTrigger.OVERFLOW);

        scheduler.tickLibrary(library);

        assertTrue(sent.isEmpty());
        assertFalse(sweepTracker.isStale(LIBRARY_ID, 99L));
    }

    @Test
    void replayShouldGroupUnacknowledgedEventsOlderThanGrace() {
        completeRecentScan();
        Instant old = Instant.now().minusSeconds(120);
        List<DurableEvent> stored = durableEventLog.append(Arrays.asList(
                event(10L, "/media/movies/a.mkv", "corr-a", old),
                event(10L, "/media/movies/b.mkv", "corr-a", old),
                event(10L, "/media/movies/c.mkv", "corr-a", old),
                event(11L, "/media/more-movies/d.mkv", "corr-b", old),
                event(10L, "/media/movies/fresh.mkv", "corr-c", Instant.now())));
        durableEventLog.acknowledge(LIBRARY_ID, Collections.singletonList(stored.get(0).getSeq()));

        scheduler.tickLibrary(library);

        assertEquals(2, sent.size());
        FsEventsCommand first = (FsEventsCommand) sent.get(0);
        assertEquals(10L, first.getRootId().longValue());
        assertEquals("corr-a", first.getCorrelationId());
        assertEquals(ScanReason.MAINTENANCE_SWEEP, first.getReason());
        assertEquals(Arrays.asList(stored.get(1).getSeq(), stored.get(2).getSeq()),
                Arrays.asList(first.getEvents().get(0).getSeq(), first.getEvents().get(1).getSeq()));
        FsEventsCommand second = (FsEventsCommand) sent.get(1);
        assertEquals(11L, second.getRootId().longValue());
        assertEquals(1, second.getEvents().size());
        assertEquals(3.0, meterRegistry.get("media.watch.maintenance.replayed").counter().count());

        sent.clear();
        scheduler.tickLibrary(library);
        assertTrue(sent.isEmpty());
    }

    @Test
    void replayShouldResendEventBehindLaterAcknowledgedBatch() {
        completeRecentScan();
        Instant old = Instant.now().minusSeconds(120);
        List<DurableEvent> stored = durableEventLog.append(Arrays.asList(
                event(10L, "/media/movies/lost.mkv", "corr-lost", old),
                event(10L, "/media/movies/done.mkv", "corr-done", old)));
        assertEquals(0L, durableEventLog.acknowledge(LIBRARY_ID, Collections.singletonList(stored.get(1).getSeq())));

        scheduler.tickLibrary(library);

        assertEquals(1, sent.size());
        FsEventsCommand replayed = (FsEventsCommand) sent.get(0);
        assertEquals("corr-lost", replayed.getCorrelationId());
        assertEquals(Collections.singletonList(stored.get(0).getSeq()), replayed.seqs());

        assertEquals(stored.get(1).getSeq().longValue(), durableEventLog.acknowledge(LIBRARY_ID, replayed.seqs()));
        sent.clear();
        scheduler.tickLibrary(library);
        assertTrue(sent.isEmpty());
    }

    @Test
    void replayedBatchThatNeverCompletesShouldBeResentAfterGrace() {
        completeRecentScan();
        durableEventLog.append(Collections.singletonList(
                event(10L, "/media/movies/a.mkv", "corr-a", Instant.now().minusSeconds(120))));

        scheduler.tickLibrary(library);
        scheduler.tickLibrary(library);
        assertEquals(1, sent.size());

        scheduler.setClock(Clock.offset(Clock.systemDefaultZone(), Duration.ofMinutes(1)));
        scheduler.tickLibrary(library);
        assertEquals(2, sent.size());
        assertEquals(((FsEventsCommand) sent.get(0)).seqs(), ((FsEventsCommand) sent.get(1)).seqs());
    }

    @Test
    void tickShouldContainFailuresPerLibrary() {
        when(fileSystemWatcherService.registeredLibraryIds()).thenReturn(Collections.singleton(LIBRARY_ID));
        when(fileSystemWatcherService.getRegisteredLibrary(LIBRARY_ID)).thenReturn(library);
        ActorMailbox failing = command -> {
            throw new IllegalStateException("boom");
        };
        scheduler = new MaintenanceSweepScheduler(fileSystemWatcherService, sweepTracker, scanOrchestrator,
                durableEventLog, new BatchDispatcher(), failing, appWatchProperties, beanProvider(meterRegistry));

        scheduler.tick();

        assertEquals(1.0, meterRegistry.get("media.watch.maintenance.failed").counter().count());
        verify(fileSystemWatcherService).closeMaintenanceCorrelation(eq(LIBRARY_ID), anyString());
        assertTrue(sweepTracker.isStale(LIBRARY_ID, 10L));
    }

    private void completeRecentScan() {
        ScanState scan = scanOrchestrator.createScan(LIBRARY_ID, ScanType.FULL, ScanOptions.defaults());
        scanOrchestrator.startScan(scan.getId());
        scanOrchestrator.completeScan(scan.getId());
    }

    private DurableEvent event(Long rootId, String path, String correlationId, Instant detectedAt) {
        return DurableEvent.builder()
                .libraryId(LIBRARY_ID)
                .rootId(rootId)
                .kind(FileChangeKind.CREATE)
                .path(path)
                .detectedAt(detectedAt)
                .correlationId(correlationId)
                .idempotencyKey(path + ":" + correlationId)
                .build();
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
