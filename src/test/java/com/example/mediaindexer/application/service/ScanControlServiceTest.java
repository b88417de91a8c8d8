package com.example.mediaindexer.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.mediaindexer.application.pipeline.ActorMailbox;
import com.example.mediaindexer.application.pipeline.FolderScanCommand;
import com.example.mediaindexer.application.pipeline.PipelineCommand;
import com.example.mediaindexer.application.pipeline.PipelineReceipt;
import com.example.mediaindexer.common.config.AppScanProperties;
import com.example.mediaindexer.common.exception.BusinessException;
import com.example.mediaindexer.domain.enumtype.ScanReason;
import com.example.mediaindexer.domain.enumtype.ScanStatus;
import com.example.mediaindexer.domain.enumtype.ScanType;
import com.example.mediaindexer.domain.model.ScanOptions;
import com.example.mediaindexer.domain.model.ScanState;
import com.example.mediaindexer.infrastructure.persistence.entity.LibraryEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.LibraryMapper;
import com.example.mediaindexer.support.InMemoryScanStateMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class ScanControlServiceTest {

    private ScanOrchestrator scanOrchestrator;
    private LibraryMapper libraryMapper;
    private List<PipelineCommand> sent;
    private CompletableFuture<PipelineReceipt> nextResult;
    private ScanControlService service;

    @BeforeEach
    void setUp() {
        scanOrchestrator = new ScanOrchestrator(new InMemoryScanStateMapper(), new AppScanProperties(),
                new ObjectMapper(), beanProvider(new SimpleMeterRegistry()));
        libraryMapper = mock(LibraryMapper.class);
        LibraryEntity library = new LibraryEntity();
        library.setId(1L);
        library.setName("Movies");
        when(libraryMapper.selectById(1L)).thenReturn(library);
        sent = new ArrayList<>();
        nextResult = new CompletableFuture<>();
        ActorMailbox mailbox = command -> {
            sent.add(command);
            return nextResult;
        };
        service = new ScanControlService(scanOrchestrator, libraryMapper, mailbox);
    }

    @Test
    void requestScanShouldCreatePendingScanAndQueueWalk() {
        ScanState scan = service.requestScan(1L, ScanType.FULL, null);

        assertEquals(ScanStatus.PENDING, scan.getStatus());
        assertEquals(ScanReason.USER_REQUESTED, scan.getOptions().getScanReason());
        assertNotNull(scan.getOptions().getCorrelationId());
        assertEquals(1, sent.size());
        FolderScanCommand command = (FolderScanCommand) sent.get(0);
        assertEquals(scan.getId(), command.getScanId());
        assertEquals(ScanType.FULL, command.getScanType());
        assertEquals(scan.getOptions().getCorrelationId(), command.getCorrelationId());
    }

    @Test
    void requestScanShouldKeepCallerOptions() {
        ScanOptions options = ScanOptions.defaults();
        options.setRootId(10L);
        options.setCorrelationId("user-42");
        options.setScanReason(ScanReason.BULK_SEED);

        ScanState scan = service.requestScan(1L, ScanType.REFRESH_METADATA, options);

        assertEquals(10L, scan.getOptions().getRootId().longValue());
        assertEquals("user-42", scan.getOptions().getCorrelationId());
        assertEquals(ScanReason.BULK_SEED, ((FolderScanCommand) sent.get(0)).getReason());
    }

    @Test
    void unknownLibraryShouldBeRejected() {
        BusinessException error = assertThrows(BusinessException.class,
                () -> service.requestScan(2L, ScanType.FULL, null));

        assertEquals("404", error.getCode());
        assertTrue(sent.isEmpty());
    }

    @Test
    void activeFullScanShouldBlockAnotherRequest() {
        service.requestScan(1L, ScanType.FULL, null);

        BusinessException error = assertThrows(BusinessException.class,
                () -> service.requestScan(1L, ScanType.ANALYZE, null));

        assertEquals("409", error.getCode());
        assertNotNull(error.getUserAction());
    }

    @Test
    void runningIncrementalScanShouldNotBlockRequest() {
        ScanState live = scanOrchestrator.createScan(1L, ScanType.INCREMENTAL, ScanOptions.defaults());
        scanOrchestrator.startScan(live.getId());

        ScanState scan = service.requestScan(1L, ScanType.FULL, null);

        assertEquals(ScanStatus.PENDING, scan.getStatus());
    }

    @Test
    void rejectedCommandShouldFailScan() {
        ScanState scan = service.requestScan(1L, ScanType.FULL, null);

        nextResult.completeExceptionally(new IllegalStateException("mailbox full"));

        ScanState failed = service.getScan(scan.getId());
        assertEquals(ScanStatus.FAILED, failed.getStatus());
        assertTrue(failed.getErrors().get(0).contains("mailbox full"));
    }

    @Test
    void resumeShouldQueueThePausedScanAgain() {
        ScanState scan = service.requestScan(1L, ScanType.FULL, null);
        scanOrchestrator.startScan(scan.getId());
        assertEquals(ScanStatus.PAUSED, service.pauseScan(scan.getId()).getStatus());

        ScanState resumed = service.resumeScan(scan.getId());

        assertEquals(ScanStatus.RUNNING, resumed.getStatus());
        assertEquals(2, sent.size());
        assertEquals(scan.getId(), ((FolderScanCommand) sent.get(1)).getScanId());
    }

    @Test
    void cancelAndLookup() {
        ScanState scan = service.requestScan(1L, ScanType.FULL, null);

        assertEquals(ScanStatus.CANCELLED, service.cancelScan(scan.getId()).getStatus());
        assertEquals(ScanStatus.CANCELLED, service.getScan(scan.getId()).getStatus());
        assertEquals("404", assertThrows(BusinessException.class, () -> service.getScan(999L)).getCode());
    }

    @Test
    void rejectedTransitionsShouldSurfaceAsConflict() {
        ScanState scan = service.requestScan(1L, ScanType.FULL, null);

        assertEquals("409", assertThrows(BusinessException.class, () -> service.pauseScan(scan.getId())).getCode());
        assertEquals("409", assertThrows(BusinessException.class, () -> service.resumeScan(scan.getId())).getCode());
        assertEquals(1, sent.size());

        service.cancelScan(scan.getId());
        assertEquals("409", assertThrows(BusinessException.class, () -> service.cancelScan(scan.getId())).getCode());
        assertEquals("404", assertThrows(BusinessException.class, () -> service.resumeScan(999L)).getCode());
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
