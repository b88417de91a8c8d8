package com.example.mediaindexer.application.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mediaindexer.application.service.FileSystemWatcherService;
import com.example.mediaindexer.application.service.ScanOrchestrator;
import com.example.mediaindexer.common.exception.BusinessException;
import com.example.mediaindexer.domain.enumtype.LibraryType;
import com.example.mediaindexer.domain.model.WatchedLibrary;
import com.example.mediaindexer.infrastructure.persistence.entity.LibraryEntity;
import com.example.mediaindexer.infrastructure.persistence.entity.LibraryRootEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.LibraryMapper;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class WatcherBootstrapTest {

    private ScanOrchestrator scanOrchestrator;
    private FileSystemWatcherService fileSystemWatcherService;
    private LibraryMapper libraryMapper;
    private WatcherBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        scanOrchestrator = mock(ScanOrchestrator.class);
        fileSystemWatcherService = mock(FileSystemWatcherService.class);
        libraryMapper = mock(LibraryMapper.class);
        bootstrap = new WatcherBootstrap(scanOrchestrator, fileSystemWatcherService, libraryMapper);
    }

    @Test
    void startShouldRecoverScansThenRegisterEnabledLibraries() {
        when(libraryMapper.selectEnabled()).thenReturn(Collections.singletonList(library(1L, "Movies", "movies")));
        when(libraryMapper.selectRootsByLibraryId(1L)).thenReturn(Arrays.asList(
                new LibraryRootEntity(10L, 1L, "/media/movies", 1),
                new LibraryRootEntity(11L, 1L, "/mnt/nas/movies", 1)));

        bootstrap.start();

        InOrder order = inOrder(scanOrchestrator, fileSystemWatcherService);
        order.verify(scanOrchestrator).recoverInterruptedScans();
        ArgumentCaptor<WatchedLibrary> captor = ArgumentCaptor.forClass(WatchedLibrary.class);
        order.verify(fileSystemWatcherService).registerLibrary(captor.capture());
        WatchedLibrary registered = captor.getValue();
        assertEquals(1L, registered.getId().longValue());
        assertEquals(LibraryType.MOVIES, registered.getLibraryType());
        assertEquals(2, registered.getRoots().size());
        assertEquals("/mnt/nas/movies", registered.findRoot(11L).getPath());
    }

    @Test
    void failingLibraryShouldNotStopOthers() {
        when(libraryMapper.selectEnabled()).thenReturn(Arrays.asList(
                library(1L, "Broken", "MOVIES"), library(2L, "Unknown", "podcasts"), library(3L, "Series", "SERIES")));
        when(libraryMapper.selectRootsByLibraryId(any())).thenReturn(Collections.singletonList(
                new LibraryRootEntity(30L, 3L, "/media/tv", 1)));
        doThrow(new BusinessException("WATCH_INIT_FAILED", "No root could be watched"))
                .when(fileSystemWatcherService).registerLibrary(argThat(lib -> lib.getId() == 1L));

        bootstrap.start();

        verify(fileSystemWatcherService, times(2)).registerLibrary(any(WatchedLibrary.class));
        verify(fileSystemWatcherService).registerLibrary(argThat(lib -> lib.getId() == 3L));
        verify(fileSystemWatcherService, never()).registerLibrary(argThat(lib -> lib.getId() == 2L));
    }

    @Test
    void noEnabledLibraryShouldOnlyRecover() {
        when(libraryMapper.selectEnabled()).thenReturn(Collections.emptyList());

        bootstrap.start();

        verify(scanOrchestrator).recoverInterruptedScans();
        verify(fileSystemWatcherService, never()).registerLibrary(any());
    }

    private LibraryEntity library(Long id, String name, String type) {
        LibraryEntity entity = new LibraryEntity();
        entity.setId(id);
        entity.setName(name);
        entity.setLibraryType(type);
        entity.setEnabled(1);
        return entity;
    }
}
