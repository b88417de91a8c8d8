package com.example.mediaindexer.application.job;

import com.example.mediaindexer.application.service.FileSystemWatcherService;
import com.example.mediaindexer.application.service.ScanOrchestrator;
import com.example.mediaindexer.common.exception.BusinessException;
import com.example.mediaindexer.domain.enumtype.LibraryType;
import com.example.mediaindexer.domain.model.LibraryRoot;
import com.example.mediaindexer.domain.model.WatchedLibrary;
import com.example.mediaindexer.infrastructure.persistence.entity.LibraryEntity;
import com.example.mediaindexer.infrastructure.persistence.entity.LibraryRootEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.LibraryMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Recovers scans interrupted by the previous shutdown, then starts watching every enabled library.
 */
@Component
public class WatcherBootstrap {

    private static final Logger log = LoggerFactory.getLogger(WatcherBootstrap.class);

    private final ScanOrchestrator scanOrchestrator;
    private final FileSystemWatcherService fileSystemWatcherService;
    private final LibraryMapper libraryMapper;

    public WatcherBootstrap(ScanOrchestrator scanOrchestrator,
                            FileSystemWatcherService fileSystemWatcherService,
                            LibraryMapper libraryMapper) {
        this.scanOrchestrator = scanOrchestrator;
        this.fileSystemWatcherService = fileSystemWatcherService;
        this.libraryMapper = libraryMapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        int recovered = scanOrchestrator.recoverInterruptedScans();
        List<LibraryEntity> libraries = libraryMapper.selectEnabled();
        if (libraries == null || libraries.isEmpty()) {
            log.info("WATCH_BOOTSTRAP_EMPTY recoveredScans={}", recovered);
            return;
        }
        int registered = 0;
        for (LibraryEntity entity : libraries) {
            LibraryType type = LibraryType.fromValue(entity.getLibraryType());
            if (type == null) {
                log.warn("WATCH_BOOTSTRAP_SKIPPED libraryId={} name={} libraryType={}",
                        entity.getId(), entity.getName(), entity.getLibraryType());
                continue;
            }
            try {
                fileSystemWatcherService.registerLibrary(toWatchedLibrary(entity, type));
                registered++;
            } catch (BusinessException e) {
                log.warn("WATCH_BOOTSTRAP_FAILED libraryId={} name={} code={} msg={}",
                        entity.getId(), entity.getName(), e.getCode(), e.getMessage());
            } catch (Exception e) {
                log.error("WATCH_BOOTSTRAP_FAILED libraryId={} name={}", entity.getId(), entity.getName(), e);
            }
        }
        log.info("WATCH_BOOTSTRAP_DONE libraries={} registered={} recoveredScans={}",
                libraries.size(), registered, recovered);
    }

    private WatchedLibrary toWatchedLibrary(LibraryEntity entity, LibraryType type) {
        List<LibraryRoot> roots = new ArrayList<>();
        List<LibraryRootEntity> rootEntities = libraryMapper.selectRootsByLibraryId(entity.getId());
        if (rootEntities != null) {
            for (LibraryRootEntity root : rootEntities) {
                roots.add(new LibraryRoot(root.getId(), root.getPath()));
            }
        }
        return new WatchedLibrary(entity.getId(), entity.getName(), type, roots);
    }
}
