package com.example.mediaindexer.application.watch;

import com.example.mediaindexer.domain.enumtype.SweepTrigger;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Roots waiting for a maintenance sweep, keyed by library. Written by the flush tasks and the
 * pipeline driver, drained by the maintenance scheduler.
 */
@Component
public class SweepTracker {

    private static final Logger log = LoggerFactory.getLogger(SweepTracker.class);

    private final ConcurrentMap<Long, ConcurrentMap<Long, SweepTrigger>> staleRoots = new ConcurrentHashMap<>();

    public void markRootStale(Long libraryId, Long rootId, SweepTrigger trigger) {
        if (libraryId == null || rootId == null) {
            return;
        }
        SweepTrigger previous = staleRoots.computeIfAbsent(libraryId, key -> new ConcurrentHashMap<>())
                .put(rootId, trigger);
        if (previous == null) {
            log.info("SWEEP_ROOT_MARKED libraryId={} rootId={} trigger={}", libraryId, rootId, trigger);
        }
    }

    public void markLibraryStale(Long libraryId, Collection<Long> rootIds, SweepTrigger trigger) {
        if (rootIds == null) {
            return;
        }
        for (Long rootId : rootIds) {
            markRootStale(libraryId, rootId, trigger);
        }
    }

    /**
     * @return snapshot of the library's stale roots ordered by root id
     */
    public Map<Long, SweepTrigger> staleRoots(Long libraryId) {
        Map<Long, SweepTrigger> roots = staleRoots.get(libraryId);
        if (roots == null || roots.isEmpty()) {
            return Collections.emptyMap();
        }
        return new TreeMap<>(roots);
    }

    public boolean isStale(Long libraryId, Long rootId) {
        Map<Long, SweepTrigger> roots = staleRoots.get(libraryId);
        return roots != null && roots.containsKey(rootId);
    }

    /**
     * Clears the flag only if it still carries the trigger that was swept, so a trigger raised
     * while the sweep was being queued survives.
     */
    public boolean clearRoot(Long libraryId, Long rootId, SweepTrigger trigger) {
        Map<Long, SweepTrigger> roots = staleRoots.get(libraryId);
        return roots != null && roots.remove(rootId, trigger);
    }

    public void forgetLibrary(Long libraryId) {
        staleRoots.remove(libraryId);
    }
}
