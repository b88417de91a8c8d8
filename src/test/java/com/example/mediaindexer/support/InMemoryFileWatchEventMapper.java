package com.example.mediaindexer.support;

import com.example.mediaindexer.infrastructure.persistence.entity.FileWatchEventEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.FileWatchEventMapper;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Event and acknowledgement tables with the unique key behaviour of the real ones. Can be told to
 * fail the next inserts.
 */
public class InMemoryFileWatchEventMapper implements FileWatchEventMapper {

    private final Map<Long, FileWatchEventEntity> rows = new TreeMap<>();
    private final Map<String, Long> idsByKey = new HashMap<>();
    private final Map<Long, Set<Long>> acks = new HashMap<>();
    private long nextId = 1;
    private int failuresLeft;

    @Override
    public synchronized int insert(FileWatchEventEntity entity) {
        if (failuresLeft > 0) {
            failuresLeft--;
            throw new IllegalStateException("event store unavailable");
        }
        Long existing = idsByKey.get(entity.getIdempotencyKey());
        if (existing != null) {
            entity.setId(existing);
            return 0;
        }
        entity.setId(nextId++);
        rows.put(entity.getId(), entity);
        idsByKey.put(entity.getIdempotencyKey(), entity.getId());
        return 1;
    }

    @Override
    public synchronized List<FileWatchEventEntity> selectUnacknowledged(Long libraryId, long afterSeq,
                                                                        LocalDateTime detectedBefore, int limit) {
        List<FileWatchEventEntity> result = new ArrayList<>();
        for (FileWatchEventEntity entity : rows.values()) {
            if (result.size() >= limit) {
                break;
            }
            if (libraryId.equals(entity.getLibraryId()) && entity.getId() > afterSeq
                    && entity.getDetectedAt().isBefore(detectedBefore) && !isAcked(libraryId, entity.getId())) {
                result.add(entity);
            }
        }
        return result;
    }

    @Override
    public synchronized Long selectFirstUnacknowledgedSeq(Long libraryId, long afterSeq, long upToSeq) {
        for (FileWatchEventEntity entity : rows.values()) {
            if (libraryId.equals(entity.getLibraryId()) && entity.getId() > afterSeq && entity.getId() <= upToSeq
                    && !isAcked(libraryId, entity.getId())) {
                return entity.getId();
            }
        }
        return null;
    }

    @Override
    public synchronized Long selectMaxSeq(Long libraryId) {
        Long max = null;
        for (FileWatchEventEntity entity : rows.values()) {
            if (libraryId.equals(entity.getLibraryId())) {
                max = entity.getId();
            }
        }
        return max;
    }

    @Override
    public synchronized int insertAcks(Long libraryId, List<Long> seqs) {
        Set<Long> acked = acks.computeIfAbsent(libraryId, id -> new HashSet<>());
        int inserted = 0;
        for (Long seq : seqs) {
            if (acked.add(seq)) {
                inserted++;
            }
        }
        return inserted;
    }

    @Override
    public synchronized int deleteAcksUpTo(Long libraryId, long seq) {
        Set<Long> acked = acks.get(libraryId);
        if (acked == null) {
            return 0;
        }
        int before = acked.size();
        acked.removeIf(s -> s <= seq);
        return before - acked.size();
    }

    public synchronized void failNextInserts(int count) {
        this.failuresLeft = count;
    }

    public synchronized List<FileWatchEventEntity> all() {
        return new ArrayList<>(rows.values());
    }

    public synchronized Set<Long> pendingAcks(Long libraryId) {
        Set<Long> acked = acks.get(libraryId);
        return acked == null ? new HashSet<>() : new HashSet<>(acked);
    }

    private boolean isAcked(Long libraryId, Long seq) {
        Set<Long> acked = acks.get(libraryId);
        return acked != null && acked.contains(seq);
    }
}
