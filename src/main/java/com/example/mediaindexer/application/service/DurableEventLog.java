package com.example.mediaindexer.application.service;

import com.example.mediaindexer.domain.enumtype.FileChangeKind;
import com.example.mediaindexer.domain.model.DurableEvent;
import com.example.mediaindexer.infrastructure.persistence.entity.FileWatchEventEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.FileWatchCursorMapper;
import com.example.mediaindexer.infrastructure.persistence.mapper.FileWatchEventMapper;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only store of normalized filesystem events plus a per-library consumer cursor. Events
 * are appended before anything downstream sees them. Batches are acknowledged by their sequence
 * numbers and the cursor only covers the contiguous acknowledged prefix, so an event whose batch
 * never completed stays above the cursor until it is acknowledged.
 *
 * <p>Appends for one library come from its single flush task, so sequence numbers of a library
 * become visible in order.
 */
@Service
public class DurableEventLog {

    private static final Logger log = LoggerFactory.getLogger(DurableEventLog.class);

    private final FileWatchEventMapper fileWatchEventMapper;
    private final FileWatchCursorMapper fileWatchCursorMapper;

    public DurableEventLog(FileWatchEventMapper fileWatchEventMapper,
                           FileWatchCursorMapper fileWatchCursorMapper) {
        this.fileWatchEventMapper = fileWatchEventMapper;
        this.fileWatchCursorMapper = fileWatchCursorMapper;
    }

    /**
     * Persists the events in order and returns them with their sequence numbers. An event whose
     * idempotency key is already stored comes back with the stored sequence number.
     */
    @Transactional
    public List<DurableEvent> append(List<DurableEvent> events) {
        if (events == null || events.isEmpty()) {
            return Collections.emptyList();
        }
        List<DurableEvent> persisted = new ArrayList<>(events.size());
        for (DurableEvent event : events) {
            FileWatchEventEntity entity = toEntity(event);
            fileWatchEventMapper.insert(entity);
            persisted.add(event.toBuilder().seq(entity.getId()).build());
        }
        log.debug("EVENT_LOG_APPEND libraryId={} count={} lastSeq={}",
                events.get(0).getLibraryId(), persisted.size(), persisted.get(persisted.size() - 1).getSeq());
        return persisted;
    }

    /**
     * @return up to {@code limit} unacknowledged events of the library with a sequence number above
     *         {@code afterSeq} and detected before {@code detectedBefore}, in sequence order
     */
    public List<DurableEvent> fetchAfter(Long libraryId, long afterSeq, Instant detectedBefore, int limit) {
        List<FileWatchEventEntity> entities = fileWatchEventMapper.selectUnacknowledged(
                libraryId, afterSeq, toLocal(detectedBefore), Math.max(1, limit));
        if (entities == null || entities.isEmpty()) {
            return Collections.emptyList();
        }
        List<DurableEvent> events = new ArrayList<>(entities.size());
        for (FileWatchEventEntity entity : entities) {
            events.add(toEvent(entity));
        }
        return events;
    }

    /**
     * Records the given events as processed and moves the cursor over every acknowledged event
     * directly above it. The cursor never moves backwards.
     *
     * @return the cursor after the acknowledgement
     */
    @Transactional
    public long acknowledge(Long libraryId, Collection<Long> seqs) {
        long current = cursor(libraryId);
        List<Long> fresh = new ArrayList<>();
        if (seqs != null) {
            for (Long seq : seqs) {
                if (seq != null && seq > current) {
                    fresh.add(seq);
                }
            }
        }
        if (fresh.isEmpty()) {
            return current;
        }
        fileWatchEventMapper.insertAcks(libraryId, fresh);

        Long maxSeq = fileWatchEventMapper.selectMaxSeq(libraryId);
        long upTo = maxSeq == null ? current : maxSeq;
        Long firstGap = fileWatchEventMapper.selectFirstUnacknowledgedSeq(libraryId, current, upTo);
        long next = firstGap == null ? upTo : firstGap - 1;
        if (next > current) {
            fileWatchCursorMapper.advance(libraryId, next);
            fileWatchEventMapper.deleteAcksUpTo(libraryId, next);
        }
        long cursor = Math.max(current, next);
        log.debug("EVENT_LOG_ACK libraryId={} acked={} cursor={} firstGap={}", libraryId, fresh.size(), cursor, firstGap);
        return cursor;
    }

    public long cursor(Long libraryId) {
        Long seq = fileWatchCursorMapper.selectLastSeq(libraryId);
        return seq == null ? 0L : seq;
    }

    private FileWatchEventEntity toEntity(DurableEvent event) {
        FileWatchEventEntity entity = new FileWatchEventEntity();
        entity.setVersion(event.getVersion());
        entity.setLibraryId(event.getLibraryId());
        entity.setRootId(event.getRootId());
        entity.setKind(event.getKind().name());
        entity.setPath(event.getPath());
        entity.setOldPath(event.getOldPath());
        entity.setFileSize(event.getFileSize());
        entity.setDetectedAt(toLocal(event.getDetectedAt()));
        entity.setCorrelationId(event.getCorrelationId());
        entity.setIdempotencyKey(event.getIdempotencyKey());
        return entity;
    }

    private DurableEvent toEvent(FileWatchEventEntity entity) {
        return DurableEvent.builder()
                .seq(entity.getId())
                .version(entity.getVersion() == null ? DurableEvent.EVENT_VERSION : entity.getVersion())
                .libraryId(entity.getLibraryId())
                .rootId(entity.getRootId())
                .kind(FileChangeKind.valueOf(entity.getKind()))
                .path(entity.getPath())
                .oldPath(entity.getOldPath())
                .fileSize(entity.getFileSize())
                .detectedAt(entity.getDetectedAt() == null ? null : entity.getDetectedAt().toInstant(ZoneOffset.UTC))
                .correlationId(entity.getCorrelationId())
                .idempotencyKey(entity.getIdempotencyKey())
                .build();
    }

    private LocalDateTime toLocal(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
