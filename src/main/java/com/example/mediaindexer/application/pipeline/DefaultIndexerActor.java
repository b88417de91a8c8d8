package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.common.exception.MediaReferenceNotFoundException;
import com.example.mediaindexer.common.util.HashUtil;
import com.example.mediaindexer.common.util.MeterSupport;
import com.example.mediaindexer.common.util.TextUtil;
import com.example.mediaindexer.domain.enumtype.IndexingChange;
import com.example.mediaindexer.domain.model.IndexingOutcome;
import com.example.mediaindexer.domain.model.MediaAnalyzed;
import com.example.mediaindexer.domain.model.MediaJob;
import com.example.mediaindexer.domain.model.MediaReadyForIndex;
import com.example.mediaindexer.domain.model.MediaReference;
import com.example.mediaindexer.infrastructure.persistence.MediaReferencesRepository;
import com.example.mediaindexer.infrastructure.persistence.entity.IndexedMediaEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.IndexedMediaMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Writes one file into {@code indexed_media}. The logical entity is hydrated by probing the
 * movie, series, season and episode stores in that order; a miss moves on to the next store and
 * any other failure propagates.
 */
@Component
public class DefaultIndexerActor implements IndexerActor {

    private static final Logger log = LoggerFactory.getLogger(DefaultIndexerActor.class);

    private final MediaReferencesRepository mediaReferencesRepository;
    private final IndexedMediaMapper indexedMediaMapper;
    private final ObjectProvider<MeterRegistry> meterRegistryProvider;

    public DefaultIndexerActor(MediaReferencesRepository mediaReferencesRepository,
                               IndexedMediaMapper indexedMediaMapper,
                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.mediaReferencesRepository = mediaReferencesRepository;
        this.indexedMediaMapper = indexedMediaMapper;
        this.meterRegistryProvider = meterRegistryProvider;
    }

    @Override
    public IndexingOutcome index(MediaJob job, MediaReadyForIndex ready) {
        MediaReference media = resolveMedia(ready);

        String pathMd5 = HashUtil.md5Hex(job.getPath());
        IndexedMediaEntity existing = findExisting(job, pathMd5);
        String mediaId = existing != null && TextUtil.hasText(existing.getMediaId())
                ? existing.getMediaId()
                : mediaIdFor(job.getLibraryId(), job.getPath());
        IndexingChange change = existing == null ? IndexingChange.CREATED : IndexingChange.UPDATED;

        MediaAnalyzed analyzed = ready.getAnalyzed();
        IndexedMediaEntity entity = new IndexedMediaEntity();
        entity.setMediaId(mediaId);
        entity.setLibraryId(job.getLibraryId());
        entity.setRootId(job.getRootId());
        entity.setPath(job.getPath());
        entity.setPathMd5(pathMd5);
        entity.setMediaType(ready.getMediaType() == null ? null : ready.getMediaType().name());
        entity.setLogicalId(ready.getLogicalId());
        if (analyzed != null && analyzed.getFingerprint() != null) {
            entity.setFingerprint(TextUtil.truncate(analyzed.getFingerprint().hashRepr(), 256));
            entity.setFileSize(analyzed.getFingerprint().getSize());
            entity.setFileMtime(analyzed.getFingerprint().getMtime());
        } else {
            entity.setFileSize(job.getFileSize());
            entity.setFileMtime(job.getMtimeMillis());
        }
        entity.setStreamsJson(analyzed == null ? null : analyzed.getStreamsJson());
        entity.setIdempotencyKey(job.getIdempotencyKey());
        entity.setLastScanId(job.getScanId());
        int affected = indexedMediaMapper.upsert(entity);

        MeterSupport.incrementCounter(meterRegistryProvider.getIfAvailable(), "media.pipeline.index.upserted", 1,
                "change", change.name());
        log.debug("INDEX_UPSERT scanId={} path={} mediaId={} change={} logicalId={}",
                job.getScanId(), job.getPath(), mediaId, change, ready.getLogicalId());
        return IndexingOutcome.builder()
                .upserted(affected > 0)
                .mediaId(mediaId)
                .media(media)
                .change(change)
                .build();
    }

    private MediaReference resolveMedia(MediaReadyForIndex ready) {
        if (!TextUtil.hasText(ready.getLogicalId())) {
            return null;
        }
        MediaReference media = hydrate(ready.getLogicalId());
        if (media != null) {
            return media;
        }
        List<MediaReference> references = ready.getReferences();
        if (references == null || references.isEmpty()) {
            return null;
        }
        for (MediaReference reference : references) {
            mediaReferencesRepository.saveReference(reference);
        }
        return references.get(references.size() - 1);
    }

    MediaReference hydrate(String logicalId) {
        try {
            return mediaReferencesRepository.getMovieReference(logicalId);
        } catch (MediaReferenceNotFoundException e) {
            log.trace("INDEX_LOOKUP_MISS type=MOVIE id={}", logicalId);
        }
        try {
            return mediaReferencesRepository.getSeriesReference(logicalId);
        } catch (MediaReferenceNotFoundException e) {
            log.trace("INDEX_LOOKUP_MISS type=SERIES id={}", logicalId);
        }
        try {
            return mediaReferencesRepository.getSeasonReference(logicalId);
        } catch (MediaReferenceNotFoundException e) {
            log.trace("INDEX_LOOKUP_MISS type=SEASON id={}", logicalId);
        }
        try {
            return mediaReferencesRepository.getEpisodeReference(logicalId);
        } catch (MediaReferenceNotFoundException e) {
            log.trace("INDEX_LOOKUP_MISS type=EPISODE id={}", logicalId);
        }
        return null;
    }

    private IndexedMediaEntity findExisting(MediaJob job, String pathMd5) {
        if (TextUtil.hasText(job.getIdempotencyKey())) {
            IndexedMediaEntity byKey = indexedMediaMapper.selectByIdempotencyKey(job.getLibraryId(), job.getIdempotencyKey());
            if (byKey != null && pathMd5.equals(byKey.getPathMd5())) {
                return byKey;
            }
        }
        IndexedMediaEntity byPath = indexedMediaMapper.selectByLibraryAndPathMd5(job.getLibraryId(), pathMd5);
        if (byPath != null) {
            return byPath;
        }
        if (TextUtil.hasText(job.getPreviousPath())) {
            IndexedMediaEntity moved = indexedMediaMapper.selectByLibraryAndPathMd5(
                    job.getLibraryId(), HashUtil.md5Hex(job.getPreviousPath()));
            if (moved != null) {
                indexedMediaMapper.relocate(moved.getId(), job.getPath(), pathMd5);
                log.info("INDEX_RELOCATED libraryId={} mediaId={} from={} to={}",
                        job.getLibraryId(), moved.getMediaId(), job.getPreviousPath(), job.getPath());
                return moved;
            }
        }
        return null;
    }

    static String mediaIdFor(Long libraryId, String path) {
        return UUID.nameUUIDFromBytes(("media:" + libraryId + ":" + path).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
