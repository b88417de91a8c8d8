package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.common.config.AppImageProperties;
import com.example.mediaindexer.common.util.MeterSupport;
import com.example.mediaindexer.common.util.TextUtil;
import com.example.mediaindexer.domain.enumtype.ImageFetchPriority;
import com.example.mediaindexer.domain.enumtype.MediaType;
import com.example.mediaindexer.domain.model.DetailedMediaInfo;
import com.example.mediaindexer.domain.model.ImageFetchJob;
import com.example.mediaindexer.domain.model.ImageKey;
import com.example.mediaindexer.domain.model.MediaAnalyzed;
import com.example.mediaindexer.domain.model.MediaJob;
import com.example.mediaindexer.domain.model.MediaReadyForIndex;
import com.example.mediaindexer.domain.model.MediaReference;
import com.example.mediaindexer.domain.model.ParsedTitle;
import com.example.mediaindexer.domain.model.SearchQuery;
import com.example.mediaindexer.domain.model.SearchResult;
import com.example.mediaindexer.infrastructure.metadata.MetadataProvider;
import com.example.mediaindexer.infrastructure.metadata.MetadataProviderException;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Resolves a file to a movie or an episode through the {@link MetadataProvider}. Provider errors
 * never leave this stage: the item continues unresolved and the reason is reported for the scan.
 */
@Component
public class DefaultMetadataActor implements MetadataActor {

    private static final Logger log = LoggerFactory.getLogger(DefaultMetadataActor.class);

    private final ObjectProvider<MetadataProvider> metadataProviderProvider;
    private final TitleParser titleParser;
    private final AppImageProperties appImageProperties;
    private final ObjectProvider<MeterRegistry> meterRegistryProvider;

    public DefaultMetadataActor(ObjectProvider<MetadataProvider> metadataProviderProvider,
                                TitleParser titleParser,
                                AppImageProperties appImageProperties,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.metadataProviderProvider = metadataProviderProvider;
        this.titleParser = titleParser;
        this.appImageProperties = appImageProperties;
        this.meterRegistryProvider = meterRegistryProvider;
    }

    @Override
    public MediaReadyForIndex enrich(MediaJob job, MediaAnalyzed analyzed) {
        if (job.getOptions() != null && job.getOptions().isSkipMetadataProvider()) {
            return MediaReadyForIndex.unresolved(analyzed, null);
        }
        MetadataProvider provider = metadataProviderProvider.getIfAvailable();
        if (provider == null) {
            return degraded(job, analyzed, "NO_PROVIDER", "no metadata provider configured");
        }
        Path fileName = Paths.get(job.getPath()).getFileName();
        ParsedTitle parsed = titleParser.parse(fileName == null ? job.getPath() : fileName.toString());
        if (!TextUtil.hasText(parsed.getTitle())) {
            return degraded(job, analyzed, "UNPARSEABLE", "no title in file name");
        }

        MediaType searchType = parsed.isEpisode() ? MediaType.SERIES : MediaType.MOVIE;
        long startNanos = System.nanoTime();
        try {
            List<SearchResult> results = provider.search(new SearchQuery(parsed.getTitle(), parsed.getYear(), searchType));
            SearchResult best = pickBest(results, parsed.getYear());
            if (best == null) {
                return degraded(job, analyzed, "NO_MATCH", "no match for '" + parsed.getTitle() + "'");
            }
            MediaType resultType = best.getMediaType() == null ? searchType : best.getMediaType();
            DetailedMediaInfo info = provider.getMetadata(best.getExternalId(), resultType);
            MeterSupport.recordDuration(meterRegistry(), "media.pipeline.enrich.duration",
                    System.nanoTime() - startNanos, "result", "ok");
            return resolved(job, analyzed, parsed, info == null ? fromSearch(best, resultType) : info);
        } catch (MetadataProviderException e) {
            MeterSupport.recordDuration(meterRegistry(), "media.pipeline.enrich.duration",
                    System.nanoTime() - startNanos, "result", "degraded");
            return degraded(job, analyzed, e.getKind().name(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("METADATA_PROVIDER_ERROR scanId={} path={} title={}",
                    job.getScanId(), job.getPath(), parsed.getTitle(), e);
            MeterSupport.recordDuration(meterRegistry(), "media.pipeline.enrich.duration",
                    System.nanoTime() - startNanos, "result", "degraded");
            return degraded(job, analyzed, "PROVIDER_ERROR", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private MediaReadyForIndex resolved(MediaJob job, MediaAnalyzed analyzed, ParsedTitle parsed,
                                        DetailedMediaInfo info) {
        List<MediaReference> references = new ArrayList<>();
        String logicalId;
        MediaType mediaType;
        MediaReference top;
        if (parsed.isEpisode()) {
            top = reference(logicalId(MediaType.SERIES, info.getExternalId()), MediaType.SERIES, info, null);
            MediaReference season = reference(
                    logicalId(MediaType.SEASON, info.getExternalId(), parsed.getSeason()),
                    MediaType.SEASON, info, top.getId());
            season.setTitle(info.getTitle() + " Season " + parsed.getSeason());
            season.setSeasonNumber(parsed.getSeason());
            MediaReference episode = reference(
                    logicalId(MediaType.EPISODE, info.getExternalId(), parsed.getSeason(), parsed.getEpisode()),
                    MediaType.EPISODE, info, season.getId());
            episode.setTitle(String.format("%s S%02dE%02d", info.getTitle(), parsed.getSeason(), parsed.getEpisode()));
            episode.setSeasonNumber(parsed.getSeason());
            episode.setEpisodeNumber(parsed.getEpisode());
            references.add(top);
            references.add(season);
            references.add(episode);
            logicalId = episode.getId();
            mediaType = MediaType.EPISODE;
        } else {
            top = reference(logicalId(MediaType.MOVIE, info.getExternalId()), MediaType.MOVIE, info, null);
            references.add(top);
            logicalId = top.getId();
            mediaType = MediaType.MOVIE;
        }

        List<ImageFetchJob> imageJobs = new ArrayList<>(2);
        addImageJob(imageJobs, job.getLibraryId(), top, info.getPosterPath(), "poster", ImageFetchPriority.POSTER);
        addImageJob(imageJobs, job.getLibraryId(), top, info.getBackdropPath(), "backdrop", ImageFetchPriority.BACKDROP);

        log.debug("METADATA_RESOLVED scanId={} path={} type={} logicalId={} externalId={}",
                job.getScanId(), job.getPath(), mediaType, logicalId, info.getExternalId());
        MeterSupport.incrementCounter(meterRegistry(), "media.pipeline.enrich.resolved", 1,
                "media_type", mediaType.name());
        return MediaReadyForIndex.builder()
                .analyzed(analyzed)
                .logicalId(logicalId)
                .mediaType(mediaType)
                .references(references)
                .imageJobs(imageJobs)
                .build();
    }

    private MediaReadyForIndex degraded(MediaJob job, MediaAnalyzed analyzed, String kind, String message) {
        log.warn("METADATA_DEGRADED scanId={} path={} kind={} msg={}", job.getScanId(), job.getPath(), kind, message);
        MeterSupport.incrementCounter(meterRegistry(), "media.pipeline.enrich.degraded", 1, "kind", kind);
        return MediaReadyForIndex.unresolved(analyzed, "metadata " + kind + ": " + message);
    }

    private SearchResult pickBest(List<SearchResult> results, Integer year) {
        if (results == null || results.isEmpty()) {
            return null;
        }
        SearchResult first = null;
        for (SearchResult result : results) {
            if (result == null || !TextUtil.hasText(result.getExternalId())) {
                continue;
            }
            if (year != null && Objects.equals(year, result.getYear())) {
                return result;
            }
            if (first == null) {
                first = result;
            }
        }
        return first;
    }

    private DetailedMediaInfo fromSearch(SearchResult result, MediaType mediaType) {
        DetailedMediaInfo info = new DetailedMediaInfo();
        info.setExternalId(result.getExternalId());
        info.setMediaType(mediaType);
        info.setTitle(result.getTitle());
        info.setYear(result.getYear());
        return info;
    }

    private MediaReference reference(String id, MediaType type, DetailedMediaInfo info, String parentId) {
        MediaReference reference = new MediaReference();
        reference.setId(id);
        reference.setMediaType(type);
        reference.setExternalId(info.getExternalId());
        reference.setParentId(parentId);
        reference.setTitle(info.getTitle());
        reference.setYear(info.getYear());
        if (type == MediaType.MOVIE || type == MediaType.SERIES) {
            reference.setOverview(info.getOverview());
            reference.setPosterPath(info.getPosterPath());
            reference.setBackdropPath(info.getBackdropPath());
        }
        return reference;
    }

    private void addImageJob(List<ImageFetchJob> jobs, Long libraryId, MediaReference owner, String source,
                             String imageType, ImageFetchPriority priority) {
        if (!TextUtil.hasText(source)) {
            return;
        }
        jobs.add(ImageFetchJob.builder()
                .libraryId(libraryId)
                .source(source)
                .key(new ImageKey(owner.getMediaType(), owner.getId(), imageType, 0,
                        appImageProperties.getDefaultVariant()))
                .priority(priority)
                .build());
    }

    /**
     * Same provider entity, same id, on every run.
     */
    static String logicalId(MediaType type, String externalId, Object... parts) {
        StringBuilder sb = new StringBuilder(type.name()).append(':').append(externalId);
        for (Object part : parts) {
            sb.append(':').append(part);
        }
        return UUID.nameUUIDFromBytes(sb.toString().getBytes(StandardCharsets.UTF_8)).toString();
    }

    private MeterRegistry meterRegistry() {
        return meterRegistryProvider.getIfAvailable();
    }
}
