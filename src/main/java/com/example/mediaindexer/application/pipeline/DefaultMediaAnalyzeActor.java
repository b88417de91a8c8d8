package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.common.config.AppScanProperties;
import com.example.mediaindexer.common.util.HashUtil;
import com.example.mediaindexer.common.util.MeterSupport;
import com.example.mediaindexer.domain.model.MediaAnalyzed;
import com.example.mediaindexer.domain.model.MediaFingerprint;
import com.example.mediaindexer.domain.model.MediaJob;
import com.example.mediaindexer.domain.model.TechnicalMetadata;
import com.example.mediaindexer.infrastructure.parser.TechnicalMetadataExtractor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class DefaultMediaAnalyzeActor implements MediaAnalyzeActor {

    private static final Logger log = LoggerFactory.getLogger(DefaultMediaAnalyzeActor.class);

    static final int WEAK_HASH_BYTES = 64 * 1024;

    private final TechnicalMetadataExtractor technicalMetadataExtractor;
    private final ExecutorService mediaAnalyzeExecutor;
    private final AppScanProperties appScanProperties;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<MeterRegistry> meterRegistryProvider;

    public DefaultMediaAnalyzeActor(TechnicalMetadataExtractor technicalMetadataExtractor,
                                    @Qualifier("mediaAnalyzeExecutor") ExecutorService mediaAnalyzeExecutor,
                                    AppScanProperties appScanProperties,
                                    ObjectMapper objectMapper,
                                    ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.technicalMetadataExtractor = technicalMetadataExtractor;
        this.mediaAnalyzeExecutor = mediaAnalyzeExecutor;
        this.appScanProperties = appScanProperties;
        this.objectMapper = objectMapper;
        this.meterRegistryProvider = meterRegistryProvider;
    }

    @Override
    public MediaAnalyzed analyze(MediaJob job) throws IOException {
        Path path = Paths.get(job.getPath());
        MediaFingerprint fingerprint = fingerprint(path);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("path", job.getPath());
        context.put("file_name", path.getFileName() == null ? job.getPath() : path.getFileName().toString());

        if (job.getOptions() != null && job.getOptions().isSkipFileMetadata()) {
            return placeholder(fingerprint, context, null);
        }

        long startNanos = System.nanoTime();
        String probeError;
        Future<TechnicalMetadata> future = null;
        try {
            future = mediaAnalyzeExecutor.submit(() -> technicalMetadataExtractor.extract(path.toFile()));
            TechnicalMetadata metadata = future.get(appScanProperties.getProbeTimeoutMs(), TimeUnit.MILLISECONDS);
            String streamsJson = objectMapper.writeValueAsString(metadata);
            context.put("technical_metadata", metadata);
            MeterSupport.recordDuration(meterRegistry(), "media.pipeline.analyze.duration",
                    System.nanoTime() - startNanos, "result", "ok");
            return MediaAnalyzed.builder()
                    .fingerprint(fingerprint)
                    .streamsJson(streamsJson)
                    .context(Collections.unmodifiableMap(context))
                    .placeholder(false)
                    .build();
        } catch (TimeoutException e) {
            future.cancel(true);
            probeError = "probe timed out after " + appScanProperties.getProbeTimeoutMs() + "ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            probeError = "probe failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        } catch (RejectedExecutionException e) {
            probeError = "probe rejected: analyze queue full";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            probeError = "probe interrupted";
        } catch (JsonProcessingException e) {
            probeError = "probe result not serializable: " + e.getOriginalMessage();
        }
        MeterSupport.recordDuration(meterRegistry(), "media.pipeline.analyze.duration",
                System.nanoTime() - startNanos, "result", "placeholder");
        MeterSupport.incrementCounter(meterRegistry(), "media.pipeline.analyze.placeholder", 1);
        log.debug("ANALYZE_PLACEHOLDER scanId={} path={} reason={}", job.getScanId(), job.getPath(), probeError);
        return placeholder(fingerprint, context, probeError);
    }

    MediaFingerprint fingerprint(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        Long deviceId = null;
        Long inode = null;
        try {
            Map<String, Object> unix = Files.readAttributes(path, "unix:dev,ino", LinkOption.NOFOLLOW_LINKS);
            deviceId = toLong(unix.get("dev"));
            inode = toLong(unix.get("ino"));
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            log.trace("ANALYZE_NO_UNIX_ATTRIBUTES path={}", path);
        }
        return MediaFingerprint.builder()
                .deviceId(deviceId)
                .inode(inode)
                .size(attrs.size())
                .mtime(attrs.lastModifiedTime().toMillis())
                .weakHash(weakHash(path))
                .build();
    }

    private String weakHash(Path path) throws IOException {
        byte[] buffer = new byte[WEAK_HASH_BYTES];
        int read = 0;
        try (InputStream in = Files.newInputStream(path)) {
            while (read < buffer.length) {
                int n = in.read(buffer, read, buffer.length - read);
                if (n < 0) {
                    break;
                }
                read += n;
            }
        }
        return HashUtil.md5Hex(buffer, 0, read);
    }

    private MediaAnalyzed placeholder(MediaFingerprint fingerprint, Map<String, Object> context, String probeError) {
        return MediaAnalyzed.builder()
                .fingerprint(fingerprint)
                .streamsJson(MediaAnalyzed.PLACEHOLDER_STREAMS_JSON)
                .context(Collections.unmodifiableMap(context))
                .placeholder(true)
                .probeError(probeError)
                .build();
    }

    private Long toLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    private MeterRegistry meterRegistry() {
        return meterRegistryProvider.getIfAvailable();
    }
}
