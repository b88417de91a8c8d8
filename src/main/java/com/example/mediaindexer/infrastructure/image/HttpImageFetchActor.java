package com.example.mediaindexer.infrastructure.image;

import com.example.mediaindexer.application.pipeline.ImageFetchActor;
import com.example.mediaindexer.common.config.AppImageProperties;
import com.example.mediaindexer.common.util.MeterSupport;
import com.example.mediaindexer.common.util.TextUtil;
import com.example.mediaindexer.domain.model.ImageFetchJob;
import com.example.mediaindexer.domain.model.ImageKey;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Downloads artwork into the local image cache. Files already cached are not fetched again.
 */
@Component
public class HttpImageFetchActor implements ImageFetchActor {

    private static final Logger log = LoggerFactory.getLogger(HttpImageFetchActor.class);

    private final CloseableHttpClient imageHttpClient;
    private final AppImageProperties appImageProperties;
    private final ObjectProvider<MeterRegistry> meterRegistryProvider;

    public HttpImageFetchActor(@Qualifier("imageHttpClient") CloseableHttpClient imageHttpClient,
                               AppImageProperties appImageProperties,
                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.imageHttpClient = imageHttpClient;
        this.appImageProperties = appImageProperties;
        this.meterRegistryProvider = meterRegistryProvider;
    }

    @Override
    public boolean fetch(ImageFetchJob job) {
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable();
        String priority = job.getPriority() == null ? "NONE" : job.getPriority().name();
        if (job.getKey() == null || !TextUtil.hasText(job.getSource())) {
            log.warn("IMAGE_FETCH_INVALID libraryId={} source={}", job.getLibraryId(), job.getSource());
            MeterSupport.incrementCounter(meterRegistry, "media.pipeline.image.failed", 1, "priority", priority);
            return false;
        }
        Path target = targetPath(job);
        if (Files.exists(target)) {
            MeterSupport.incrementCounter(meterRegistry, "media.pipeline.image.cached", 1, "priority", priority);
            return true;
        }
        String url = resolveUrl(job);
        long startNanos = System.nanoTime();
        try {
            download(url, target);
            MeterSupport.recordDuration(meterRegistry, "media.pipeline.image.duration",
                    System.nanoTime() - startNanos, "priority", priority);
            MeterSupport.incrementCounter(meterRegistry, "media.pipeline.image.fetched", 1, "priority", priority);
            log.debug("IMAGE_FETCHED mediaId={} type={} target={}", job.getKey().getMediaId(),
                    job.getKey().getImageType(), target);
            return true;
        } catch (IOException e) {
            MeterSupport.incrementCounter(meterRegistry, "media.pipeline.image.failed", 1, "priority", priority);
            log.warn("IMAGE_FETCH_FAILED mediaId={} type={} url={} msg={}",
                    job.getKey().getMediaId(), job.getKey().getImageType(), url, e.getMessage());
            return false;
        }
    }

    Path targetPath(ImageFetchJob job) {
        ImageKey key = job.getKey();
        String variant = TextUtil.hasText(key.getVariant()) ? key.getVariant() : appImageProperties.getDefaultVariant();
        String fileName = key.getImageType() + "_" + variant + "_" + key.getOrderIndex() + "." + extension(job.getSource());
        return Paths.get(appImageProperties.getCacheDir())
                .resolve(key.getMediaType() == null ? "unknown" : key.getMediaType().name().toLowerCase(Locale.ROOT))
                .resolve(key.getMediaId())
                .resolve(fileName);
    }

    String resolveUrl(ImageFetchJob job) {
        String source = job.getSource();
        if (source.startsWith("http://") || source.startsWith("https://")) {
            return source;
        }
        String variant = job.getKey() != null && TextUtil.hasText(job.getKey().getVariant())
                ? job.getKey().getVariant() : appImageProperties.getDefaultVariant();
        String base = appImageProperties.getBaseUrl();
        StringBuilder url = new StringBuilder(base);
        if (!base.endsWith("/")) {
            url.append('/');
        }
        url.append(variant);
        if (!source.startsWith("/")) {
            url.append('/');
        }
        return url.append(source).toString();
    }

    private void download(String url, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        HttpGet request = new HttpGet(url);
        try (CloseableHttpResponse response = imageHttpClient.execute(request)) {
            int statusCode = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            if (statusCode != HttpStatus.SC_OK || entity == null) {
                EntityUtils.consumeQuietly(entity);
                throw new IOException("Image request failed, status=" + statusCode);
            }
            Path temp = Files.createTempFile(target.getParent(), ".fetch-", ".tmp");
            try {
                try (InputStream in = entity.getContent()) {
                    Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
                }
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        }
    }

    private String extension(String source) {
        String name = source;
        int query = name.indexOf('?');
        if (query >= 0) {
            name = name.substring(0, query);
        }
        int slash = name.lastIndexOf('/');
        int dot = name.lastIndexOf('.');
        if (dot > slash && dot < name.length() - 1) {
            String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (ext.length() <= 5 && ext.chars().allMatch(Character::isLetterOrDigit)) {
                return ext;
            }
        }
        return "jpg";
    }
}
