package com.example.mediaindexer.infrastructure.image;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.mediaindexer.common.config.AppImageProperties;
import com.example.mediaindexer.domain.enumtype.ImageFetchPriority;
import com.example.mediaindexer.domain.enumtype.MediaType;
import com.example.mediaindexer.domain.model.ImageFetchJob;
import com.example.mediaindexer.domain.model.ImageKey;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.http.HttpVersion;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.message.BasicStatusLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class HttpImageFetchActorTest {

    @TempDir
    Path cacheDir;

    private CloseableHttpClient httpClient;
    private SimpleMeterRegistry meterRegistry;
    private HttpImageFetchActor actor;

    @BeforeEach
    void setUp() {
        httpClient = mock(CloseableHttpClient.class);
        meterRegistry = new SimpleMeterRegistry();
        AppImageProperties properties = new AppImageProperties();
        properties.setCacheDir(cacheDir.toString());
        properties.setBaseUrl("https://images.example.org/t/p");
        actor = new HttpImageFetchActor(httpClient, properties, beanProvider(meterRegistry));
    }

    @Test
    void fetchShouldDownloadIntoCache() throws Exception {
        byte[] body = "jpeg-bytes".getBytes(StandardCharsets.UTF_8);
        CloseableHttpResponse response = response(200, body);
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response);

        assertTrue(actor.fetch(job("/heat.jpg", "w500")));

        ArgumentCaptor<HttpUriRequest> request = ArgumentCaptor.forClass(HttpUriRequest.class);
        verify(httpClient).execute(request.capture());
        assertEquals("https://images.example.org/t/p/w500/heat.jpg", request.getValue().getURI().toString());
        Path cached = cacheDir.resolve("movie").resolve("movie-1").resolve("poster_w500_0.jpg");
        assertArrayEquals(body, Files.readAllBytes(cached));
        verify(response).close();
        assertEquals(1.0, meterRegistry.get("media.pipeline.image.fetched").tag("priority", "POSTER")
                .counter().count());
    }

    @Test
    void cachedImageShouldNotBeFetchedAgain() throws Exception {
        Path cached = cacheDir.resolve("movie").resolve("movie-1").resolve("poster_w500_0.png");
        Files.createDirectories(cached.getParent());
        Files.write(cached, new byte[] {1});

        assertTrue(actor.fetch(job("/heat.png", "w500")));

        verifyNoInteractions(httpClient);
    }

    @Test
    void errorStatusShouldFailWithoutCacheEntry() throws Exception {
        CloseableHttpResponse response = response(404, new byte[0]);
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response);

        assertFalse(actor.fetch(job("/missing.jpg", null)));

        assertFalse(Files.exists(cacheDir.resolve("movie").resolve("movie-1").resolve("poster_original_0.jpg")));
        assertEquals(1.0, meterRegistry.get("media.pipeline.image.failed").counter().count());
    }

    @Test
    void absoluteSourceShouldBeUsedAsIs() {
        ImageFetchJob job = job("https://cdn.example.org/art/backdrop.webp?size=large", null);

        assertEquals("https://cdn.example.org/art/backdrop.webp?size=large", actor.resolveUrl(job));
        assertEquals("poster_original_0.webp", actor.targetPath(job).getFileName().toString());
    }

    @Test
    void jobWithoutSourceShouldFail() {
        assertFalse(actor.fetch(job("", null)));
        verifyNoInteractions(httpClient);
    }

    private ImageFetchJob job(String source, String variant) {
        return ImageFetchJob.builder()
                .libraryId(1L)
                .source(source)
                .key(new ImageKey(MediaType.MOVIE, "movie-1", "poster", 0, variant))
                .priority(ImageFetchPriority.POSTER)
                .build();
    }

    private CloseableHttpResponse response(int status, byte[] body) {
        CloseableHttpResponse response = mock(CloseableHttpResponse.class);
        when(response.getStatusLine()).thenReturn(new BasicStatusLine(HttpVersion.HTTP_1_1, status, "status"));
        when(response.getEntity()).thenReturn(new ByteArrayEntity(body));
        return response;
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
