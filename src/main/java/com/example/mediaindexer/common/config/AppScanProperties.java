package com.example.mediaindexer.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.scan")
public class AppScanProperties {

    private List<String> mediaExtensions = new ArrayList<>(Arrays.asList(
            "mkv", "mp4", "m4v", "avi", "mov", "webm", "ts", "wmv", "mp3", "flac", "m4a", "ogg", "wav"));

    /**
     * Size of the per-scan error log. Older entries are dropped; the error count keeps counting.
     */
    private int maxRecordedErrors = 200;

    private int analyzeThreadCount = 2;

    private int analyzeQueueCapacity = 256;

    private long probeTimeoutMs = 15000;

    /**
     * Worker threads shared by all scans for per-item pipeline work.
     */
    private int pipelineWorkerThreadCount = 4;

    private int pipelineWorkerQueueCapacity = 512;

    private int mailboxQueueCapacity = 1024;

    private int imageFetchThreadCount = 2;

    private int imageFetchQueueCapacity = 2048;

    public Set<String> normalizedMediaExtensions() {
        return mediaExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
