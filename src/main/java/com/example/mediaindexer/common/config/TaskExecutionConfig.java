package com.example.mediaindexer.common.config;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private final List<ExecutorService> managedExecutors = new ArrayList<>();

    /**
     * Long-lived watcher threads: one per watched root plus one flush thread per library.
     */
    @Bean
    public ExecutorService watchTaskExecutor() {
        return register(new ThreadPoolExecutor(
                0,
                Integer.MAX_VALUE,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new NamedThreadFactory("media-watch-"),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    /**
     * Single consumer behind the queued actor mailbox. One thread keeps batches in dispatch order.
     */
    @Bean
    public ExecutorService pipelineMailboxExecutor(AppScanProperties appScanProperties) {
        return register(new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(1, appScanProperties.getMailboxQueueCapacity())),
                new NamedThreadFactory("media-mailbox-"),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    @Bean
    public ExecutorService pipelineWorkerExecutor(AppScanProperties appScanProperties) {
        int core = Math.max(1, appScanProperties.getPipelineWorkerThreadCount());
        return register(new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(20, appScanProperties.getPipelineWorkerQueueCapacity())),
                new NamedThreadFactory("media-pipeline-"),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    @Bean
    public ExecutorService mediaAnalyzeExecutor(AppScanProperties appScanProperties) {
        int core = Math.max(1, appScanProperties.getAnalyzeThreadCount());
        return register(new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, appScanProperties.getAnalyzeQueueCapacity())),
                new NamedThreadFactory("media-analyze-"),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    @Bean
    public ExecutorService imageFetchExecutor(AppScanProperties appScanProperties) {
        int core = Math.max(1, appScanProperties.getImageFetchThreadCount());
        return register(new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, appScanProperties.getImageFetchQueueCapacity())),
                new NamedThreadFactory("media-image-"),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    @PreDestroy
    public void shutdown() {
        synchronized (managedExecutors) {
            for (ExecutorService executor : managedExecutors) {
                executor.shutdown();
            }
        }
    }

    private ExecutorService register(ExecutorService executor) {
        synchronized (managedExecutors) {
            managedExecutors.add(executor);
        }
        return executor;
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
