package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.common.util.MeterSupport;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands commands to a bounded executor. With a single consumer thread commands run in the order
 * they were sent.
 */
public class QueuedActorMailbox implements ActorMailbox {

    private static final Logger log = LoggerFactory.getLogger(QueuedActorMailbox.class);

    private final PipelineCommandHandler handler;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;

    public QueuedActorMailbox(PipelineCommandHandler handler, ExecutorService executor, MeterRegistry meterRegistry) {
        this.handler = handler;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public CompletableFuture<PipelineReceipt> send(PipelineCommand command) {
        try {
            CompletableFuture<PipelineReceipt> future = CompletableFuture.supplyAsync(
                    () -> command.dispatchTo(handler), executor);
            MeterSupport.incrementCounter(meterRegistry, "media.pipeline.mailbox.accepted", 1,
                    "command", command.getClass().getSimpleName());
            return future;
        } catch (RejectedExecutionException e) {
            log.warn("MAILBOX_REJECTED command={} msg={}", command, e.getMessage());
            MeterSupport.incrementCounter(meterRegistry, "media.pipeline.mailbox.rejected", 1,
                    "command", command.getClass().getSimpleName());
            CompletableFuture<PipelineReceipt> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
    }
}
