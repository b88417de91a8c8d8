package com.example.mediaindexer.application.pipeline;

import java.util.concurrent.CompletableFuture;

/**
 * Delivery channel into the pipeline. Callers do not know whether the command runs in-process
 * or behind a queue.
 *
 * <p>A command the mailbox cannot accept yields a future that is already completed exceptionally.
 */
public interface ActorMailbox {

    CompletableFuture<PipelineReceipt> send(PipelineCommand command);
}
