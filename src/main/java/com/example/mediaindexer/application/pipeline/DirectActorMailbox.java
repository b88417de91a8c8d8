package com.example.mediaindexer.application.pipeline;

import java.util.concurrent.CompletableFuture;

/**
 * Runs each command on the calling thread.
 */
public class DirectActorMailbox implements ActorMailbox {

    private final PipelineCommandHandler handler;

    public DirectActorMailbox(PipelineCommandHandler handler) {
        this.handler = handler;
    }

    @Override
    public CompletableFuture<PipelineReceipt> send(PipelineCommand command) {
        CompletableFuture<PipelineReceipt> future = new CompletableFuture<>();
        try {
            future.complete(command.dispatchTo(handler));
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return future;
    }
}
