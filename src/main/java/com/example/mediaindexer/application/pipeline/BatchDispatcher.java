package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.domain.enumtype.ScanReason;
import com.example.mediaindexer.domain.model.DurableEvent;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

@Component
public class BatchDispatcher {

    /**
     * Sends one command carrying the whole batch. An empty batch sends nothing.
     */
    public CompletableFuture<PipelineReceipt> dispatchBatch(ActorMailbox mailbox, Long libraryId, Long rootId,
                                                            List<DurableEvent> events) {
        return dispatchBatch(mailbox, libraryId, rootId, events, ScanReason.HOT_CHANGE);
    }

    public CompletableFuture<PipelineReceipt> dispatchBatch(ActorMailbox mailbox, Long libraryId, Long rootId,
                                                            List<DurableEvent> events, ScanReason reason) {
        if (events == null || events.isEmpty()) {
            return CompletableFuture.completedFuture(PipelineReceipt.empty(libraryId));
        }
        String correlationId = events.get(0).getCorrelationId();
        return mailbox.send(new FsEventsCommand(libraryId, rootId, correlationId, events, reason));
    }
}
