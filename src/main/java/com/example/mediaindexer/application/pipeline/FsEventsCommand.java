package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.domain.enumtype.ScanReason;
import com.example.mediaindexer.domain.model.DurableEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One flushed batch of persisted events for a single root. Every event shares the command's
 * correlation id.
 */
public class FsEventsCommand extends PipelineCommand {

    private final Long rootId;
    private final List<DurableEvent> events;
    private final ScanReason reason;

    public FsEventsCommand(Long libraryId, Long rootId, String correlationId, List<DurableEvent> events,
                           ScanReason reason) {
        super(libraryId, correlationId);
        this.rootId = rootId;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.reason = reason;
    }

    public Long getRootId() {
        return rootId;
    }

    public List<DurableEvent> getEvents() {
        return events;
    }

    public ScanReason getReason() {
        return reason;
    }

    public List<Long> seqs() {
        List<Long> seqs = new ArrayList<>(events.size());
        for (DurableEvent event : events) {
            if (event.getSeq() != null) {
                seqs.add(event.getSeq());
            }
        }
        return seqs;
    }

    public long maxSeq() {
        long max = 0L;
        for (DurableEvent event : events) {
            if (event.getSeq() != null && event.getSeq() > max) {
                max = event.getSeq();
            }
        }
        return max;
    }

    @Override
    public PipelineReceipt dispatchTo(PipelineCommandHandler handler) {
        return handler.handleFsEvents(this);
    }

    @Override
    public String toString() {
        return "FsEventsCommand{libraryId=" + getLibraryId() + ", rootId=" + rootId + ", events=" + events.size()
                + ", reason=" + reason + ", correlationId=" + getCorrelationId() + "}";
    }
}
