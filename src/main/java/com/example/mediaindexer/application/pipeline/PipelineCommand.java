package com.example.mediaindexer.application.pipeline;

/**
 * Unit of work delivered through an {@link ActorMailbox}.
 */
public abstract class PipelineCommand {

    private final Long libraryId;
    private final String correlationId;

    protected PipelineCommand(Long libraryId, String correlationId) {
        this.libraryId = libraryId;
        this.correlationId = correlationId;
    }

    public Long getLibraryId() {
        return libraryId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public abstract PipelineReceipt dispatchTo(PipelineCommandHandler handler);
}
