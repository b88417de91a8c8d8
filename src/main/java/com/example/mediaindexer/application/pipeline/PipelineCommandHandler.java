package com.example.mediaindexer.application.pipeline;

public interface PipelineCommandHandler {

    PipelineReceipt handleFsEvents(FsEventsCommand command);

    PipelineReceipt handleFolderScan(FolderScanCommand command);
}
