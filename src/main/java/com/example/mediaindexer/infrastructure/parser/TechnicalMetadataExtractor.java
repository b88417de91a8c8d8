package com.example.mediaindexer.infrastructure.parser;

import com.example.mediaindexer.domain.model.TechnicalMetadata;
import java.io.File;

public interface TechnicalMetadataExtractor {

    TechnicalMetadata extract(File mediaFile) throws Exception;
}
