package com.example.mediaindexer.infrastructure.metadata;

import com.example.mediaindexer.domain.enumtype.MediaType;
import com.example.mediaindexer.domain.model.DetailedMediaInfo;
import com.example.mediaindexer.domain.model.SearchQuery;
import com.example.mediaindexer.domain.model.SearchResult;
import java.util.List;

/**
 * External title and artwork lookup. No implementation ships with the indexer; when none is
 * registered the enrich stage runs degraded.
 */
public interface MetadataProvider {

    List<SearchResult> search(SearchQuery query) throws MetadataProviderException;

    DetailedMediaInfo getMetadata(String externalId, MediaType mediaType) throws MetadataProviderException;
}
