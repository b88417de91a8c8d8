package com.example.mediaindexer.infrastructure.persistence;

import com.example.mediaindexer.common.exception.MediaReferenceNotFoundException;
import com.example.mediaindexer.domain.model.MediaReference;

/**
 * Store of logical movie, series, season and episode references. Each lookup either returns a
 * hydrated reference or throws {@link MediaReferenceNotFoundException}.
 */
public interface MediaReferencesRepository {

    MediaReference getMovieReference(String id);

    MediaReference getSeriesReference(String id);

    MediaReference getSeasonReference(String id);

    MediaReference getEpisodeReference(String id);

    void saveReference(MediaReference reference);
}
