package com.example.mediaindexer.infrastructure.persistence;

import com.example.mediaindexer.common.exception.MediaReferenceNotFoundException;
import com.example.mediaindexer.domain.enumtype.MediaType;
import com.example.mediaindexer.domain.model.MediaReference;
import com.example.mediaindexer.infrastructure.persistence.entity.MediaReferenceEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.MediaReferenceMapper;
import org.springframework.stereotype.Repository;

@Repository
public class MybatisMediaReferencesRepository implements MediaReferencesRepository {

    private final MediaReferenceMapper mediaReferenceMapper;

    public MybatisMediaReferencesRepository(MediaReferenceMapper mediaReferenceMapper) {
        this.mediaReferenceMapper = mediaReferenceMapper;
    }

    @Override
    public MediaReference getMovieReference(String id) {
        return load(id, MediaType.MOVIE);
    }

    @Override
    public MediaReference getSeriesReference(String id) {
        return load(id, MediaType.SERIES);
    }

    @Override
    public MediaReference getSeasonReference(String id) {
        return load(id, MediaType.SEASON);
    }

    @Override
    public MediaReference getEpisodeReference(String id) {
        return load(id, MediaType.EPISODE);
    }

    @Override
    public void saveReference(MediaReference reference) {
        MediaReferenceEntity entity = new MediaReferenceEntity();
        entity.setId(reference.getId());
        entity.setMediaType(reference.getMediaType().name());
        entity.setExternalId(reference.getExternalId());
        entity.setParentId(reference.getParentId());
        entity.setTitle(reference.getTitle());
        entity.setReleaseYear(reference.getYear());
        entity.setSeasonNumber(reference.getSeasonNumber());
        entity.setEpisodeNumber(reference.getEpisodeNumber());
        entity.setOverview(reference.getOverview());
        entity.setPosterPath(reference.getPosterPath());
        entity.setBackdropPath(reference.getBackdropPath());
        mediaReferenceMapper.upsert(entity);
    }

    private MediaReference load(String id, MediaType mediaType) {
        MediaReferenceEntity entity = mediaReferenceMapper.selectByIdAndType(id, mediaType.name());
        if (entity == null) {
            throw new MediaReferenceNotFoundException(mediaType, id);
        }
        MediaReference reference = new MediaReference();
        reference.setId(entity.getId());
        reference.setMediaType(mediaType);
        reference.setExternalId(entity.getExternalId());
        reference.setParentId(entity.getParentId());
        reference.setTitle(entity.getTitle());
        reference.setYear(entity.getReleaseYear());
        reference.setSeasonNumber(entity.getSeasonNumber());
        reference.setEpisodeNumber(entity.getEpisodeNumber());
        reference.setOverview(entity.getOverview());
        reference.setPosterPath(entity.getPosterPath());
        reference.setBackdropPath(entity.getBackdropPath());
        return reference;
    }
}
