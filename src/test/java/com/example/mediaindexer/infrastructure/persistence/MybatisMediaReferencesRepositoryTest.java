package com.example.mediaindexer.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mediaindexer.common.exception.MediaReferenceNotFoundException;
import com.example.mediaindexer.domain.enumtype.MediaType;
import com.example.mediaindexer.domain.model.MediaReference;
import com.example.mediaindexer.infrastructure.persistence.entity.MediaReferenceEntity;
import com.example.mediaindexer.infrastructure.persistence.mapper.MediaReferenceMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class MybatisMediaReferencesRepositoryTest {

    private final MediaReferenceMapper mapper = mock(MediaReferenceMapper.class);
    private final MybatisMediaReferencesRepository repository = new MybatisMediaReferencesRepository(mapper);

    @Test
    void lookupShouldBeScopedToTheRequestedType() {
        MediaReferenceEntity entity = new MediaReferenceEntity();
        entity.setId("ep-1");
        entity.setMediaType("EPISODE");
        entity.setParentId("season-1");
        entity.setTitle("Show S01E02");
        entity.setSeasonNumber(1);
        entity.setEpisodeNumber(2);
        when(mapper.selectByIdAndType("ep-1", "EPISODE")).thenReturn(entity);

        MediaReference episode = repository.getEpisodeReference("ep-1");

        assertEquals(MediaType.EPISODE, episode.getMediaType());
        assertEquals("season-1", episode.getParentId());
        assertEquals(2, episode.getEpisodeNumber());
        MediaReferenceNotFoundException error = assertThrows(MediaReferenceNotFoundException.class,
                () -> repository.getMovieReference("ep-1"));
        assertEquals(MediaType.MOVIE, error.getMediaType());
        assertEquals("ep-1", error.getReferenceId());
    }

    @Test
    void saveShouldUpsertEntity() {
        MediaReference movie = new MediaReference();
        movie.setId("movie-1");
        movie.setMediaType(MediaType.MOVIE);
        movie.setExternalId("tt-heat");
        movie.setTitle("Heat");
        movie.setYear(1995);

        repository.saveReference(movie);

        ArgumentCaptor<MediaReferenceEntity> captor = ArgumentCaptor.forClass(MediaReferenceEntity.class);
        verify(mapper).upsert(captor.capture());
        assertEquals("MOVIE", captor.getValue().getMediaType());
        assertEquals(1995, captor.getValue().getReleaseYear());
        assertEquals("tt-heat", captor.getValue().getExternalId());
    }
}
