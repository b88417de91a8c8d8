package com.example.mediaindexer.infrastructure.persistence.mapper;

import com.example.mediaindexer.infrastructure.persistence.entity.MediaReferenceEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface MediaReferenceMapper {

    @Select("SELECT id, media_type, external_id, parent_id, title, release_year, season_number, episode_number, "
            + "overview, poster_path, backdrop_path, created_at, updated_at "
            + "FROM media_reference WHERE id = #{id} AND media_type = #{mediaType}")
    MediaReferenceEntity selectByIdAndType(@Param("id") String id, @Param("mediaType") String mediaType);

    @Insert("INSERT INTO media_reference(id, media_type, external_id, parent_id, title, release_year, "
            + "season_number, episode_number, overview, poster_path, backdrop_path) "
            + "VALUES(#{id}, #{mediaType}, #{externalId}, #{parentId}, #{title}, #{releaseYear}, "
            + "#{seasonNumber}, #{episodeNumber}, #{overview}, #{posterPath}, #{backdropPath}) "
            + "ON DUPLICATE KEY UPDATE external_id = VALUES(external_id), parent_id = VALUES(parent_id), "
            + "title = VALUES(title), release_year = VALUES(release_year), overview = VALUES(overview), "
            + "poster_path = VALUES(poster_path), backdrop_path = VALUES(backdrop_path), updated_at = NOW()")
    int upsert(MediaReferenceEntity entity);
}
