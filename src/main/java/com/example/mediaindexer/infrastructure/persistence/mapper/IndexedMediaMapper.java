package com.example.mediaindexer.infrastructure.persistence.mapper;

import com.example.mediaindexer.infrastructure.persistence.entity.IndexedMediaEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface IndexedMediaMapper {

    String COLUMNS = "id, media_id, library_id, root_id, path, path_md5, media_type, logical_id, fingerprint, "
            + "file_size, file_mtime, streams_json, idempotency_key, last_scan_id, deleted, created_at, updated_at";

    @Select("SELECT " + COLUMNS + " FROM indexed_media WHERE library_id = #{libraryId} AND path_md5 = #{pathMd5}")
    IndexedMediaEntity selectByLibraryAndPathMd5(@Param("libraryId") Long libraryId,
                                                 @Param("pathMd5") String pathMd5);

    @Select("SELECT " + COLUMNS + " FROM indexed_media "
            + "WHERE library_id = #{libraryId} AND idempotency_key = #{idempotencyKey} LIMIT 1")
    IndexedMediaEntity selectByIdempotencyKey(@Param("libraryId") Long libraryId,
                                              @Param("idempotencyKey") String idempotencyKey);

    @Select("SELECT id, path, path_md5 FROM indexed_media "
            + "WHERE library_id = #{libraryId} AND path LIKE CONCAT(#{prefix}, '%') AND deleted = 0")
    List<IndexedMediaEntity> selectLiveByPrefix(@Param("libraryId") Long libraryId, @Param("prefix") String prefix);

    @Insert("INSERT INTO indexed_media(media_id, library_id, root_id, path, path_md5, media_type, logical_id, "
            + "fingerprint, file_size, file_mtime, streams_json, idempotency_key, last_scan_id, deleted) "
            + "VALUES(#{mediaId}, #{libraryId}, #{rootId}, #{path}, #{pathMd5}, #{mediaType}, #{logicalId}, "
            + "#{fingerprint}, #{fileSize}, #{fileMtime}, #{streamsJson}, #{idempotencyKey}, #{lastScanId}, 0) "
            + "ON DUPLICATE KEY UPDATE media_id = VALUES(media_id), root_id = VALUES(root_id), "
            + "path = VALUES(path), media_type = VALUES(media_type), logical_id = VALUES(logical_id), "
            + "fingerprint = VALUES(fingerprint), file_size = VALUES(file_size), file_mtime = VALUES(file_mtime), "
            + "streams_json = VALUES(streams_json), idempotency_key = VALUES(idempotency_key), "
            + "last_scan_id = VALUES(last_scan_id), deleted = 0, updated_at = NOW()")
    int upsert(IndexedMediaEntity entity);

    @Update("UPDATE indexed_media SET path = #{path}, path_md5 = #{pathMd5}, updated_at = NOW() WHERE id = #{id}")
    int relocate(@Param("id") Long id, @Param("path") String path, @Param("pathMd5") String pathMd5);

    @Update("UPDATE indexed_media SET deleted = 1, updated_at = NOW() "
            + "WHERE library_id = #{libraryId} AND path_md5 = #{pathMd5} AND deleted = 0")
    int markDeleted(@Param("libraryId") Long libraryId, @Param("pathMd5") String pathMd5);

    @Update("UPDATE indexed_media SET deleted = 1, updated_at = NOW() "
            + "WHERE library_id = #{libraryId} AND path LIKE CONCAT(#{prefix}, '%') AND deleted = 0")
    int markDeletedByPrefix(@Param("libraryId") Long libraryId, @Param("prefix") String prefix);
}
