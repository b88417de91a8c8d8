package com.example.mediaindexer.infrastructure.persistence.mapper;

import com.example.mediaindexer.infrastructure.persistence.entity.FileWatchEventEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface FileWatchEventMapper {

    /**
     * Appends an event. A duplicate idempotency key keeps the stored row and reports its id as the
     * generated key.
     */
    @Insert("INSERT INTO file_watch_event(version, library_id, root_id, kind, path, old_path, file_size, "
            + "detected_at, correlation_id, idempotency_key) "
            + "VALUES(#{version}, #{libraryId}, #{rootId}, #{kind}, #{path}, #{oldPath}, #{fileSize}, "
            + "#{detectedAt}, #{correlationId}, #{idempotencyKey}) "
            + "ON DUPLICATE KEY UPDATE id = LAST_INSERT_ID(id)")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(FileWatchEventEntity entity);

    @Select("SELECT e.id, e.version, e.library_id, e.root_id, e.kind, e.path, e.old_path, e.file_size, "
            + "e.detected_at, e.correlation_id, e.idempotency_key, e.created_at "
            + "FROM file_watch_event e "
            + "LEFT JOIN file_watch_ack a ON a.library_id = e.library_id AND a.seq = e.id "
            + "WHERE e.library_id = #{libraryId} AND e.id > #{afterSeq} AND e.detected_at < #{detectedBefore} "
            + "AND a.seq IS NULL "
            + "ORDER BY e.id LIMIT #{limit}")
    List<FileWatchEventEntity> selectUnacknowledged(@Param("libraryId") Long libraryId,
                                                    @Param("afterSeq") long afterSeq,
                                                    @Param("detectedBefore") LocalDateTime detectedBefore,
                                                    @Param("limit") int limit);

    @Select("SELECT MIN(e.id) FROM file_watch_event e "
            + "LEFT JOIN file_watch_ack a ON a.library_id = e.library_id AND a.seq = e.id "
            + "WHERE e.library_id = #{libraryId} AND e.id > #{afterSeq} AND e.id <= #{upToSeq} AND a.seq IS NULL")
    Long selectFirstUnacknowledgedSeq(@Param("libraryId") Long libraryId,
                                      @Param("afterSeq") long afterSeq,
                                      @Param("upToSeq") long upToSeq);

    @Select("SELECT MAX(id) FROM file_watch_event WHERE library_id = #{libraryId}")
    Long selectMaxSeq(@Param("libraryId") Long libraryId);

    @Insert("<script>"
            + "INSERT IGNORE INTO file_watch_ack(library_id, seq) VALUES "
            + "<foreach item='seq' collection='seqs' separator=','>"
            + "(#{libraryId}, #{seq})"
            + "</foreach>"
            + "</script>")
    int insertAcks(@Param("libraryId") Long libraryId, @Param("seqs") List<Long> seqs);

    @Delete("DELETE FROM file_watch_ack WHERE library_id = #{libraryId} AND seq <= #{seq}")
    int deleteAcksUpTo(@Param("libraryId") Long libraryId, @Param("seq") long seq);
}
