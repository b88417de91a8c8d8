package com.example.mediaindexer.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface FileWatchCursorMapper {

    @Select("SELECT last_seq FROM file_watch_cursor WHERE library_id = #{libraryId}")
    Long selectLastSeq(@Param("libraryId") Long libraryId);

    @Insert("INSERT INTO file_watch_cursor(library_id, last_seq) VALUES(#{libraryId}, #{seq}) "
            + "ON DUPLICATE KEY UPDATE last_seq = GREATEST(last_seq, VALUES(last_seq))")
    int advance(@Param("libraryId") Long libraryId, @Param("seq") long seq);
}
