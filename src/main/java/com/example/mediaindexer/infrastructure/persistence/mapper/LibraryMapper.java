package com.example.mediaindexer.infrastructure.persistence.mapper;

import com.example.mediaindexer.infrastructure.persistence.entity.LibraryEntity;
import com.example.mediaindexer.infrastructure.persistence.entity.LibraryRootEntity;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface LibraryMapper {

    @Select("SELECT id, name, library_type, enabled, created_at, updated_at FROM media_library "
            + "WHERE enabled = 1 ORDER BY id")
    List<LibraryEntity> selectEnabled();

    @Select("SELECT id, name, library_type, enabled, created_at, updated_at FROM media_library WHERE id = #{id}")
    LibraryEntity selectById(@Param("id") Long id);

    @Select("SELECT id, library_id, path, enabled FROM media_library_root "
            + "WHERE library_id = #{libraryId} AND enabled = 1 ORDER BY id")
    List<LibraryRootEntity> selectRootsByLibraryId(@Param("libraryId") Long libraryId);
}
