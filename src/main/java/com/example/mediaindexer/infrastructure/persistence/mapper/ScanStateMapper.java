package com.example.mediaindexer.infrastructure.persistence.mapper;

import com.example.mediaindexer.infrastructure.persistence.entity.ScanStateEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ScanStateMapper {

    String COLUMNS = "id, library_id, scan_type, status, total_folders, processed_folders, total_files, "
            + "processed_files, current_path, error_count, errors_json, options_json, started_at, "
            + "completed_at, created_at, updated_at";

    @Insert("INSERT INTO scan_state(library_id, scan_type, status, total_folders, processed_folders, "
            + "total_files, processed_files, current_path, error_count, errors_json, options_json, "
            + "started_at, completed_at, created_at, updated_at) "
            + "VALUES(#{libraryId}, #{scanType}, #{status}, #{totalFolders}, #{processedFolders}, "
            + "#{totalFiles}, #{processedFiles}, #{currentPath}, #{errorCount}, #{errorsJson}, #{optionsJson}, "
            + "#{startedAt}, #{completedAt}, #{createdAt}, #{updatedAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(ScanStateEntity entity);

    @Select("SELECT " + COLUMNS + " FROM scan_state WHERE id = #{id}")
    ScanStateEntity selectById(@Param("id") Long id);

    @Update("UPDATE scan_state SET status = #{status}, started_at = #{startedAt}, completed_at = #{completedAt}, "
            + "updated_at = #{updatedAt} "
            + "WHERE id = #{id} AND status = #{expectedStatus}")
    int updateStatus(@Param("id") Long id,
                     @Param("expectedStatus") String expectedStatus,
                     @Param("status") String status,
                     @Param("startedAt") LocalDateTime startedAt,
                     @Param("completedAt") LocalDateTime completedAt,
                     @Param("updatedAt") LocalDateTime updatedAt);

    @Update("UPDATE scan_state SET total_folders = #{totalFolders}, processed_folders = #{processedFolders}, "
            + "total_files = #{totalFiles}, processed_files = #{processedFiles}, current_path = #{currentPath}, "
            + "updated_at = #{updatedAt} "
            + "WHERE id = #{id}")
    int updateProgress(@Param("id") Long id,
                       @Param("totalFolders") int totalFolders,
                       @Param("processedFolders") int processedFolders,
                       @Param("totalFiles") int totalFiles,
                       @Param("processedFiles") int processedFiles,
                       @Param("currentPath") String currentPath,
                       @Param("updatedAt") LocalDateTime updatedAt);

    @Update("UPDATE scan_state SET error_count = #{errorCount}, errors_json = #{errorsJson}, "
            + "updated_at = #{updatedAt} "
            + "WHERE id = #{id}")
    int updateErrors(@Param("id") Long id,
                     @Param("errorCount") int errorCount,
                     @Param("errorsJson") String errorsJson,
                     @Param("updatedAt") LocalDateTime updatedAt);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM scan_state WHERE status IN "
            + "<foreach collection='statuses' item='status' open='(' separator=',' close=')'>#{status}</foreach>"
            + "<if test='libraryId != null'> AND library_id = #{libraryId}</if>"
            + " ORDER BY id"
            + "</script>")
    List<ScanStateEntity> selectByStatuses(@Param("libraryId") Long libraryId,
                                           @Param("statuses") List<String> statuses);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM scan_state WHERE library_id = #{libraryId}"
            + "<if test='scanType != null'> AND scan_type = #{scanType}</if>"
            + "<if test='status != null'> AND status = #{status}</if>"
            + " ORDER BY id DESC LIMIT 1"
            + "</script>")
    ScanStateEntity selectLatest(@Param("libraryId") Long libraryId,
                                 @Param("scanType") String scanType,
                                 @Param("status") String status);
}
