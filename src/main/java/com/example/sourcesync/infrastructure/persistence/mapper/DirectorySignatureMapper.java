package com.example.sourcesync.infrastructure.persistence.mapper;

import com.example.sourcesync.infrastructure.persistence.entity.DirectorySignatureEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface DirectorySignatureMapper {

    @Select("SELECT id, user_id, config_id, dir_path, dir_path_md5, dir_etag, file_count, subdir_count, "
            + "last_scanned_at, created_at, updated_at "
            + "FROM directory_signature WHERE config_id = #{configId} AND dir_path_md5 = #{dirPathMd5}")
    DirectorySignatureEntity selectByConfigAndDirPathMd5(@Param("configId") Long configId,
                                                         @Param("dirPathMd5") String dirPathMd5);

    @Select("SELECT id, user_id, config_id, dir_path, dir_path_md5, dir_etag, file_count, subdir_count, "
            + "last_scanned_at, created_at, updated_at "
            + "FROM directory_signature WHERE config_id = #{configId} "
            + "AND dir_path LIKE #{likePattern} ESCAPE '\\\\'")
    List<DirectorySignatureEntity> selectByDirectoryPrefix(@Param("configId") Long configId,
                                                           @Param("likePattern") String likePattern);

    @Insert("INSERT INTO directory_signature(user_id, config_id, dir_path, dir_path_md5, dir_etag, "
            + "file_count, subdir_count, last_scanned_at) "
            + "VALUES(#{userId}, #{configId}, #{dirPath}, #{dirPathMd5}, #{dirEtag}, "
            + "#{fileCount}, #{subdirCount}, NOW()) "
            + "ON DUPLICATE KEY UPDATE "
            + "dir_etag = VALUES(dir_etag), file_count = VALUES(file_count), "
            + "subdir_count = VALUES(subdir_count), last_scanned_at = NOW(), updated_at = NOW()")
    int upsert(DirectorySignatureEntity entity);

    @Delete("DELETE FROM directory_signature WHERE config_id = #{configId} AND dir_path_md5 = #{dirPathMd5}")
    int deleteByConfigAndDirPathMd5(@Param("configId") Long configId, @Param("dirPathMd5") String dirPathMd5);
}
