package com.example.sourcesync.infrastructure.persistence.mapper;

import com.example.sourcesync.infrastructure.persistence.entity.SyncSourceConfigEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SyncSourceConfigMapper {

    @Insert("INSERT INTO sync_source_config(user_id, name, source_type, base_url, username, password_enc, "
            + "root_path, enabled) "
            + "VALUES(#{userId}, #{name}, #{sourceType}, #{baseUrl}, #{username}, #{passwordEnc}, "
            + "#{rootPath}, #{enabled})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SyncSourceConfigEntity entity);

    @Select("SELECT id, user_id, name, source_type, base_url, username, password_enc, root_path, enabled, "
            + "last_sync_at, created_at, updated_at "
            + "FROM sync_source_config WHERE id = #{id}")
    SyncSourceConfigEntity selectById(@Param("id") Long id);

    @Select("SELECT id, user_id, name, source_type, base_url, username, password_enc, root_path, enabled, "
            + "last_sync_at, created_at, updated_at "
            + "FROM sync_source_config WHERE enabled = 1 ORDER BY id ASC")
    List<SyncSourceConfigEntity> selectEnabled();

    @Update("UPDATE sync_source_config SET last_sync_at = NOW(), updated_at = NOW() WHERE id = #{id}")
    int touchLastSync(@Param("id") Long id);
}
