package com.example.playlistrouter.infrastructure.persistence.mapper;

import com.example.playlistrouter.infrastructure.persistence.entity.SpotifyIntegrationEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface SpotifyIntegrationMapper {

    @Select("SELECT id, user_id, spotify_user_id, access_token, token_type, expires_at, created_at, updated_at "
            + "FROM spotify_integration WHERE user_id = #{userId} LIMIT 1")
    SpotifyIntegrationEntity selectByUserId(@Param("userId") Long userId);
}
