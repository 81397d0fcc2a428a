package com.example.playlistrouter.infrastructure.persistence.mapper;

import com.example.playlistrouter.infrastructure.persistence.entity.BasePlaylistEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface BasePlaylistMapper {

    @Insert("INSERT INTO base_playlist(user_id, name, spotify_playlist_id, is_active) "
            + "VALUES(#{userId}, #{name}, #{spotifyPlaylistId}, #{isActive})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(BasePlaylistEntity entity);

    @Select("SELECT id, user_id, name, spotify_playlist_id, is_active, created_at, updated_at "
            + "FROM base_playlist WHERE id = #{id} AND user_id = #{userId}")
    BasePlaylistEntity selectById(@Param("id") Long id, @Param("userId") Long userId);

    @Select("SELECT id, user_id, name, spotify_playlist_id, is_active, created_at, updated_at "
            + "FROM base_playlist WHERE user_id = #{userId} ORDER BY created_at DESC, id DESC")
    List<BasePlaylistEntity> selectByUserId(@Param("userId") Long userId);

    @Select("SELECT COUNT(1) FROM base_playlist "
            + "WHERE user_id = #{userId} AND spotify_playlist_id = #{spotifyPlaylistId}")
    int countBySpotifyPlaylistId(@Param("userId") Long userId,
                                 @Param("spotifyPlaylistId") String spotifyPlaylistId);

    @Delete("DELETE FROM base_playlist WHERE id = #{id} AND user_id = #{userId}")
    int deleteById(@Param("id") Long id, @Param("userId") Long userId);
}
