package com.example.playlistrouter.infrastructure.persistence.mapper;

import com.example.playlistrouter.infrastructure.persistence.entity.ChildPlaylistEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ChildPlaylistMapper {

    String COLUMNS = "id, user_id, base_playlist_id, name, description, spotify_playlist_id, "
            + "filter_rules, is_active, created_at, updated_at";

    @Insert("INSERT INTO child_playlist(user_id, base_playlist_id, name, description, spotify_playlist_id, "
            + "filter_rules, is_active) "
            + "VALUES(#{userId}, #{basePlaylistId}, #{name}, #{description}, #{spotifyPlaylistId}, "
            + "#{filterRules}, #{isActive})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(ChildPlaylistEntity entity);

    @Select("SELECT " + COLUMNS + " FROM child_playlist WHERE id = #{id} AND user_id = #{userId}")
    ChildPlaylistEntity selectById(@Param("id") Long id, @Param("userId") Long userId);

    @Select("SELECT " + COLUMNS + " FROM child_playlist "
            + "WHERE base_playlist_id = #{basePlaylistId} AND user_id = #{userId} ORDER BY id ASC")
    List<ChildPlaylistEntity> selectByBasePlaylistId(@Param("basePlaylistId") Long basePlaylistId,
                                                     @Param("userId") Long userId);

    @Select("SELECT " + COLUMNS + " FROM child_playlist "
            + "WHERE base_playlist_id = #{basePlaylistId} AND user_id = #{userId} AND is_active = 1 "
            + "ORDER BY id ASC")
    List<ChildPlaylistEntity> selectActiveByBasePlaylistId(@Param("basePlaylistId") Long basePlaylistId,
                                                           @Param("userId") Long userId);

    @Update("UPDATE child_playlist SET name = #{name}, description = #{description}, "
            + "filter_rules = #{filterRules}, is_active = #{isActive}, updated_at = NOW() "
            + "WHERE id = #{id} AND user_id = #{userId}")
    int updateDetails(ChildPlaylistEntity entity);

    @Update("UPDATE child_playlist SET spotify_playlist_id = #{spotifyPlaylistId}, updated_at = NOW() "
            + "WHERE id = #{id} AND user_id = #{userId}")
    int updateSpotifyPlaylistId(@Param("id") Long id,
                                @Param("userId") Long userId,
                                @Param("spotifyPlaylistId") String spotifyPlaylistId);

    @Delete("DELETE FROM child_playlist WHERE id = #{id} AND user_id = #{userId}")
    int deleteById(@Param("id") Long id, @Param("userId") Long userId);

    @Delete("DELETE FROM child_playlist WHERE base_playlist_id = #{basePlaylistId} AND user_id = #{userId}")
    int deleteByBasePlaylistId(@Param("basePlaylistId") Long basePlaylistId, @Param("userId") Long userId);
}
