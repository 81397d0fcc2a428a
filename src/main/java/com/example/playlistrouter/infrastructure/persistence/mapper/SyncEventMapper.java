package com.example.playlistrouter.infrastructure.persistence.mapper;

import com.example.playlistrouter.infrastructure.persistence.entity.SyncEventEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SyncEventMapper {

    String COLUMNS = "id, user_id, base_playlist_id, child_playlist_ids, status, started_at, completed_at, "
            + "tracks_processed, total_api_requests, error_message, created_at, updated_at";

    /** Inserts only when no IN_PROGRESS event exists for the same user and base playlist. */
    @Insert("INSERT INTO sync_event(user_id, base_playlist_id, child_playlist_ids, status, started_at, "
            + "tracks_processed, total_api_requests) "
            + "SELECT #{userId}, #{basePlaylistId}, #{childPlaylistIds}, #{status}, #{startedAt}, "
            + "#{tracksProcessed}, #{totalApiRequests} FROM DUAL "
            + "WHERE NOT EXISTS (SELECT 1 FROM sync_event WHERE user_id = #{userId} "
            + "AND base_playlist_id = #{basePlaylistId} AND status = 'IN_PROGRESS')")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insertIfNoneInProgress(SyncEventEntity entity);

    @Select("SELECT COUNT(1) FROM sync_event "
            + "WHERE user_id = #{userId} AND base_playlist_id = #{basePlaylistId} AND status = 'IN_PROGRESS'")
    int countInProgress(@Param("userId") Long userId, @Param("basePlaylistId") Long basePlaylistId);

    @Update("UPDATE sync_event SET child_playlist_ids = #{childPlaylistIds}, status = #{status}, "
            + "completed_at = #{completedAt}, tracks_processed = #{tracksProcessed}, "
            + "total_api_requests = #{totalApiRequests}, error_message = #{errorMessage}, updated_at = NOW() "
            + "WHERE id = #{id} AND user_id = #{userId}")
    int updateById(SyncEventEntity entity);

    @Select("SELECT " + COLUMNS + " FROM sync_event WHERE id = #{id} AND user_id = #{userId}")
    SyncEventEntity selectById(@Param("id") Long id, @Param("userId") Long userId);

    @Select("SELECT " + COLUMNS + " FROM sync_event "
            + "WHERE user_id = #{userId} AND base_playlist_id = #{basePlaylistId} "
            + "ORDER BY started_at DESC, id DESC LIMIT #{limit}")
    List<SyncEventEntity> selectRecentByBasePlaylist(@Param("userId") Long userId,
                                                     @Param("basePlaylistId") Long basePlaylistId,
                                                     @Param("limit") int limit);
}
