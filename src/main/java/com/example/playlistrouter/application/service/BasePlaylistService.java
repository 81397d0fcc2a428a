package com.example.playlistrouter.application.service;

import com.example.playlistrouter.api.response.BasePlaylistResponse;
import com.example.playlistrouter.common.exception.BusinessException;
import com.example.playlistrouter.infrastructure.persistence.entity.BasePlaylistEntity;
import com.example.playlistrouter.infrastructure.persistence.mapper.BasePlaylistMapper;
import com.example.playlistrouter.infrastructure.persistence.mapper.ChildPlaylistMapper;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class BasePlaylistService {

    private static final Logger log = LoggerFactory.getLogger(BasePlaylistService.class);
    private static final int MAX_NAME_LENGTH = 100;

    private final BasePlaylistMapper basePlaylistMapper;
    private final ChildPlaylistMapper childPlaylistMapper;
    private final SyncEventService syncEventService;

    public BasePlaylistService(BasePlaylistMapper basePlaylistMapper,
                               ChildPlaylistMapper childPlaylistMapper,
                               SyncEventService syncEventService) {
        this.basePlaylistMapper = basePlaylistMapper;
        this.childPlaylistMapper = childPlaylistMapper;
        this.syncEventService = syncEventService;
    }

    @Transactional(rollbackFor = Exception.class)
    public BasePlaylistResponse createBasePlaylist(Long userId, String name, String spotifyPlaylistId) {
        String safeName = normalizeName(name);
        if (!StringUtils.hasText(spotifyPlaylistId)) {
            throw new BusinessException("400", "spotifyPlaylistId must not be blank");
        }
        String safeSpotifyId = spotifyPlaylistId.trim();
        if (basePlaylistMapper.countBySpotifyPlaylistId(userId, safeSpotifyId) > 0) {
            throw new BusinessException("409", "Base playlist already exists for this Spotify playlist");
        }
        BasePlaylistEntity entity = new BasePlaylistEntity();
        entity.setUserId(userId);
        entity.setName(safeName);
        entity.setSpotifyPlaylistId(safeSpotifyId);
        entity.setIsActive(1);
        basePlaylistMapper.insert(entity);
        log.info("BASE_PLAYLIST_CREATED id={} userId={} spotifyPlaylistId={}", entity.getId(), userId, safeSpotifyId);
        return toResponse(requireBasePlaylist(entity.getId(), userId));
    }

    public BasePlaylistResponse getBasePlaylist(Long id, Long userId) {
        return toResponse(requireBasePlaylist(id, userId));
    }

    public List<BasePlaylistResponse> listBasePlaylists(Long userId) {
        return basePlaylistMapper.selectByUserId(userId).stream().map(this::toResponse).collect(Collectors.toList());
    }

    /**
     * Removes the base playlist and its child rows. The Spotify playlists stay untouched.
     */
    @Transactional(rollbackFor = Exception.class)
    public void deleteBasePlaylist(Long id, Long userId) {
        requireBasePlaylist(id, userId);
        if (syncEventService.hasActiveSyncForBasePlaylist(userId, id)) {
            throw new BusinessException("SYNC_IN_PROGRESS", "A sync is running for this base playlist");
        }
        int removedChildren = childPlaylistMapper.deleteByBasePlaylistId(id, userId);
        int deleted = basePlaylistMapper.deleteById(id, userId);
        if (deleted <= 0) {
            throw new BusinessException("404", "Base playlist not found");
        }
        log.info("BASE_PLAYLIST_DELETED id={} userId={} removedChildren={}", id, userId, removedChildren);
    }

    public BasePlaylistEntity requireBasePlaylist(Long id, Long userId) {
        BasePlaylistEntity entity = basePlaylistMapper.selectById(id, userId);
        if (entity == null) {
            throw new BusinessException("404", "Base playlist not found");
        }
        return entity;
    }

    private String normalizeName(String rawName) {
        if (!StringUtils.hasText(rawName)) {
            throw new BusinessException("400", "Playlist name must not be blank");
        }
        String safeName = rawName.trim();
        if (safeName.length() > MAX_NAME_LENGTH) {
            throw new BusinessException("400", "Playlist name must not exceed " + MAX_NAME_LENGTH + " characters");
        }
        return safeName;
    }

    private BasePlaylistResponse toResponse(BasePlaylistEntity entity) {
        return new BasePlaylistResponse(
                entity.getId(),
                entity.getName(),
                entity.getSpotifyPlaylistId(),
                entity.getIsActive() != null && entity.getIsActive() == 1,
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
