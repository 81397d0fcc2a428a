package com.example.playlistrouter.application.service;

import com.example.playlistrouter.api.response.ChildPlaylistResponse;
import com.example.playlistrouter.common.exception.BusinessException;
import com.example.playlistrouter.domain.filter.FilterRuleException;
import com.example.playlistrouter.domain.filter.FilterRules;
import com.example.playlistrouter.domain.model.RemotePlaylist;
import com.example.playlistrouter.domain.model.SpotifyCredentials;
import com.example.playlistrouter.infrastructure.persistence.entity.BasePlaylistEntity;
import com.example.playlistrouter.infrastructure.persistence.entity.ChildPlaylistEntity;
import com.example.playlistrouter.infrastructure.persistence.mapper.ChildPlaylistMapper;
import com.example.playlistrouter.infrastructure.spotify.SpotifyApiException;
import com.example.playlistrouter.infrastructure.spotify.SpotifyClient;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class ChildPlaylistService {

    private static final Logger log = LoggerFactory.getLogger(ChildPlaylistService.class);
    private static final int MAX_NAME_LENGTH = 100;
    private static final int MAX_DESCRIPTION_LENGTH = 300;

    private final ChildPlaylistMapper childPlaylistMapper;
    private final BasePlaylistService basePlaylistService;
    private final SpotifyCredentialsService spotifyCredentialsService;
    private final SpotifyClient spotifyClient;
    private final FilterRulesCodec filterRulesCodec;
    private final ChildPlaylistNaming childPlaylistNaming;

    public ChildPlaylistService(ChildPlaylistMapper childPlaylistMapper,
                                BasePlaylistService basePlaylistService,
                                SpotifyCredentialsService spotifyCredentialsService,
                                SpotifyClient spotifyClient,
                                FilterRulesCodec filterRulesCodec,
                                ChildPlaylistNaming childPlaylistNaming) {
        this.childPlaylistMapper = childPlaylistMapper;
        this.basePlaylistService = basePlaylistService;
        this.spotifyCredentialsService = spotifyCredentialsService;
        this.spotifyClient = spotifyClient;
        this.filterRulesCodec = filterRulesCodec;
        this.childPlaylistNaming = childPlaylistNaming;
    }

    /**
     * Creates the Spotify playlist first, then the row pointing at it.
     */
    public ChildPlaylistResponse createChildPlaylist(Long userId, Long basePlaylistId, String name,
                                                     String description, FilterRules filterRules) {
        BasePlaylistEntity basePlaylist = basePlaylistService.requireBasePlaylist(basePlaylistId, userId);
        String safeName = normalizeName(name);
        String safeDescription = normalizeDescription(description);
        String rulesJson = serializeRules(filterRules);

        SpotifyCredentials credentials = spotifyCredentialsService.requireCredentials(userId);
        RemotePlaylist remote;
        try {
            remote = spotifyClient.createPlaylist(credentials,
                    childPlaylistNaming.remoteName(basePlaylist.getName(), safeName),
                    childPlaylistNaming.remoteDescription(safeDescription),
                    false);
        } catch (SpotifyApiException e) {
            throw new BusinessException("SPOTIFY_CALL_FAILED", "Failed to create Spotify playlist: " + e.getMessage(), e);
        }

        ChildPlaylistEntity entity = new ChildPlaylistEntity();
        entity.setUserId(userId);
        entity.setBasePlaylistId(basePlaylistId);
        entity.setName(safeName);
        entity.setDescription(safeDescription);
        entity.setSpotifyPlaylistId(remote.getId());
        entity.setFilterRules(rulesJson);
        entity.setIsActive(1);
        childPlaylistMapper.insert(entity);
        log.info("CHILD_PLAYLIST_CREATED id={} userId={} basePlaylistId={} spotifyPlaylistId={}",
                entity.getId(), userId, basePlaylistId, remote.getId());
        return toResponse(requireChildPlaylist(entity.getId(), userId));
    }

    public ChildPlaylistResponse getChildPlaylist(Long id, Long userId) {
        return toResponse(requireChildPlaylist(id, userId));
    }

    public List<ChildPlaylistResponse> listChildPlaylists(Long userId, Long basePlaylistId) {
        basePlaylistService.requireBasePlaylist(basePlaylistId, userId);
        return childPlaylistMapper.selectByBasePlaylistId(basePlaylistId, userId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    /**
     * Null arguments leave the field unchanged. A name or description change is pushed to the
     * Spotify playlist as well.
     */
    public ChildPlaylistResponse updateChildPlaylist(Long id, Long userId, String name, String description,
                                                     FilterRules filterRules, boolean clearFilterRules,
                                                     Boolean active) {
        ChildPlaylistEntity entity = requireChildPlaylist(id, userId);
        String oldName = entity.getName();
        String oldDescription = entity.getDescription();

        if (name != null) {
            entity.setName(normalizeName(name));
        }
        if (description != null) {
            entity.setDescription(normalizeDescription(description));
        }
        if (clearFilterRules) {
            entity.setFilterRules(null);
        } else if (filterRules != null) {
            entity.setFilterRules(serializeRules(filterRules));
        }
        if (active != null) {
            entity.setIsActive(active ? 1 : 0);
        }
        childPlaylistMapper.updateDetails(entity);

        boolean detailsChanged = !Objects.equals(oldName, entity.getName())
                || !Objects.equals(oldDescription, entity.getDescription());
        if (detailsChanged && StringUtils.hasText(entity.getSpotifyPlaylistId())) {
            BasePlaylistEntity basePlaylist = basePlaylistService.requireBasePlaylist(entity.getBasePlaylistId(), userId);
            SpotifyCredentials credentials = spotifyCredentialsService.requireCredentials(userId);
            try {
                spotifyClient.updatePlaylistDetails(credentials, entity.getSpotifyPlaylistId(),
                        childPlaylistNaming.remoteName(basePlaylist.getName(), entity.getName()),
                        childPlaylistNaming.remoteDescription(entity.getDescription()));
            } catch (SpotifyApiException e) {
                throw new BusinessException("SPOTIFY_CALL_FAILED",
                        "Saved locally but failed to update Spotify playlist: " + e.getMessage(),
                        "Retry the update or run a sync", e);
            }
        }
        log.info("CHILD_PLAYLIST_UPDATED id={} userId={} detailsChanged={}", id, userId, detailsChanged);
        return toResponse(requireChildPlaylist(id, userId));
    }

    /**
     * Unfollows the Spotify playlist, then deletes the row.
     */
    public void deleteChildPlaylist(Long id, Long userId) {
        ChildPlaylistEntity entity = requireChildPlaylist(id, userId);
        if (StringUtils.hasText(entity.getSpotifyPlaylistId())) {
            SpotifyCredentials credentials = spotifyCredentialsService.requireCredentials(userId);
            try {
                spotifyClient.deletePlaylist(credentials, entity.getSpotifyPlaylistId());
            } catch (SpotifyApiException e) {
                throw new BusinessException("SPOTIFY_CALL_FAILED",
                        "Failed to delete Spotify playlist: " + e.getMessage(), e);
            }
        }
        childPlaylistMapper.deleteById(id, userId);
        log.info("CHILD_PLAYLIST_DELETED id={} userId={} spotifyPlaylistId={}",
                id, userId, entity.getSpotifyPlaylistId());
    }

    /** Active children of a base playlist, ordered by id. */
    public List<ChildPlaylistEntity> listActiveByBasePlaylist(Long basePlaylistId, Long userId) {
        return childPlaylistMapper.selectActiveByBasePlaylistId(basePlaylistId, userId);
    }

    public void updateSpotifyPlaylistId(Long id, Long userId, String spotifyPlaylistId) {
        int updated = childPlaylistMapper.updateSpotifyPlaylistId(id, userId, spotifyPlaylistId);
        if (updated <= 0) {
            throw new BusinessException("404", "Child playlist not found: " + id);
        }
    }

    public ChildPlaylistEntity requireChildPlaylist(Long id, Long userId) {
        ChildPlaylistEntity entity = childPlaylistMapper.selectById(id, userId);
        if (entity == null) {
            throw new BusinessException("404", "Child playlist not found");
        }
        return entity;
    }

    private String serializeRules(FilterRules filterRules) {
        try {
            return filterRulesCodec.serialize(filterRules);
        } catch (FilterRuleException e) {
            throw new BusinessException("INVALID_FILTER_RULES", e.getMessage(), "Fix the filter rules and retry");
        }
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

    private String normalizeDescription(String rawDescription) {
        if (rawDescription == null) {
            return null;
        }
        String safeDescription = rawDescription.trim();
        if (safeDescription.length() > MAX_DESCRIPTION_LENGTH) {
            throw new BusinessException("400",
                    "Description must not exceed " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return safeDescription.isEmpty() ? null : safeDescription;
    }

    private ChildPlaylistResponse toResponse(ChildPlaylistEntity entity) {
        ChildPlaylistResponse response = new ChildPlaylistResponse();
        response.setId(entity.getId());
        response.setBasePlaylistId(entity.getBasePlaylistId());
        response.setName(entity.getName());
        response.setDescription(entity.getDescription());
        response.setSpotifyPlaylistId(entity.getSpotifyPlaylistId());
        response.setActive(entity.getIsActive() != null && entity.getIsActive() == 1);
        response.setCreatedAt(entity.getCreatedAt());
        response.setUpdatedAt(entity.getUpdatedAt());
        try {
            response.setFilterRules(filterRulesCodec.parse(entity.getFilterRules()));
        } catch (FilterRuleException e) {
            log.warn("CHILD_PLAYLIST_RULES_UNREADABLE id={} reason={}", entity.getId(), e.getMessage());
            response.setFilterRulesError(e.getMessage());
        }
        return response;
    }
}
