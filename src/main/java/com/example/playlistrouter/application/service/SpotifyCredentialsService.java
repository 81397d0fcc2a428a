package com.example.playlistrouter.application.service;

import com.example.playlistrouter.common.exception.BusinessException;
import com.example.playlistrouter.domain.model.SpotifyCredentials;
import com.example.playlistrouter.infrastructure.persistence.entity.SpotifyIntegrationEntity;
import com.example.playlistrouter.infrastructure.persistence.mapper.SpotifyIntegrationMapper;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Resolves the stored Spotify access token of a user. Token exchange and refresh happen
 * elsewhere; an expired token is only logged and used as-is, Spotify then rejects it.
 */
@Service
public class SpotifyCredentialsService {

    private static final Logger log = LoggerFactory.getLogger(SpotifyCredentialsService.class);

    private final SpotifyIntegrationMapper spotifyIntegrationMapper;

    public SpotifyCredentialsService(SpotifyIntegrationMapper spotifyIntegrationMapper) {
        this.spotifyIntegrationMapper = spotifyIntegrationMapper;
    }

    public SpotifyCredentials requireCredentials(Long userId) {
        SpotifyIntegrationEntity integration = spotifyIntegrationMapper.selectByUserId(userId);
        if (integration == null || !StringUtils.hasText(integration.getAccessToken())) {
            throw new BusinessException("SPOTIFY_NOT_CONNECTED", "Spotify account is not connected",
                    "Connect a Spotify account and retry");
        }
        if (integration.getExpiresAt() != null && integration.getExpiresAt().isBefore(LocalDateTime.now())) {
            log.warn("SPOTIFY_TOKEN_EXPIRED userId={} expiresAt={}", userId, integration.getExpiresAt());
        }
        return new SpotifyCredentials(integration.getSpotifyUserId(), integration.getAccessToken());
    }
}
