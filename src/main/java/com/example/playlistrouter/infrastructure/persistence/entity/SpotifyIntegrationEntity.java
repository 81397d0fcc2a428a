package com.example.playlistrouter.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;
import lombok.ToString;

@Data
public class SpotifyIntegrationEntity {

    private Long id;

    private Long userId;

    private String spotifyUserId;

    @ToString.Exclude
    private String accessToken;

    private String tokenType;

    private LocalDateTime expiresAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
