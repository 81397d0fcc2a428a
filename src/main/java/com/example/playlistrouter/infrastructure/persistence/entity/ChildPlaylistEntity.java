package com.example.playlistrouter.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ChildPlaylistEntity {

    private Long id;

    private Long userId;

    private Long basePlaylistId;

    private String name;

    private String description;

    /** Replaced on every sync that rebuilds the remote playlist. */
    private String spotifyPlaylistId;

    /** JSON {@code FilterRules}; null means every track matches. */
    private String filterRules;

    private Integer isActive;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
