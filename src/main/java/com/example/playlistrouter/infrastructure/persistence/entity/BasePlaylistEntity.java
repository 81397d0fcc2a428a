package com.example.playlistrouter.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class BasePlaylistEntity {

    private Long id;

    private Long userId;

    private String name;

    private String spotifyPlaylistId;

    private Integer isActive;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
