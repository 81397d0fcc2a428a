package com.example.playlistrouter.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncEventEntity {

    private Long id;

    private Long userId;

    private Long basePlaylistId;

    /** JSON array of child playlist ids. */
    private String childPlaylistIds;

    private String status;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private Integer tracksProcessed;

    private Integer totalApiRequests;

    private String errorMessage;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
