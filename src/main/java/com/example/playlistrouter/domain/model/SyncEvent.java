package com.example.playlistrouter.domain.model;

import com.example.playlistrouter.domain.enumtype.SyncStatus;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class SyncEvent {

    private Long id;

    private Long userId;

    private Long basePlaylistId;

    private List<Long> childPlaylistIds = new ArrayList<>();

    private SyncStatus status;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private int tracksProcessed;

    private int totalApiRequests;

    private String errorMessage;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void addApiRequests(int count) {
        this.totalApiRequests += count;
    }
}
