package com.example.playlistrouter.api.response;

import com.example.playlistrouter.domain.model.SyncEvent;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncEventResponse {

    private Long id;
    private Long basePlaylistId;
    private List<Long> childPlaylistIds;
    private String status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Integer tracksProcessed;
    private Integer totalApiRequests;
    private String errorMessage;

    public static SyncEventResponse from(SyncEvent event) {
        return new SyncEventResponse(
                event.getId(),
                event.getBasePlaylistId(),
                event.getChildPlaylistIds() == null ? new ArrayList<>() : new ArrayList<>(event.getChildPlaylistIds()),
                event.getStatus() == null ? null : event.getStatus().name(),
                event.getStartedAt(),
                event.getCompletedAt(),
                event.getTracksProcessed(),
                event.getTotalApiRequests(),
                event.getErrorMessage()
        );
    }
}
