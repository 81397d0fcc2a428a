package com.example.playlistrouter.api.controller;

import com.example.playlistrouter.api.response.ApiResponse;
import com.example.playlistrouter.api.response.SyncEventResponse;
import com.example.playlistrouter.application.service.SyncEventService;
import com.example.playlistrouter.application.service.SyncOrchestratorService;
import com.example.playlistrouter.common.logging.AccessLogFilter;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class SyncController {

    private final SyncOrchestratorService syncOrchestratorService;
    private final SyncEventService syncEventService;

    public SyncController(SyncOrchestratorService syncOrchestratorService, SyncEventService syncEventService) {
        this.syncOrchestratorService = syncOrchestratorService;
        this.syncEventService = syncEventService;
    }

    /** Runs synchronously; a failed sync answers with its error code and the failed event. */
    @PostMapping("/base-playlists/{id}/sync")
    public ApiResponse<SyncEventResponse> sync(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
                                               @PathVariable("id") Long basePlaylistId) {
        return ApiResponse.success(SyncEventResponse.from(syncOrchestratorService.syncBasePlaylist(userId, basePlaylistId)));
    }

    @GetMapping("/base-playlists/{id}/sync-events")
    public ApiResponse<List<SyncEventResponse>> listEvents(
            @RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
            @PathVariable("id") Long basePlaylistId,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return ApiResponse.success(syncEventService.listSyncEvents(userId, basePlaylistId, limit).stream()
                .map(SyncEventResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/sync-events/{id}")
    public ApiResponse<SyncEventResponse> getEvent(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
                                                   @PathVariable("id") Long id) {
        return ApiResponse.success(SyncEventResponse.from(syncEventService.getSyncEvent(id, userId)));
    }
}
