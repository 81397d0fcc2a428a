package com.example.playlistrouter.api.controller;

import com.example.playlistrouter.api.request.CreateBasePlaylistRequest;
import com.example.playlistrouter.api.request.CreateChildPlaylistRequest;
import com.example.playlistrouter.api.response.ApiResponse;
import com.example.playlistrouter.api.response.BasePlaylistResponse;
import com.example.playlistrouter.api.response.ChildPlaylistResponse;
import com.example.playlistrouter.application.service.BasePlaylistService;
import com.example.playlistrouter.application.service.ChildPlaylistService;
import com.example.playlistrouter.common.logging.AccessLogFilter;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/base-playlists")
public class BasePlaylistController {

    private final BasePlaylistService basePlaylistService;
    private final ChildPlaylistService childPlaylistService;

    public BasePlaylistController(BasePlaylistService basePlaylistService,
                                  ChildPlaylistService childPlaylistService) {
        this.basePlaylistService = basePlaylistService;
        this.childPlaylistService = childPlaylistService;
    }

    @PostMapping
    public ApiResponse<BasePlaylistResponse> create(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
                                                    @Valid @RequestBody CreateBasePlaylistRequest request) {
        return ApiResponse.success(basePlaylistService.createBasePlaylist(
                userId, request.getName(), request.getSpotifyPlaylistId()));
    }

    @GetMapping
    public ApiResponse<List<BasePlaylistResponse>> list(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId) {
        return ApiResponse.success(basePlaylistService.listBasePlaylists(userId));
    }

    @GetMapping("/{id}")
    public ApiResponse<BasePlaylistResponse> get(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
                                                 @PathVariable("id") Long id) {
        return ApiResponse.success(basePlaylistService.getBasePlaylist(id, userId));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
                                    @PathVariable("id") Long id) {
        basePlaylistService.deleteBasePlaylist(id, userId);
        return ApiResponse.success(null);
    }

    @PostMapping("/{id}/children")
    public ApiResponse<ChildPlaylistResponse> createChild(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
                                                          @PathVariable("id") Long basePlaylistId,
                                                          @Valid @RequestBody CreateChildPlaylistRequest request) {
        return ApiResponse.success(childPlaylistService.createChildPlaylist(userId, basePlaylistId,
                request.getName(), request.getDescription(), request.getFilterRules()));
    }

    @GetMapping("/{id}/children")
    public ApiResponse<List<ChildPlaylistResponse>> listChildren(
            @RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
            @PathVariable("id") Long basePlaylistId) {
        return ApiResponse.success(childPlaylistService.listChildPlaylists(userId, basePlaylistId));
    }
}
