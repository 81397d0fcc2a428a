package com.example.playlistrouter.api.controller;

import com.example.playlistrouter.api.request.UpdateChildPlaylistRequest;
import com.example.playlistrouter.api.response.ApiResponse;
import com.example.playlistrouter.api.response.ChildPlaylistResponse;
import com.example.playlistrouter.application.service.ChildPlaylistService;
import com.example.playlistrouter.common.logging.AccessLogFilter;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/child-playlists")
public class ChildPlaylistController {

    private final ChildPlaylistService childPlaylistService;

    public ChildPlaylistController(ChildPlaylistService childPlaylistService) {
        this.childPlaylistService = childPlaylistService;
    }

    @GetMapping("/{id}")
    public ApiResponse<ChildPlaylistResponse> get(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
                                                  @PathVariable("id") Long id) {
        return ApiResponse.success(childPlaylistService.getChildPlaylist(id, userId));
    }

    @PatchMapping("/{id}")
    public ApiResponse<ChildPlaylistResponse> update(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
                                                     @PathVariable("id") Long id,
                                                     @Valid @RequestBody UpdateChildPlaylistRequest request) {
        return ApiResponse.success(childPlaylistService.updateChildPlaylist(id, userId,
                request.getName(), request.getDescription(), request.getFilterRules(),
                request.isClearFilterRules(), request.getActive()));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@RequestHeader(AccessLogFilter.HEADER_USER_ID) Long userId,
                                    @PathVariable("id") Long id) {
        childPlaylistService.deleteChildPlaylist(id, userId);
        return ApiResponse.success(null);
    }
}
