package com.example.playlistrouter.api.response;

import com.example.playlistrouter.domain.filter.FilterRules;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ChildPlaylistResponse {

    private Long id;
    private Long basePlaylistId;
    private String name;
    private String description;
    private String spotifyPlaylistId;
    private FilterRules filterRules;

    /** Set instead of {@code filterRules} when the stored rules no longer parse. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String filterRulesError;

    private Boolean active;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
