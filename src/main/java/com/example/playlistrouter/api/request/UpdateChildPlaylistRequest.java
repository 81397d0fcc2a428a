package com.example.playlistrouter.api.request;

import com.example.playlistrouter.domain.filter.FilterRules;
import javax.validation.constraints.Size;
import lombok.Data;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
public class UpdateChildPlaylistRequest {

    @Size(min = 1, max = 100)
    private String name;

    @Size(max = 300)
    private String description;

    private FilterRules filterRules;

    /** Removes the rules so the child takes every track. Wins over {@code filterRules}. */
    private boolean clearFilterRules;

    private Boolean active;
}
