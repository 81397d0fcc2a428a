package com.example.playlistrouter.api.request;

import com.example.playlistrouter.domain.filter.FilterRules;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateChildPlaylistRequest {

    @NotBlank
    @Size(max = 100)
    private String name;

    @Size(max = 300)
    private String description;

    /** Omit to route every track of the base playlist. */
    private FilterRules filterRules;
}
