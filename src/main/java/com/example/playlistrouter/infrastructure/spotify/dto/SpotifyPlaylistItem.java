package com.example.playlistrouter.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpotifyPlaylistItem {

    @JsonProperty("is_local")
    private boolean local;

    /** Null for tracks removed from the catalogue. */
    private SpotifyTrack track;
}
