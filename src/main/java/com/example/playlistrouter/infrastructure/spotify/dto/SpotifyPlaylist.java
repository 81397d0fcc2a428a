package com.example.playlistrouter.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpotifyPlaylist {

    private String id;
    private String name;
    private String uri;
    private String description;
}
