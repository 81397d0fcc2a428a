package com.example.playlistrouter.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpotifyAlbum {

    private String id;
    private String name;
    private String uri;

    @JsonProperty("release_date")
    private String releaseDate;
}
