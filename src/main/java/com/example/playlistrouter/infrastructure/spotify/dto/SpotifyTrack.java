package com.example.playlistrouter.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpotifyTrack {

    private String id;
    private String name;
    private String uri;
    private String type;

    @JsonProperty("duration_ms")
    private Integer durationMs;

    private Integer popularity;
    private Boolean explicit;
    private SpotifyAlbum album;
    private List<SpotifyArtist> artists;
}
