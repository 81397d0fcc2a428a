package com.example.playlistrouter.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Data;

/** Full artist object; the simplified one nested in tracks only fills id, name and uri. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpotifyArtist {

    private String id;
    private String name;
    private String uri;
    private List<String> genres;
    private Integer popularity;
}
