package com.example.playlistrouter.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpotifyPage<T> {

    private List<T> items;
    private Integer total;
    private Integer limit;
    private Integer offset;
    private String next;
}
