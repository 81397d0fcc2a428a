package com.example.playlistrouter.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArtistInfo {

    private String id;
    private String name;
    private List<String> genres;
    private int popularity;
    private String uri;
}
