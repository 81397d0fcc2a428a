package com.example.playlistrouter.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Track snapshot used for routing. The fields below {@code artistIds} are derived from the
 * album and the artists once aggregation has fetched them.
 */
@Data
public class TrackInfo {

    private String id;
    private String name;
    private String uri;
    private int durationMs;
    private int popularity;
    private boolean explicit;
    private AlbumInfo album;
    private List<String> artistIds = new ArrayList<>();

    private int releaseYear;
    private List<String> allGenres = new ArrayList<>();
    private int maxArtistPopularity;
    private List<String> artistNames = new ArrayList<>();
}
