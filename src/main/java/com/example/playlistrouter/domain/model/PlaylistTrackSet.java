package com.example.playlistrouter.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Data;

@Data
public class PlaylistTrackSet {

    private Long basePlaylistId;
    private Long userId;
    private List<TrackInfo> tracks = new ArrayList<>();
    private Map<String, ArtistInfo> artists = new LinkedHashMap<>();
    private int apiCallCount;

    /** Distinct artist ids across all tracks, in first-seen order. */
    public List<String> collectArtistIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (TrackInfo track : tracks) {
            for (String artistId : track.getArtistIds()) {
                if (artistId != null) {
                    ids.add(artistId);
                }
            }
        }
        return new ArrayList<>(ids);
    }
}
