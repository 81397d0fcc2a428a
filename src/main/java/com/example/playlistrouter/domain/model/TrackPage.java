package com.example.playlistrouter.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One page of a remote playlist. {@code itemCount} counts every item on the page, including
 * the ones that could not be mapped to a {@link TrackInfo} (local files, removed tracks).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackPage {

    private List<TrackInfo> tracks;
    private int itemCount;
    private int total;
}
