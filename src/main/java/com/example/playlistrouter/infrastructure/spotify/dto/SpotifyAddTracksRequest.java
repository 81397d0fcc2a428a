package com.example.playlistrouter.infrastructure.spotify.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpotifyAddTracksRequest {

    private List<String> uris;
}
