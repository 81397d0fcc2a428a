package com.example.playlistrouter.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpotifyCredentials {

    private String spotifyUserId;

    @ToString.Exclude
    private String accessToken;
}
