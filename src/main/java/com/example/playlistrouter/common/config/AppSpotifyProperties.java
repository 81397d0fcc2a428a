package com.example.playlistrouter.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.spotify")
public class AppSpotifyProperties {

    private String apiBaseUrl = "https://api.spotify.com/v1";

    private int connectTimeoutMs = 5000;

    private int socketTimeoutMs = 15000;

    private int maxConnections = 20;
}
