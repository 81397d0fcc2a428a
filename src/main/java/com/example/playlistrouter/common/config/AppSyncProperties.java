package com.example.playlistrouter.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync")
public class AppSyncProperties {

    /** Spotify caps playlist item pages at 50 for this endpoint family. */
    private int trackPageSize = 50;

    private int artistBatchSize = 50;

    private int addTracksBatchSize = 100;

    private String descriptionBanner = "[PLAYLIST GENERATED AND MANAGED BY PlaylistRouter]";
}
