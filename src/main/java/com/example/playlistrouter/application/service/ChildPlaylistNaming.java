package com.example.playlistrouter.application.service;

import com.example.playlistrouter.common.config.AppSyncProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Name and description given to the Spotify playlist behind a child playlist.
 */
@Component
public class ChildPlaylistNaming {

    private final AppSyncProperties appSyncProperties;

    public ChildPlaylistNaming(AppSyncProperties appSyncProperties) {
        this.appSyncProperties = appSyncProperties;
    }

    /** {@code [Base Name] > Child Name} */
    public String remoteName(String basePlaylistName, String childName) {
        return "[" + basePlaylistName + "] > " + childName;
    }

    public String remoteDescription(String childDescription) {
        String banner = appSyncProperties.getDescriptionBanner();
        if (!StringUtils.hasText(childDescription)) {
            return banner;
        }
        return banner + " " + childDescription.trim();
    }
}
