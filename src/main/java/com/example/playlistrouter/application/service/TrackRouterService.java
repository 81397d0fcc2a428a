package com.example.playlistrouter.application.service;

import com.example.playlistrouter.domain.filter.FilterEngine;
import com.example.playlistrouter.domain.filter.FilterRuleException;
import com.example.playlistrouter.domain.model.PlaylistTrackSet;
import com.example.playlistrouter.domain.model.TrackInfo;
import com.example.playlistrouter.infrastructure.persistence.entity.ChildPlaylistEntity;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Evaluates every track against the filter rules of each active child. No remote calls.
 */
@Service
public class TrackRouterService {

    private static final Logger log = LoggerFactory.getLogger(TrackRouterService.class);

    private final FilterRulesCodec filterRulesCodec;

    public TrackRouterService(FilterRulesCodec filterRulesCodec) {
        this.filterRulesCodec = filterRulesCodec;
    }

    /**
     * Maps a child's Spotify playlist id to the URIs of its matching tracks, in base playlist
     * order. Children without a match get no entry; the map iterates in child order.
     *
     * @throws FilterRuleException when any active child carries rules that do not parse or
     *                             compile, or two active children share a Spotify playlist;
     *                             nothing is routed in that case
     */
    public Map<String, List<String>> routeTracksToChildren(PlaylistTrackSet trackSet,
                                                           List<ChildPlaylistEntity> children) {
        List<ChildPlaylistEntity> activeChildren = new ArrayList<>();
        List<FilterEngine> engines = new ArrayList<>();
        Map<String, Long> ownerByRemoteId = new HashMap<>();
        for (ChildPlaylistEntity child : children) {
            if (child.getIsActive() == null || child.getIsActive() != 1) {
                continue;
            }
            if (StringUtils.hasText(child.getSpotifyPlaylistId())) {
                Long owner = ownerByRemoteId.putIfAbsent(child.getSpotifyPlaylistId(), child.getId());
                if (owner != null) {
                    throw new FilterRuleException("Child playlists " + owner + " and " + child.getId()
                            + " both point at Spotify playlist " + child.getSpotifyPlaylistId());
                }
            }
            try {
                engines.add(filterRulesCodec.compile(child.getFilterRules()));
                activeChildren.add(child);
            } catch (FilterRuleException e) {
                throw new FilterRuleException("Invalid filter rules for child playlist " + child.getId()
                        + " (" + child.getName() + "): " + e.getMessage(), e);
            }
        }

        Map<String, List<String>> routed = new LinkedHashMap<>();
        for (int i = 0; i < activeChildren.size(); i++) {
            ChildPlaylistEntity child = activeChildren.get(i);
            FilterEngine engine = engines.get(i);
            if (!StringUtils.hasText(child.getSpotifyPlaylistId())) {
                log.warn("ROUTE_SKIPPED_NO_REMOTE childId={}", child.getId());
                continue;
            }
            List<String> uris = new ArrayList<>();
            for (TrackInfo track : trackSet.getTracks()) {
                if (engine.matches(track)) {
                    uris.add(track.getUri());
                }
            }
            if (!uris.isEmpty()) {
                routed.put(child.getSpotifyPlaylistId(), uris);
            }
            log.debug("TRACKS_ROUTED childId={} matched={}", child.getId(), uris.size());
        }
        return routed;
    }
}
