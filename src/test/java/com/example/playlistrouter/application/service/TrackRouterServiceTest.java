package com.example.playlistrouter.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.playlistrouter.domain.filter.FilterRuleException;
import com.example.playlistrouter.domain.model.PlaylistTrackSet;
import com.example.playlistrouter.domain.model.TrackInfo;
import com.example.playlistrouter.infrastructure.persistence.entity.ChildPlaylistEntity;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrackRouterServiceTest {

    private static final String POPULAR = "{\"version\":1,\"rules\":{\"popularity\":{\"type\":\"range\",\"min\":50}}}";

    private TrackRouterService service;
    private PlaylistTrackSet trackSet;

    @BeforeEach
    void setUp() {
        service = new TrackRouterService(new FilterRulesCodec(new ObjectMapper()));
        trackSet = new PlaylistTrackSet();
        trackSet.getTracks().add(track("hit", 80, "rock"));
        trackSet.getTracks().add(track("deep-cut", 30, "jazz"));
    }

    @Test
    void popularChildShouldOnlyGetPopularTrack() {
        Map<String, List<String>> routed = service.routeTracksToChildren(trackSet,
                Collections.singletonList(child(1L, "remote-1", POPULAR, 1)));

        assertEquals(Collections.singletonList("spotify:track:hit"), routed.get("remote-1"));
    }

    @Test
    void childWithoutRulesShouldTakeEveryTrackInOrder() {
        Map<String, List<String>> routed = service.routeTracksToChildren(trackSet,
                Collections.singletonList(child(1L, "remote-1", null, 1)));

        assertEquals(Arrays.asList("spotify:track:hit", "spotify:track:deep-cut"), routed.get("remote-1"));
    }

    @Test
    void childWithoutMatchesShouldGetNoEntry() {
        String metal = "{\"version\":1,\"rules\":{\"genres\":{\"type\":\"set\",\"include\":[\"metal\"]}}}";

        Map<String, List<String>> routed = service.routeTracksToChildren(trackSet,
                Collections.singletonList(child(1L, "remote-1", metal, 1)));

        assertTrue(routed.isEmpty());
    }

    @Test
    void inactiveChildShouldBeIgnored() {
        Map<String, List<String>> routed = service.routeTracksToChildren(trackSet,
                Collections.singletonList(child(1L, "remote-1", null, 0)));

        assertFalse(routed.containsKey("remote-1"));
    }

    @Test
    void sameTrackMayGoToSeveralChildrenAndOrderFollowsChildren() {
        List<ChildPlaylistEntity> children = Arrays.asList(
                child(3L, "remote-3", null, 1),
                child(1L, "remote-1", POPULAR, 1),
                child(2L, "remote-2", "{\"version\":1,\"rules\":{\"genres\":{\"type\":\"set\",\"include\":[\"JAZZ\"]}}}", 1));

        Map<String, List<String>> routed = service.routeTracksToChildren(trackSet, children);

        assertEquals(Arrays.asList("remote-3", "remote-1", "remote-2"), new ArrayList<>(routed.keySet()));
        assertTrue(routed.get("remote-3").contains("spotify:track:hit"));
        assertTrue(routed.get("remote-1").contains("spotify:track:hit"));
        assertEquals(Collections.singletonList("spotify:track:deep-cut"), routed.get("remote-2"));
    }

    @Test
    void malformedRulesShouldAbortRouting() {
        List<ChildPlaylistEntity> children = Arrays.asList(
                child(1L, "remote-1", POPULAR, 1),
                child(2L, "remote-2", "{\"version\":1,\"rules\":{\"bpm\":{\"type\":\"range\",\"min\":120}}}", 1));

        FilterRuleException error = assertThrows(FilterRuleException.class,
                () -> service.routeTracksToChildren(trackSet, children));

        assertTrue(error.getMessage().contains("child playlist 2"));
    }

    @Test
    void childrenSharingRemotePlaylistShouldAbortRouting() {
        List<ChildPlaylistEntity> children = Arrays.asList(
                child(1L, "remote-1", null, 1),
                child(2L, "remote-1", POPULAR, 1));

        FilterRuleException error = assertThrows(FilterRuleException.class,
                () -> service.routeTracksToChildren(trackSet, children));

        assertTrue(error.getMessage().contains("remote-1"));
    }

    @Test
    void inactiveChildMayShareRemotePlaylist() {
        Map<String, List<String>> routed = service.routeTracksToChildren(trackSet, Arrays.asList(
                child(1L, "remote-1", POPULAR, 1),
                child(2L, "remote-1", null, 0)));

        assertEquals(Collections.singletonList("spotify:track:hit"), routed.get("remote-1"));
    }

    private ChildPlaylistEntity child(Long id, String spotifyPlaylistId, String rules, int active) {
        ChildPlaylistEntity child = new ChildPlaylistEntity();
        child.setId(id);
        child.setUserId(1L);
        child.setBasePlaylistId(7L);
        child.setName("Child " + id);
        child.setSpotifyPlaylistId(spotifyPlaylistId);
        child.setFilterRules(rules);
        child.setIsActive(active);
        return child;
    }

    private TrackInfo track(String id, int popularity, String genre) {
        TrackInfo track = new TrackInfo();
        track.setId(id);
        track.setName(id);
        track.setUri("spotify:track:" + id);
        track.setPopularity(popularity);
        track.setAllGenres(Collections.singletonList(genre));
        return track;
    }
}
