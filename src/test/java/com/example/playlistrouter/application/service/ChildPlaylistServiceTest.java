package com.example.playlistrouter.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.playlistrouter.api.response.ChildPlaylistResponse;
import com.example.playlistrouter.common.config.AppSyncProperties;
import com.example.playlistrouter.common.exception.BusinessException;
import com.example.playlistrouter.domain.filter.FilterRules;
import com.example.playlistrouter.domain.filter.RangePredicate;
import com.example.playlistrouter.domain.model.RemotePlaylist;
import com.example.playlistrouter.domain.model.SpotifyCredentials;
import com.example.playlistrouter.infrastructure.persistence.entity.BasePlaylistEntity;
import com.example.playlistrouter.infrastructure.persistence.entity.ChildPlaylistEntity;
import com.example.playlistrouter.infrastructure.persistence.mapper.ChildPlaylistMapper;
import com.example.playlistrouter.infrastructure.spotify.SpotifyApiException;
import com.example.playlistrouter.infrastructure.spotify.SpotifyClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class ChildPlaylistServiceTest {

    private static final SpotifyCredentials CREDENTIALS = new SpotifyCredentials("spotify-user", "token");

    private ChildPlaylistService service;
    private ChildPlaylistMapper childPlaylistMapper;
    private SpotifyClient spotifyClient;
    private ChildPlaylistEntity stored;

    @BeforeEach
    void setUp() {
        childPlaylistMapper = mock(ChildPlaylistMapper.class);
        BasePlaylistService basePlaylistService = mock(BasePlaylistService.class);
        SpotifyCredentialsService spotifyCredentialsService = mock(SpotifyCredentialsService.class);
        spotifyClient = mock(SpotifyClient.class);

        BasePlaylistEntity basePlaylist = new BasePlaylistEntity();
        basePlaylist.setId(7L);
        basePlaylist.setUserId(1L);
        basePlaylist.setName("Road Trip");
        basePlaylist.setSpotifyPlaylistId("base-remote");
        when(basePlaylistService.requireBasePlaylist(7L, 1L)).thenReturn(basePlaylist);
        when(spotifyCredentialsService.requireCredentials(1L)).thenReturn(CREDENTIALS);

        stored = new ChildPlaylistEntity();
        stored.setId(11L);
        stored.setUserId(1L);
        stored.setBasePlaylistId(7L);
        stored.setName("Bangers");
        stored.setDescription("Loud ones");
        stored.setSpotifyPlaylistId("remote-11");
        stored.setIsActive(1);
        when(childPlaylistMapper.selectById(11L, 1L)).thenReturn(stored);

        AppSyncProperties syncProperties = new AppSyncProperties();
        service = new ChildPlaylistService(childPlaylistMapper, basePlaylistService, spotifyCredentialsService,
                spotifyClient, new FilterRulesCodec(new ObjectMapper()), new ChildPlaylistNaming(syncProperties));
    }

    @Test
    void createShouldBuildRemotePlaylistThenPersistRow() {
        when(spotifyClient.createPlaylist(CREDENTIALS, "[Road Trip] > Bangers",
                "[PLAYLIST GENERATED AND MANAGED BY PlaylistRouter] Loud ones", false))
                .thenReturn(new RemotePlaylist("remote-11", "[Road Trip] > Bangers"));
        when(childPlaylistMapper.insert(any(ChildPlaylistEntity.class))).thenAnswer(invocation -> {
            ChildPlaylistEntity entity = invocation.getArgument(0);
            entity.setId(11L);
            return 1;
        });
        FilterRules rules = new FilterRules();
        rules.getRules().put("popularity", new RangePredicate(60.0, null));

        ChildPlaylistResponse response = service.createChildPlaylist(1L, 7L, " Bangers ", "Loud ones", rules);

        ArgumentCaptor<ChildPlaylistEntity> captor = ArgumentCaptor.forClass(ChildPlaylistEntity.class);
        verify(childPlaylistMapper).insert(captor.capture());
        ChildPlaylistEntity inserted = captor.getValue();
        assertEquals("Bangers", inserted.getName());
        assertEquals("remote-11", inserted.getSpotifyPlaylistId());
        assertEquals(Integer.valueOf(1), inserted.getIsActive());
        assertTrue(inserted.getFilterRules().contains("\"popularity\""));
        assertEquals(11L, response.getId());
    }

    @Test
    void createShouldRejectInvalidRulesBeforeRemoteCall() {
        FilterRules rules = new FilterRules();
        rules.getRules().put("popularity", new RangePredicate(90.0, 10.0));

        BusinessException error = assertThrows(BusinessException.class,
                () -> service.createChildPlaylist(1L, 7L, "Bangers", null, rules));

        assertEquals("INVALID_FILTER_RULES", error.getCode());
        verifyNoInteractions(spotifyClient);
        verify(childPlaylistMapper, never()).insert(any(ChildPlaylistEntity.class));
    }

    @Test
    void createShouldNotPersistWhenRemoteCreateFails() {
        when(spotifyClient.createPlaylist(any(), anyString(), anyString(), anyBoolean()))
                .thenThrow(new SpotifyApiException(401, "expired token"));

        BusinessException error = assertThrows(BusinessException.class,
                () -> service.createChildPlaylist(1L, 7L, "Bangers", null, null));

        assertEquals("SPOTIFY_CALL_FAILED", error.getCode());
        verify(childPlaylistMapper, never()).insert(any(ChildPlaylistEntity.class));
    }

    @Test
    void renameShouldPushDetailsToSpotify() {
        service.updateChildPlaylist(11L, 1L, "Anthems", null, null, false, null);

        verify(childPlaylistMapper).updateDetails(stored);
        verify(spotifyClient).updatePlaylistDetails(CREDENTIALS, "remote-11", "[Road Trip] > Anthems",
                "[PLAYLIST GENERATED AND MANAGED BY PlaylistRouter] Loud ones");
    }

    @Test
    void ruleOnlyChangeShouldStayLocal() {
        FilterRules rules = new FilterRules();
        rules.getRules().put("release_year", new RangePredicate(2010.0, 2019.0));

        service.updateChildPlaylist(11L, 1L, null, null, rules, false, false);

        assertTrue(stored.getFilterRules().contains("release_year"));
        assertEquals(Integer.valueOf(0), stored.getIsActive());
        verifyNoInteractions(spotifyClient);
    }

    @Test
    void clearFilterRulesShouldRemoveStoredRules() {
        stored.setFilterRules("{\"version\":1,\"rules\":{}}");

        service.updateChildPlaylist(11L, 1L, null, null, null, true, null);

        assertNull(stored.getFilterRules());
    }

    @Test
    void deleteShouldUnfollowThenDeleteRow() {
        service.deleteChildPlaylist(11L, 1L);

        InOrder order = inOrder(spotifyClient, childPlaylistMapper);
        order.verify(spotifyClient).deletePlaylist(CREDENTIALS, "remote-11");
        order.verify(childPlaylistMapper).deleteById(11L, 1L);
    }

    @Test
    void deleteShouldKeepRowWhenUnfollowFails() {
        doThrow(new SpotifyApiException(500, "boom")).when(spotifyClient).deletePlaylist(CREDENTIALS, "remote-11");

        assertThrows(BusinessException.class, () -> service.deleteChildPlaylist(11L, 1L));

        verify(childPlaylistMapper, never()).deleteById(11L, 1L);
    }

    @Test
    void unreadableStoredRulesShouldStillRender() {
        stored.setFilterRules("{broken");

        ChildPlaylistResponse response = service.getChildPlaylist(11L, 1L);

        assertNull(response.getFilterRules());
        assertTrue(response.getFilterRulesError().startsWith("Unparsable filter rules"));
    }

    @Test
    void missingChildShouldBeNotFound() {
        BusinessException error = assertThrows(BusinessException.class, () -> service.getChildPlaylist(99L, 1L));

        assertEquals("404", error.getCode());
    }
}
