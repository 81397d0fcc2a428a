package com.example.playlistrouter.infrastructure.spotify;

import com.example.playlistrouter.domain.model.ArtistInfo;
import com.example.playlistrouter.domain.model.RemotePlaylist;
import com.example.playlistrouter.domain.model.SpotifyCredentials;
import com.example.playlistrouter.domain.model.TrackPage;
import java.util.List;

/**
 * Spotify Web API operations used by playlist management and sync. Every call is a single
 * blocking HTTP request; failures surface as {@link SpotifyApiException}.
 */
public interface SpotifyClient {

    int MAX_TRACKS_PER_ADD = 100;

    int MAX_ARTISTS_PER_REQUEST = 50;

    TrackPage listPlaylistTracks(SpotifyCredentials credentials, String playlistId, int limit, int offset);

    /** At most {@link #MAX_ARTISTS_PER_REQUEST} ids per call. */
    List<ArtistInfo> getSeveralArtists(SpotifyCredentials credentials, List<String> artistIds);

    /** Spotify has no hard delete; the playlist is unfollowed by its owner. */
    void deletePlaylist(SpotifyCredentials credentials, String playlistId);

    RemotePlaylist createPlaylist(SpotifyCredentials credentials, String name, String description, boolean isPublic);

    /** At most {@link #MAX_TRACKS_PER_ADD} uris per call; callers chunk. */
    void addTracksToPlaylist(SpotifyCredentials credentials, String playlistId, List<String> trackUris);

    void updatePlaylistDetails(SpotifyCredentials credentials, String playlistId, String name, String description);
}
