package com.example.playlistrouter.application.service;

import com.example.playlistrouter.common.config.AppSyncProperties;
import com.example.playlistrouter.domain.model.ArtistInfo;
import com.example.playlistrouter.domain.model.PlaylistTrackSet;
import com.example.playlistrouter.domain.model.SpotifyCredentials;
import com.example.playlistrouter.domain.model.TrackInfo;
import com.example.playlistrouter.domain.model.TrackPage;
import com.example.playlistrouter.infrastructure.persistence.entity.BasePlaylistEntity;
import com.example.playlistrouter.infrastructure.spotify.SpotifyApiException;
import com.example.playlistrouter.infrastructure.spotify.SpotifyClient;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Loads every track of a base playlist together with the artists behind them, then fills the
 * derived track fields the filters work on.
 */
@Service
public class TrackAggregatorService {

    private static final Logger log = LoggerFactory.getLogger(TrackAggregatorService.class);

    private final BasePlaylistService basePlaylistService;
    private final SpotifyClient spotifyClient;
    private final AppSyncProperties appSyncProperties;

    public TrackAggregatorService(BasePlaylistService basePlaylistService,
                                  SpotifyClient spotifyClient,
                                  AppSyncProperties appSyncProperties) {
        this.basePlaylistService = basePlaylistService;
        this.spotifyClient = spotifyClient;
        this.appSyncProperties = appSyncProperties;
    }

    /**
     * @throws TrackAggregationException when a remote call fails; it carries the tracks fetched
     *                                   and the calls attempted so far
     */
    public PlaylistTrackSet aggregatePlaylistData(Long userId, Long basePlaylistId, SpotifyCredentials credentials) {
        BasePlaylistEntity basePlaylist = basePlaylistService.requireBasePlaylist(basePlaylistId, userId);
        PlaylistTrackSet trackSet = new PlaylistTrackSet();
        trackSet.setUserId(userId);
        trackSet.setBasePlaylistId(basePlaylistId);

        fetchAllTracks(trackSet, basePlaylist.getSpotifyPlaylistId(), credentials);
        fetchArtists(trackSet, credentials);
        for (TrackInfo track : trackSet.getTracks()) {
            enrichTrack(trackSet, track);
        }
        log.info("TRACKS_AGGREGATED basePlaylistId={} tracks={} artists={} apiCalls={}",
                basePlaylistId, trackSet.getTracks().size(), trackSet.getArtists().size(), trackSet.getApiCallCount());
        return trackSet;
    }

    private void fetchAllTracks(PlaylistTrackSet trackSet, String playlistId, SpotifyCredentials credentials) {
        int pageSize = Math.max(1, appSyncProperties.getTrackPageSize());
        int offset = 0;
        while (true) {
            checkNotInterrupted(trackSet);
            trackSet.setApiCallCount(trackSet.getApiCallCount() + 1);
            TrackPage page;
            try {
                page = spotifyClient.listPlaylistTracks(credentials, playlistId, pageSize, offset);
            } catch (SpotifyApiException e) {
                throw new TrackAggregationException("Failed to fetch playlist tracks at offset " + offset
                        + ": " + e.getMessage(), e, trackSet.getTracks().size(), trackSet.getApiCallCount());
            }
            trackSet.getTracks().addAll(page.getTracks());
            offset += page.getItemCount();
            log.debug("TRACK_PAGE_FETCHED playlistId={} items={} offset={} total={}",
                    playlistId, page.getItemCount(), offset, page.getTotal());
            if (page.getItemCount() == 0 || offset >= page.getTotal()) {
                return;
            }
        }
    }

    private void fetchArtists(PlaylistTrackSet trackSet, SpotifyCredentials credentials) {
        List<String> artistIds = trackSet.collectArtistIds();
        int batchSize = Math.max(1, Math.min(appSyncProperties.getArtistBatchSize(),
                SpotifyClient.MAX_ARTISTS_PER_REQUEST));
        for (int start = 0; start < artistIds.size(); start += batchSize) {
            checkNotInterrupted(trackSet);
            List<String> batch = artistIds.subList(start, Math.min(start + batchSize, artistIds.size()));
            trackSet.setApiCallCount(trackSet.getApiCallCount() + 1);
            List<ArtistInfo> artists;
            try {
                artists = spotifyClient.getSeveralArtists(credentials, new ArrayList<>(batch));
            } catch (SpotifyApiException e) {
                throw new TrackAggregationException("Failed to fetch artists: " + e.getMessage(), e,
                        trackSet.getTracks().size(), trackSet.getApiCallCount());
            }
            for (ArtistInfo artist : artists) {
                trackSet.getArtists().put(artist.getId(), artist);
            }
        }
    }

    private void enrichTrack(PlaylistTrackSet trackSet, TrackInfo track) {
        track.setReleaseYear(parseReleaseYear(track.getAlbum() == null ? null : track.getAlbum().getReleaseDate()));
        Set<String> genres = new LinkedHashSet<>();
        List<String> artistNames = new ArrayList<>();
        int maxPopularity = 0;
        for (String artistId : track.getArtistIds()) {
            ArtistInfo artist = trackSet.getArtists().get(artistId);
            if (artist == null) {
                continue;
            }
            if (artist.getGenres() != null) {
                for (String genre : artist.getGenres()) {
                    if (genre != null) {
                        genres.add(genre.toLowerCase(Locale.ROOT));
                    }
                }
            }
            if (artist.getName() != null) {
                artistNames.add(artist.getName());
            }
            maxPopularity = Math.max(maxPopularity, artist.getPopularity());
        }
        track.setAllGenres(new ArrayList<>(genres));
        track.setArtistNames(artistNames);
        track.setMaxArtistPopularity(maxPopularity);
    }

    /** Year from {@code YYYY}, {@code YYYY-MM} or {@code YYYY-MM-DD}; 0 when missing. */
    static int parseReleaseYear(String releaseDate) {
        if (releaseDate == null || releaseDate.length() < 4) {
            return 0;
        }
        try {
            return Integer.parseInt(releaseDate.substring(0, 4));
        } catch (NumberFormatException e) {
            log.debug("Unparsable release date: {}", releaseDate);
            return 0;
        }
    }

    private static void checkNotInterrupted(PlaylistTrackSet trackSet) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TrackAggregationException("Aggregation interrupted", new InterruptedException(),
                    trackSet.getTracks().size(), trackSet.getApiCallCount());
        }
    }
}
