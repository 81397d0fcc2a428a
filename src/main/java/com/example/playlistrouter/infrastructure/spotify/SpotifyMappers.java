package com.example.playlistrouter.infrastructure.spotify;

import com.example.playlistrouter.domain.model.AlbumInfo;
import com.example.playlistrouter.domain.model.ArtistInfo;
import com.example.playlistrouter.domain.model.TrackInfo;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyAlbum;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyArtist;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyPlaylistItem;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyTrack;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class SpotifyMappers {

    private SpotifyMappers() {
    }

    /** Skips local files, removed tracks and podcast episodes. */
    static List<TrackInfo> toTracks(List<SpotifyPlaylistItem> items) {
        if (items == null) {
            return Collections.emptyList();
        }
        List<TrackInfo> tracks = new ArrayList<>(items.size());
        for (SpotifyPlaylistItem item : items) {
            if (item == null || item.isLocal() || item.getTrack() == null) {
                continue;
            }
            SpotifyTrack track = item.getTrack();
            if (track.getId() == null || (track.getType() != null && !"track".equals(track.getType()))) {
                continue;
            }
            tracks.add(toTrack(track));
        }
        return tracks;
    }

    static TrackInfo toTrack(SpotifyTrack source) {
        TrackInfo track = new TrackInfo();
        track.setId(source.getId());
        track.setName(source.getName());
        track.setUri(source.getUri());
        track.setDurationMs(source.getDurationMs() == null ? 0 : source.getDurationMs());
        track.setPopularity(source.getPopularity() == null ? 0 : source.getPopularity());
        track.setExplicit(Boolean.TRUE.equals(source.getExplicit()));
        track.setAlbum(toAlbum(source.getAlbum()));
        List<String> artistIds = new ArrayList<>();
        if (source.getArtists() != null) {
            for (SpotifyArtist artist : source.getArtists()) {
                if (artist != null && artist.getId() != null) {
                    artistIds.add(artist.getId());
                }
            }
        }
        track.setArtistIds(artistIds);
        return track;
    }

    static AlbumInfo toAlbum(SpotifyAlbum source) {
        if (source == null) {
            return new AlbumInfo();
        }
        return new AlbumInfo(source.getId(), source.getName(), source.getReleaseDate(), source.getUri());
    }

    static ArtistInfo toArtist(SpotifyArtist source) {
        return new ArtistInfo(
                source.getId(),
                source.getName(),
                source.getGenres() == null ? Collections.emptyList() : source.getGenres(),
                source.getPopularity() == null ? 0 : source.getPopularity(),
                source.getUri());
    }
}
