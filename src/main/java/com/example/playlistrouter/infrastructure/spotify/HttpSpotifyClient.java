package com.example.playlistrouter.infrastructure.spotify;

import com.example.playlistrouter.common.config.AppSpotifyProperties;
import com.example.playlistrouter.domain.model.ArtistInfo;
import com.example.playlistrouter.domain.model.RemotePlaylist;
import com.example.playlistrouter.domain.model.SpotifyCredentials;
import com.example.playlistrouter.domain.model.TrackPage;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyAddTracksRequest;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyArtist;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyArtistsResponse;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyPage;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyPlaylist;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyPlaylistDetailsRequest;
import com.example.playlistrouter.infrastructure.spotify.dto.SpotifyPlaylistItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.PreDestroy;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpEntityEnclosingRequestBase;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

@Component
public class HttpSpotifyClient implements SpotifyClient {

    private static final Logger log = LoggerFactory.getLogger(HttpSpotifyClient.class);
    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private final String apiBaseUrl;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;
    private final JavaType playlistItemsPageType;

    @Autowired
    public HttpSpotifyClient(AppSpotifyProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, buildHttpClient(properties));
    }

    HttpSpotifyClient(AppSpotifyProperties properties, ObjectMapper objectMapper, CloseableHttpClient httpClient) {
        this.apiBaseUrl = trimTrailingSlash(properties.getApiBaseUrl());
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.playlistItemsPageType = objectMapper.getTypeFactory()
                .constructType(new TypeReference<SpotifyPage<SpotifyPlaylistItem>>() { });
    }

    @Override
    public TrackPage listPlaylistTracks(SpotifyCredentials credentials, String playlistId, int limit, int offset) {
        String url = apiBaseUrl + "/playlists/" + encode(playlistId) + "/tracks?limit=" + limit + "&offset=" + offset;
        SpotifyPage<SpotifyPlaylistItem> page = execute(new HttpGet(url), credentials, playlistItemsPageType);
        if (page == null) {
            throw new SpotifyApiException(200, "Empty playlist tracks response, playlistId=" + playlistId);
        }
        int itemCount = page.getItems() == null ? 0 : page.getItems().size();
        int total = page.getTotal() == null ? offset + itemCount : page.getTotal();
        return new TrackPage(SpotifyMappers.toTracks(page.getItems()), itemCount, total);
    }

    @Override
    public List<ArtistInfo> getSeveralArtists(SpotifyCredentials credentials, List<String> artistIds) {
        if (artistIds == null || artistIds.isEmpty()) {
            return Collections.emptyList();
        }
        if (artistIds.size() > MAX_ARTISTS_PER_REQUEST) {
            throw new IllegalArgumentException("At most " + MAX_ARTISTS_PER_REQUEST + " artists per request, got "
                    + artistIds.size());
        }
        String url = apiBaseUrl + "/artists?ids=" + UriUtils.encodeQueryParam(String.join(",", artistIds),
                StandardCharsets.UTF_8);
        SpotifyArtistsResponse response = execute(new HttpGet(url), credentials,
                objectMapper.constructType(SpotifyArtistsResponse.class));
        if (response == null || response.getArtists() == null) {
            return Collections.emptyList();
        }
        List<ArtistInfo> artists = new ArrayList<>(response.getArtists().size());
        for (SpotifyArtist artist : response.getArtists()) {
            // unknown ids come back as null entries
            if (artist != null && artist.getId() != null) {
                artists.add(SpotifyMappers.toArtist(artist));
            }
        }
        return artists;
    }

    @Override
    public void deletePlaylist(SpotifyCredentials credentials, String playlistId) {
        String url = apiBaseUrl + "/playlists/" + encode(playlistId) + "/followers";
        execute(new HttpDelete(url), credentials, null);
    }

    @Override
    public RemotePlaylist createPlaylist(SpotifyCredentials credentials, String name, String description, boolean isPublic) {
        if (credentials == null || !StringUtils.hasText(credentials.getSpotifyUserId())) {
            throw new SpotifyApiException(-1, "Spotify user id is required to create a playlist");
        }
        String url = apiBaseUrl + "/users/" + encode(credentials.getSpotifyUserId()) + "/playlists";
        HttpPost post = new HttpPost(url);
        setJsonBody(post, new SpotifyPlaylistDetailsRequest(name, description, isPublic));
        SpotifyPlaylist created = execute(post, credentials, objectMapper.constructType(SpotifyPlaylist.class));
        if (created == null || !StringUtils.hasText(created.getId())) {
            throw new SpotifyApiException(201, "Spotify returned no playlist id for created playlist " + name);
        }
        return new RemotePlaylist(created.getId(), created.getName());
    }

    @Override
    public void addTracksToPlaylist(SpotifyCredentials credentials, String playlistId, List<String> trackUris) {
        if (trackUris == null || trackUris.isEmpty()) {
            return;
        }
        if (trackUris.size() > MAX_TRACKS_PER_ADD) {
            throw new IllegalArgumentException("At most " + MAX_TRACKS_PER_ADD + " tracks per request, got "
                    + trackUris.size());
        }
        HttpPost post = new HttpPost(apiBaseUrl + "/playlists/" + encode(playlistId) + "/tracks");
        setJsonBody(post, new SpotifyAddTracksRequest(trackUris));
        execute(post, credentials, null);
    }

    @Override
    public void updatePlaylistDetails(SpotifyCredentials credentials, String playlistId, String name, String description) {
        HttpPut put = new HttpPut(apiBaseUrl + "/playlists/" + encode(playlistId));
        setJsonBody(put, new SpotifyPlaylistDetailsRequest(name, description, null));
        execute(put, credentials, null);
    }

    @PreDestroy
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.warn("Failed to close spotify http client", e);
        }
    }

    private <T> T execute(HttpRequestBase request, SpotifyCredentials credentials, JavaType responseType) {
        if (credentials == null || !StringUtils.hasText(credentials.getAccessToken())) {
            throw new SpotifyApiException(401, "Missing Spotify access token");
        }
        request.setHeader("Authorization", "Bearer " + credentials.getAccessToken());
        request.setHeader("Accept", "application/json");
        long start = System.currentTimeMillis();
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            String body = entity == null ? null : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            long cost = System.currentTimeMillis() - start;
            if (status < 200 || status >= 300) {
                log.warn("SPOTIFY_CALL_FAILED method={} uri={} status={} costMs={}",
                        request.getMethod(), request.getURI().getPath(), status, cost);
                throw new SpotifyApiException(status, "Spotify " + request.getMethod() + " "
                        + request.getURI().getPath() + " failed (status " + status + "): " + truncate(body));
            }
            log.debug("SPOTIFY_CALL method={} uri={} status={} costMs={}",
                    request.getMethod(), request.getURI().getPath(), status, cost);
            if (responseType == null || !StringUtils.hasText(body)) {
                return null;
            }
            return objectMapper.readValue(body, responseType);
        } catch (JsonProcessingException e) {
            throw new SpotifyApiException("Unreadable Spotify response for " + request.getURI().getPath(), e);
        } catch (InterruptedIOException e) {
            throw new SpotifyApiException("Spotify call timed out or was interrupted: "
                    + request.getMethod() + " " + request.getURI().getPath(), e);
        } catch (IOException e) {
            throw new SpotifyApiException("Spotify network error: " + e.getMessage(), e);
        }
    }

    private void setJsonBody(HttpEntityEnclosingRequestBase request, Object body) {
        try {
            request.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Spotify request body", e);
        }
    }

    private static CloseableHttpClient buildHttpClient(AppSpotifyProperties properties) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(properties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(properties.getConnectTimeoutMs())
                .setSocketTimeout(properties.getSocketTimeoutMs())
                .build();
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(Math.max(1, properties.getMaxConnections()));
        cm.setDefaultMaxPerRoute(Math.max(1, properties.getMaxConnections()));
        return HttpClients.custom()
                .setConnectionManager(cm)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    private static String encode(String pathSegment) {
        return UriUtils.encodePathSegment(pathSegment, StandardCharsets.UTF_8);
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_BODY_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_BODY_LENGTH);
    }
}
