package com.example.playlistrouter.infrastructure.spotify;

/**
 * Transport or non-2xx failure of a Spotify call. {@code statusCode} is -1 when no response
 * was received.
 */
public class SpotifyApiException extends RuntimeException {

    private final int statusCode;

    public SpotifyApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public SpotifyApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
