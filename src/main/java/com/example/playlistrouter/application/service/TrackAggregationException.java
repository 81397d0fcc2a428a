package com.example.playlistrouter.application.service;

/**
 * Aggregation stopped part way. The counters describe the work done up to and including the
 * failed call.
 */
public class TrackAggregationException extends RuntimeException {

    private final int tracksFetched;
    private final int apiCallCount;

    public TrackAggregationException(String message, Throwable cause, int tracksFetched, int apiCallCount) {
        super(message, cause);
        this.tracksFetched = tracksFetched;
        this.apiCallCount = apiCallCount;
    }

    public int getTracksFetched() {
        return tracksFetched;
    }

    public int getApiCallCount() {
        return apiCallCount;
    }
}
