package com.example.playlistrouter.common.exception;

import com.example.playlistrouter.domain.model.SyncEvent;

/**
 * Raised once a sync event has been created and the sync then failed. Carries the event in
 * its final {@code FAILED} state so callers can report the partial counters.
 */
public class SyncFailedException extends BusinessException {

    private final SyncErrorType errorType;
    private final transient SyncEvent syncEvent;

    public SyncFailedException(SyncErrorType errorType, String message, SyncEvent syncEvent, Throwable cause) {
        super(errorType.name(), message, cause);
        this.errorType = errorType;
        this.syncEvent = syncEvent;
    }

    public SyncErrorType getErrorType() {
        return errorType;
    }

    public SyncEvent getSyncEvent() {
        return syncEvent;
    }
}
