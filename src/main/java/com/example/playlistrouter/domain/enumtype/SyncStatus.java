package com.example.playlistrouter.domain.enumtype;

public enum SyncStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
