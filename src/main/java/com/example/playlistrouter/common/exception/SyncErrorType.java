package com.example.playlistrouter.common.exception;

/**
 * Failure categories of a base playlist sync. The name doubles as the API error code.
 */
public enum SyncErrorType {

    /** Another sync of the same base playlist is still in progress. */
    SYNC_IN_PROGRESS,

    /** Paginated track or artist fetch failed. */
    SYNC_AGGREGATION_FAILED,

    /** A child's filter rules could not be parsed or evaluated. */
    SYNC_ROUTING_FAILED,

    /** Delete, create, id update or track insert failed for a child playlist. */
    SYNC_RECONCILIATION_FAILED,

    /** The sync thread was interrupted. */
    SYNC_CANCELED,

    SYNC_FAILED
}
