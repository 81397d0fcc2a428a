package com.example.playlistrouter.application.service;

import com.example.playlistrouter.common.config.AppSyncProperties;
import com.example.playlistrouter.common.exception.BusinessException;
import com.example.playlistrouter.common.exception.SyncErrorType;
import com.example.playlistrouter.common.exception.SyncFailedException;
import com.example.playlistrouter.domain.enumtype.SyncStatus;
import com.example.playlistrouter.domain.filter.FilterRuleException;
import com.example.playlistrouter.domain.model.PlaylistTrackSet;
import com.example.playlistrouter.domain.model.RemotePlaylist;
import com.example.playlistrouter.domain.model.SpotifyCredentials;
import com.example.playlistrouter.domain.model.SyncEvent;
import com.example.playlistrouter.infrastructure.persistence.entity.BasePlaylistEntity;
import com.example.playlistrouter.infrastructure.persistence.entity.ChildPlaylistEntity;
import com.example.playlistrouter.infrastructure.spotify.SpotifyClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Runs one sync of a base playlist: aggregate its tracks, route them through the filter
 * rules of each active child, then rebuild every routed child playlist on Spotify.
 *
 * <p>Rebuilding is delete-then-create, so a failure between the two steps leaves the child
 * without a remote playlist until the next successful sync.
 */
@Service
public class SyncOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestratorService.class);

    private static final String METRIC_SYNC = "playlist.router.sync";
    private static final String METRIC_SYNC_DURATION = "playlist.router.sync.duration";

    private final BasePlaylistService basePlaylistService;
    private final ChildPlaylistService childPlaylistService;
    private final SyncEventService syncEventService;
    private final SpotifyCredentialsService spotifyCredentialsService;
    private final TrackAggregatorService trackAggregatorService;
    private final TrackRouterService trackRouterService;
    private final SpotifyClient spotifyClient;
    private final ChildPlaylistNaming childPlaylistNaming;
    private final AppSyncProperties appSyncProperties;
    private final MeterRegistry meterRegistry;

    public SyncOrchestratorService(BasePlaylistService basePlaylistService,
                                   ChildPlaylistService childPlaylistService,
                                   SyncEventService syncEventService,
                                   SpotifyCredentialsService spotifyCredentialsService,
                                   TrackAggregatorService trackAggregatorService,
                                   TrackRouterService trackRouterService,
                                   SpotifyClient spotifyClient,
                                   ChildPlaylistNaming childPlaylistNaming,
                                   AppSyncProperties appSyncProperties,
                                   ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.basePlaylistService = basePlaylistService;
        this.childPlaylistService = childPlaylistService;
        this.syncEventService = syncEventService;
        this.spotifyCredentialsService = spotifyCredentialsService;
        this.trackAggregatorService = trackAggregatorService;
        this.trackRouterService = trackRouterService;
        this.spotifyClient = spotifyClient;
        this.childPlaylistNaming = childPlaylistNaming;
        this.appSyncProperties = appSyncProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * @return the event in its {@code COMPLETED} state
     * @throws BusinessException   {@code SYNC_IN_PROGRESS} when another sync of the base
     *                             playlist is running; no event is created
     * @throws SyncFailedException when the sync started and then failed; the carried event is
     *                             {@code FAILED} with its partial counters
     */
    public SyncEvent syncBasePlaylist(Long userId, Long basePlaylistId) {
        BasePlaylistEntity basePlaylist = basePlaylistService.requireBasePlaylist(basePlaylistId, userId);
        if (syncEventService.hasActiveSyncForBasePlaylist(userId, basePlaylistId)) {
            recordCounter("conflict");
            log.info("SYNC_REJECTED_IN_PROGRESS userId={} basePlaylistId={}", userId, basePlaylistId);
            throw new BusinessException(SyncErrorType.SYNC_IN_PROGRESS.name(),
                    "A sync is already in progress for base playlist " + basePlaylistId,
                    "Wait for the running sync to finish");
        }

        SyncEvent syncEvent = new SyncEvent();
        syncEvent.setUserId(userId);
        syncEvent.setBasePlaylistId(basePlaylistId);
        syncEvent.setStatus(SyncStatus.IN_PROGRESS);
        syncEvent.setStartedAt(LocalDateTime.now());
        try {
            syncEvent = syncEventService.createSyncEvent(syncEvent);
        } catch (BusinessException e) {
            if (SyncErrorType.SYNC_IN_PROGRESS.name().equals(e.getCode())) {
                recordCounter("conflict");
            }
            throw e;
        }
        log.info("SYNC_STARTED syncEventId={} userId={} basePlaylistId={}", syncEvent.getId(), userId, basePlaylistId);

        long startNanos = System.nanoTime();
        try {
            executeSync(syncEvent, basePlaylist);
        } catch (SyncStepException e) {
            throw failSync(syncEvent, e.getErrorType(), e.getMessage(), e.getCause(), startNanos);
        } catch (RuntimeException e) {
            throw failSync(syncEvent, SyncErrorType.SYNC_FAILED, "Sync failed: " + e.getMessage(), e, startNanos);
        }

        syncEvent.setStatus(SyncStatus.COMPLETED);
        syncEvent.setCompletedAt(LocalDateTime.now());
        persistFinalState(syncEvent);
        recordCounter("completed");
        recordDuration("completed", System.nanoTime() - startNanos);
        log.info("SYNC_COMPLETED syncEventId={} basePlaylistId={} children={} tracksProcessed={} apiRequests={}",
                syncEvent.getId(), basePlaylistId, syncEvent.getChildPlaylistIds().size(),
                syncEvent.getTracksProcessed(), syncEvent.getTotalApiRequests());
        return syncEvent;
    }

    private void executeSync(SyncEvent syncEvent, BasePlaylistEntity basePlaylist) {
        Long userId = syncEvent.getUserId();
        Long basePlaylistId = syncEvent.getBasePlaylistId();

        List<ChildPlaylistEntity> children;
        try {
            children = childPlaylistService.listActiveByBasePlaylist(basePlaylistId, userId);
        } catch (RuntimeException e) {
            throw new SyncStepException(SyncErrorType.SYNC_FAILED,
                    "Failed to load child playlists: " + e.getMessage(), e);
        }
        List<Long> childIds = new ArrayList<>(children.size());
        for (ChildPlaylistEntity child : children) {
            childIds.add(child.getId());
        }
        syncEvent.setChildPlaylistIds(childIds);
        if (children.isEmpty()) {
            log.info("SYNC_NO_CHILDREN syncEventId={} basePlaylistId={}", syncEvent.getId(), basePlaylistId);
            return;
        }

        SpotifyCredentials credentials;
        try {
            credentials = spotifyCredentialsService.requireCredentials(userId);
        } catch (BusinessException e) {
            throw new SyncStepException(SyncErrorType.SYNC_FAILED, e.getMessage(), e);
        }

        checkNotInterrupted("aggregate");
        PlaylistTrackSet trackSet;
        try {
            trackSet = trackAggregatorService.aggregatePlaylistData(userId, basePlaylistId, credentials);
        } catch (TrackAggregationException e) {
            syncEvent.setTracksProcessed(e.getTracksFetched());
            syncEvent.addApiRequests(e.getApiCallCount());
            if (e.getCause() instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                throw new SyncStepException(SyncErrorType.SYNC_CANCELED, "Sync canceled during aggregation", e);
            }
            throw new SyncStepException(SyncErrorType.SYNC_AGGREGATION_FAILED,
                    "Failed to aggregate track data: " + e.getMessage(), e);
        }
        syncEvent.setTracksProcessed(trackSet.getTracks().size());
        syncEvent.addApiRequests(trackSet.getApiCallCount());

        checkNotInterrupted("route");
        Map<String, List<String>> routed;
        try {
            routed = trackRouterService.routeTracksToChildren(trackSet, children);
        } catch (FilterRuleException e) {
            throw new SyncStepException(SyncErrorType.SYNC_ROUTING_FAILED,
                    "Failed to route tracks: " + e.getMessage(), e);
        }

        for (Map.Entry<String, List<String>> entry : routed.entrySet()) {
            ChildPlaylistEntity child = findBySpotifyPlaylistId(children, entry.getKey());
            if (child == null) {
                log.warn("SYNC_ROUTE_WITHOUT_CHILD syncEventId={} spotifyPlaylistId={}", syncEvent.getId(), entry.getKey());
                continue;
            }
            rebuildChildPlaylist(syncEvent, basePlaylist, child, entry.getValue(), credentials);
        }
    }

    /**
     * Unfollows the current remote playlist, creates a fresh one, points the child at it and
     * fills it in batches. Every attempted call is counted on the event.
     */
    private void rebuildChildPlaylist(SyncEvent syncEvent, BasePlaylistEntity basePlaylist,
                                      ChildPlaylistEntity child, List<String> trackUris,
                                      SpotifyCredentials credentials) {
        String oldPlaylistId = child.getSpotifyPlaylistId();
        String step = "delete playlist";
        try {
            checkNotInterrupted(step);
            syncEvent.addApiRequests(1);
            spotifyClient.deletePlaylist(credentials, oldPlaylistId);

            step = "create playlist";
            checkNotInterrupted(step);
            syncEvent.addApiRequests(1);
            RemotePlaylist created = spotifyClient.createPlaylist(credentials,
                    childPlaylistNaming.remoteName(basePlaylist.getName(), child.getName()),
                    childPlaylistNaming.remoteDescription(child.getDescription()),
                    false);

            step = "update playlist id";
            childPlaylistService.updateSpotifyPlaylistId(child.getId(), child.getUserId(), created.getId());
            child.setSpotifyPlaylistId(created.getId());

            step = "add tracks";
            int batchSize = Math.max(1, Math.min(appSyncProperties.getAddTracksBatchSize(),
                    SpotifyClient.MAX_TRACKS_PER_ADD));
            for (int start = 0; start < trackUris.size(); start += batchSize) {
                checkNotInterrupted(step);
                syncEvent.addApiRequests(1);
                spotifyClient.addTracksToPlaylist(credentials, created.getId(),
                        new ArrayList<>(trackUris.subList(start, Math.min(start + batchSize, trackUris.size()))));
            }
            log.info("SYNC_CHILD_REBUILT syncEventId={} childId={} oldPlaylistId={} newPlaylistId={} tracks={}",
                    syncEvent.getId(), child.getId(), oldPlaylistId, created.getId(), trackUris.size());
        } catch (SyncStepException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SyncStepException(SyncErrorType.SYNC_CANCELED, "Sync canceled during " + step
                        + " for child playlist " + child.getName(), e);
            }
            throw new SyncStepException(SyncErrorType.SYNC_RECONCILIATION_FAILED,
                    "Failed to " + step + " for child playlist " + child.getName()
                            + " (" + oldPlaylistId + "): " + e.getMessage(), e);
        }
    }

    private SyncFailedException failSync(SyncEvent syncEvent, SyncErrorType errorType, String message,
                                         Throwable cause, long startNanos) {
        syncEvent.setStatus(SyncStatus.FAILED);
        syncEvent.setCompletedAt(LocalDateTime.now());
        syncEvent.setErrorMessage(message);
        persistFinalState(syncEvent);
        recordCounter("failed");
        recordDuration("failed", System.nanoTime() - startNanos);
        log.warn("SYNC_FAILED syncEventId={} basePlaylistId={} errorType={} tracksProcessed={} apiRequests={} reason={}",
                syncEvent.getId(), syncEvent.getBasePlaylistId(), errorType, syncEvent.getTracksProcessed(),
                syncEvent.getTotalApiRequests(), message, cause);
        return new SyncFailedException(errorType, message, syncEvent, cause);
    }

    /** The sync outcome stands even when the final event write fails. */
    private void persistFinalState(SyncEvent syncEvent) {
        try {
            syncEventService.updateSyncEvent(syncEvent);
        } catch (RuntimeException e) {
            log.error("SYNC_EVENT_UPDATE_FAILED syncEventId={} status={}", syncEvent.getId(), syncEvent.getStatus(), e);
        }
    }

    private static ChildPlaylistEntity findBySpotifyPlaylistId(List<ChildPlaylistEntity> children, String playlistId) {
        for (ChildPlaylistEntity child : children) {
            if (playlistId.equals(child.getSpotifyPlaylistId())) {
                return child;
            }
        }
        return null;
    }

    private static void checkNotInterrupted(String step) {
        if (Thread.currentThread().isInterrupted()) {
            throw new SyncStepException(SyncErrorType.SYNC_CANCELED, "Sync canceled before " + step, null);
        }
    }

    private void recordCounter(String result) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(METRIC_SYNC, "result", result).increment();
        } catch (Exception ex) {
            log.debug("Sync metric counter failed, result={}", result, ex);
        }
    }

    private void recordDuration(String result, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(METRIC_SYNC_DURATION, "result", result).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Sync metric timer failed, result={}", result, ex);
        }
    }

    private static final class SyncStepException extends RuntimeException {

        private final SyncErrorType errorType;

        SyncStepException(SyncErrorType errorType, String message, Throwable cause) {
            super(message, cause);
            this.errorType = errorType;
        }

        SyncErrorType getErrorType() {
            return errorType;
        }
    }
}
