package com.example.playlistrouter.application.service;

import com.example.playlistrouter.common.exception.BusinessException;
import com.example.playlistrouter.common.exception.SyncErrorType;
import com.example.playlistrouter.domain.enumtype.SyncStatus;
import com.example.playlistrouter.domain.model.SyncEvent;
import com.example.playlistrouter.infrastructure.persistence.entity.SyncEventEntity;
import com.example.playlistrouter.infrastructure.persistence.mapper.SyncEventMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SyncEventService {

    private static final Logger log = LoggerFactory.getLogger(SyncEventService.class);
    private static final TypeReference<List<Long>> ID_LIST_TYPE = new TypeReference<List<Long>>() { };
    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;
    private static final int MAX_LIST_LIMIT = 100;

    private final SyncEventMapper syncEventMapper;
    private final ObjectMapper objectMapper;

    public SyncEventService(SyncEventMapper syncEventMapper, ObjectMapper objectMapper) {
        this.syncEventMapper = syncEventMapper;
        this.objectMapper = objectMapper;
    }

    public boolean hasActiveSyncForBasePlaylist(Long userId, Long basePlaylistId) {
        return syncEventMapper.countInProgress(userId, basePlaylistId) > 0;
    }

    /**
     * Persists a new event. The insert is conditional, so two requests racing past
     * {@link #hasActiveSyncForBasePlaylist} still leave a single IN_PROGRESS row.
     */
    public SyncEvent createSyncEvent(SyncEvent syncEvent) {
        SyncEventEntity entity = toEntity(syncEvent);
        int inserted = syncEventMapper.insertIfNoneInProgress(entity);
        if (inserted <= 0) {
            throw new BusinessException(SyncErrorType.SYNC_IN_PROGRESS.name(),
                    "A sync is already in progress for base playlist " + syncEvent.getBasePlaylistId(),
                    "Wait for the running sync to finish");
        }
        syncEvent.setId(entity.getId());
        log.info("SYNC_EVENT_CREATED id={} userId={} basePlaylistId={}",
                entity.getId(), syncEvent.getUserId(), syncEvent.getBasePlaylistId());
        return syncEvent;
    }

    public SyncEvent updateSyncEvent(SyncEvent syncEvent) {
        int updated = syncEventMapper.updateById(toEntity(syncEvent));
        if (updated <= 0) {
            throw new BusinessException("404", "Sync event not found: " + syncEvent.getId());
        }
        return syncEvent;
    }

    public SyncEvent getSyncEvent(Long id, Long userId) {
        SyncEventEntity entity = syncEventMapper.selectById(id, userId);
        if (entity == null) {
            throw new BusinessException("404", "Sync event not found");
        }
        return toModel(entity);
    }

    public List<SyncEvent> listSyncEvents(Long userId, Long basePlaylistId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return syncEventMapper.selectRecentByBasePlaylist(userId, basePlaylistId, safeLimit).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    private SyncEventEntity toEntity(SyncEvent syncEvent) {
        SyncEventEntity entity = new SyncEventEntity();
        entity.setId(syncEvent.getId());
        entity.setUserId(syncEvent.getUserId());
        entity.setBasePlaylistId(syncEvent.getBasePlaylistId());
        entity.setChildPlaylistIds(writeIds(syncEvent.getChildPlaylistIds()));
        entity.setStatus(syncEvent.getStatus() == null ? null : syncEvent.getStatus().name());
        entity.setStartedAt(syncEvent.getStartedAt());
        entity.setCompletedAt(syncEvent.getCompletedAt());
        entity.setTracksProcessed(syncEvent.getTracksProcessed());
        entity.setTotalApiRequests(syncEvent.getTotalApiRequests());
        entity.setErrorMessage(truncate(syncEvent.getErrorMessage()));
        return entity;
    }

    private SyncEvent toModel(SyncEventEntity entity) {
        SyncEvent syncEvent = new SyncEvent();
        syncEvent.setId(entity.getId());
        syncEvent.setUserId(entity.getUserId());
        syncEvent.setBasePlaylistId(entity.getBasePlaylistId());
        syncEvent.setChildPlaylistIds(readIds(entity.getId(), entity.getChildPlaylistIds()));
        syncEvent.setStatus(StringUtils.hasText(entity.getStatus()) ? SyncStatus.valueOf(entity.getStatus()) : null);
        syncEvent.setStartedAt(entity.getStartedAt());
        syncEvent.setCompletedAt(entity.getCompletedAt());
        syncEvent.setTracksProcessed(entity.getTracksProcessed() == null ? 0 : entity.getTracksProcessed());
        syncEvent.setTotalApiRequests(entity.getTotalApiRequests() == null ? 0 : entity.getTotalApiRequests());
        syncEvent.setErrorMessage(entity.getErrorMessage());
        syncEvent.setCreatedAt(entity.getCreatedAt());
        syncEvent.setUpdatedAt(entity.getUpdatedAt());
        return syncEvent;
    }

    private String writeIds(List<Long> ids) {
        try {
            return objectMapper.writeValueAsString(ids == null ? new ArrayList<Long>() : ids);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize child playlist ids", e);
        }
    }

    private List<Long> readIds(Long eventId, String json) {
        if (!StringUtils.hasText(json)) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, ID_LIST_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("SYNC_EVENT_CHILD_IDS_UNREADABLE id={} value={}", eventId, json);
            return new ArrayList<>();
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
