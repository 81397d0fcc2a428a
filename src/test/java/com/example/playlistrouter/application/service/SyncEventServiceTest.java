package com.example.playlistrouter.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.playlistrouter.common.exception.BusinessException;
import com.example.playlistrouter.domain.enumtype.SyncStatus;
import com.example.playlistrouter.domain.model.SyncEvent;
import com.example.playlistrouter.infrastructure.persistence.entity.SyncEventEntity;
import com.example.playlistrouter.infrastructure.persistence.mapper.SyncEventMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SyncEventServiceTest {

    private SyncEventService service;
    private SyncEventMapper syncEventMapper;

    @BeforeEach
    void setUp() {
        syncEventMapper = mock(SyncEventMapper.class);
        service = new SyncEventService(syncEventMapper, new ObjectMapper());
    }

    @Test
    void createShouldStoreInProgressEvent() {
        when(syncEventMapper.insertIfNoneInProgress(any(SyncEventEntity.class))).thenAnswer(invocation -> {
            SyncEventEntity entity = invocation.getArgument(0);
            entity.setId(42L);
            return 1;
        });

        SyncEvent created = service.createSyncEvent(event());

        assertEquals(42L, created.getId());
        ArgumentCaptor<SyncEventEntity> captor = ArgumentCaptor.forClass(SyncEventEntity.class);
        verify(syncEventMapper).insertIfNoneInProgress(captor.capture());
        assertEquals("IN_PROGRESS", captor.getValue().getStatus());
        assertEquals("[]", captor.getValue().getChildPlaylistIds());
    }

    @Test
    void createShouldReportConflictWhenGuardedInsertSkips() {
        when(syncEventMapper.insertIfNoneInProgress(any(SyncEventEntity.class))).thenReturn(0);

        BusinessException error = assertThrows(BusinessException.class, () -> service.createSyncEvent(event()));

        assertEquals("SYNC_IN_PROGRESS", error.getCode());
    }

    @Test
    void updateShouldWriteChildIdsAsJson() {
        when(syncEventMapper.updateById(any(SyncEventEntity.class))).thenReturn(1);
        SyncEvent event = event();
        event.setId(42L);
        event.setChildPlaylistIds(Arrays.asList(11L, 12L));
        event.setStatus(SyncStatus.COMPLETED);

        service.updateSyncEvent(event);

        ArgumentCaptor<SyncEventEntity> captor = ArgumentCaptor.forClass(SyncEventEntity.class);
        verify(syncEventMapper).updateById(captor.capture());
        assertEquals("[11,12]", captor.getValue().getChildPlaylistIds());
        assertEquals("COMPLETED", captor.getValue().getStatus());
    }

    @Test
    void getShouldMapStoredRow() {
        SyncEventEntity entity = new SyncEventEntity();
        entity.setId(42L);
        entity.setUserId(1L);
        entity.setBasePlaylistId(7L);
        entity.setChildPlaylistIds("[11,12]");
        entity.setStatus("FAILED");
        entity.setTracksProcessed(50);
        entity.setTotalApiRequests(2);
        entity.setErrorMessage("Failed to aggregate track data");
        when(syncEventMapper.selectById(42L, 1L)).thenReturn(entity);

        SyncEvent event = service.getSyncEvent(42L, 1L);

        assertEquals(SyncStatus.FAILED, event.getStatus());
        assertEquals(Arrays.asList(11L, 12L), event.getChildPlaylistIds());
        assertEquals(50, event.getTracksProcessed());
        assertEquals(2, event.getTotalApiRequests());
    }

    @Test
    void getShouldBeScopedToOwner() {
        BusinessException error = assertThrows(BusinessException.class, () -> service.getSyncEvent(42L, 2L));

        assertEquals("404", error.getCode());
    }

    @Test
    void listShouldClampLimit() {
        when(syncEventMapper.selectRecentByBasePlaylist(1L, 7L, 100)).thenReturn(Collections.emptyList());

        assertTrue(service.listSyncEvents(1L, 7L, 5000).isEmpty());
        verify(syncEventMapper).selectRecentByBasePlaylist(1L, 7L, 100);
    }

    @Test
    void activeSyncShouldFollowInProgressCount() {
        when(syncEventMapper.countInProgress(1L, 7L)).thenReturn(1);

        assertTrue(service.hasActiveSyncForBasePlaylist(1L, 7L));
        assertFalse(service.hasActiveSyncForBasePlaylist(1L, 8L));
    }

    private SyncEvent event() {
        SyncEvent event = new SyncEvent();
        event.setUserId(1L);
        event.setBasePlaylistId(7L);
        event.setStatus(SyncStatus.IN_PROGRESS);
        event.setStartedAt(LocalDateTime.now());
        return event;
    }
}
