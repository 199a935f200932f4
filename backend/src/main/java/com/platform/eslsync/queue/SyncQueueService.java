package com.platform.eslsync.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.eslsync.error.SystemUnavailableException;
import com.platform.eslsync.model.EntityType;
import com.platform.eslsync.model.SyncStatus;
import com.platform.eslsync.persistence.entity.SyncQueueItemEntity;
import com.platform.eslsync.persistence.entity.SyncQueueItemEntity.QueueStatus;
import com.platform.eslsync.persistence.entity.SyncQueueItemEntity.SyncAction;
import com.platform.eslsync.persistence.repository.PersonJpaRepository;
import com.platform.eslsync.persistence.repository.SyncQueueItemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Database-backed sync queue.
 * 
 * Deduplicates on receipt: an open (PENDING or PROCESSING) item for the same entity
 * is refreshed instead of inserting a second one.
 */
@Slf4j
@Service
public class SyncQueueService implements ResyncQueue {
    
    private static final EnumSet<QueueStatus> OPEN_STATUSES = EnumSet.of(QueueStatus.PENDING, QueueStatus.PROCESSING);
    
    private final SyncQueueItemRepository queueRepository;
    private final PersonJpaRepository personRepository;
    private final ObjectMapper objectMapper;
    
    public SyncQueueService(
            SyncQueueItemRepository queueRepository,
            PersonJpaRepository personRepository,
            ObjectMapper objectMapper) {
        this.queueRepository = queueRepository;
        this.personRepository = personRepository;
        this.objectMapper = objectMapper;
    }
    
    /**
     * Queue an UPDATE for the entity and mark it PENDING locally.
     */
    @Override
    @Transactional
    public void enqueue(String storeId, EntityType entityType, String entityId, Map<String, Object> metadata) {
        markPending(entityType, entityId);
        queue(storeId, entityType, entityId, SyncAction.UPDATE, Map.of("changes", metadata));
    }
    
    /**
     * Queue a sync operation, returning the id of the new or refreshed item.
     */
    @Transactional
    public String queue(String storeId, EntityType entityType, String entityId,
            SyncAction action, Map<String, Object> payload) {
        String json = serialize(payload);
        Instant now = Instant.now();
        
        Optional<SyncQueueItemEntity> existing = queueRepository
            .findFirstByStoreIdAndEntityTypeAndEntityIdAndStatusIn(
                storeId, entityType.getWireName(), entityId, OPEN_STATUSES);
        
        if (existing.isPresent()) {
            SyncQueueItemEntity item = existing.get();
            item.setAction(action);
            item.setPayload(json);
            item.setScheduledAt(now);
            queueRepository.save(item);
            log.debug("Refreshed queued {} {} for {} in store {}", action, entityType.getWireName(), entityId, storeId);
            return item.getId();
        }
        
        SyncQueueItemEntity item = SyncQueueItemEntity.builder()
            .id(UUID.randomUUID().toString())
            .storeId(storeId)
            .entityType(entityType.getWireName())
            .entityId(entityId)
            .action(action)
            .payload(json)
            .status(QueueStatus.PENDING)
            .scheduledAt(now)
            .build();
        queueRepository.save(item);
        log.debug("Queued {} {} for {} in store {}", action, entityType.getWireName(), entityId, storeId);
        return item.getId();
    }
    
    private void markPending(EntityType entityType, String entityId) {
        // people are the only locally replicated entity this service owns
        if (entityType == EntityType.PERSON) {
            personRepository.updateSyncStatus(entityId, SyncStatus.PENDING, Instant.now());
        }
    }
    
    private String serialize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw SystemUnavailableException.syncQueue("Failed to serialize sync payload", e);
        }
    }
}
