package com.platform.eslsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the sync queue.
 * Items are written here and executed against AIMS by the sync worker.
 */
@Entity
@Table(name = "sync_queue_items", indexes = {
    @Index(name = "idx_sync_queue_status_scheduled", columnList = "status, scheduled_at"),
    @Index(name = "idx_sync_queue_entity", columnList = "store_id, entity_type, entity_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncQueueItemEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "store_id", length = 36, nullable = false)
    private String storeId;
    
    /**
     * Wire name of the entity type, e.g. "person".
     */
    @Column(name = "entity_type", length = 20, nullable = false)
    private String entityType;
    
    @Column(name = "entity_id", length = 36, nullable = false)
    private String entityId;
    
    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private SyncAction action;
    
    /**
     * Serialized job payload as JSON.
     */
    @Column(length = 4000, nullable = false)
    private String payload;
    
    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    @Builder.Default
    private QueueStatus status = QueueStatus.PENDING;
    
    @Column(nullable = false)
    @Builder.Default
    private int attempts = 0;
    
    @Column(name = "max_attempts", nullable = false)
    @Builder.Default
    private int maxAttempts = 5;
    
    /**
     * Earliest time the worker may pick the item up.
     */
    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    public enum SyncAction {
        CREATE,
        UPDATE,
        DELETE
    }
    
    /**
     * Status of the queue item.
     */
    public enum QueueStatus {
        /** Waiting for the worker */
        PENDING,
        /** Currently being pushed to AIMS */
        PROCESSING,
        COMPLETED,
        /** Exceeded max attempts */
        FAILED
    }
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (scheduledAt == null) {
            scheduledAt = now;
        }
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
