package com.platform.eslsync.persistence.entity;

import com.platform.eslsync.model.SyncStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for people assigned to ESL spaces.
 * externalId / virtualSpaceId link the row to its AIMS article.
 */
@Entity
@Table(name = "people", indexes = {
    @Index(name = "idx_people_store_sync", columnList = "store_id, sync_status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "store_id", length = 36, nullable = false)
    private String storeId;
    
    @Column(name = "external_id", length = 100)
    private String externalId;
    
    @Column(name = "virtual_space_id", length = 100)
    private String virtualSpaceId;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", length = 20, nullable = false)
    @Builder.Default
    private SyncStatus syncStatus = SyncStatus.PENDING;
    
    /**
     * Serialized person data as JSON.
     */
    @Column(name = "data", length = 4000)
    private String data;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
