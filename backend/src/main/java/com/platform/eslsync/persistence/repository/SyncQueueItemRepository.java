package com.platform.eslsync.persistence.repository;

import com.platform.eslsync.persistence.entity.SyncQueueItemEntity;
import com.platform.eslsync.persistence.entity.SyncQueueItemEntity.QueueStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the sync queue.
 */
@Repository
public interface SyncQueueItemRepository extends JpaRepository<SyncQueueItemEntity, String> {
    
    /**
     * Find an open item for the same entity (for dedup-on-receipt).
     */
    Optional<SyncQueueItemEntity> findFirstByStoreIdAndEntityTypeAndEntityIdAndStatusIn(
        String storeId,
        String entityType,
        String entityId,
        Collection<QueueStatus> statuses
    );
    
    List<SyncQueueItemEntity> findByStoreIdAndEntityId(String storeId, String entityId);
    
    long countByStatus(QueueStatus status);
}
