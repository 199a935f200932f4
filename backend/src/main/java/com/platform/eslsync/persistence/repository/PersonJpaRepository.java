package com.platform.eslsync.persistence.repository;

import com.platform.eslsync.model.SyncStatus;
import com.platform.eslsync.persistence.entity.PersonEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for people.
 */
@Repository
public interface PersonJpaRepository extends JpaRepository<PersonEntity, String> {
    
    /**
     * Find people of a store in the given sync state, oldest first.
     */
    @Query("SELECT p FROM PersonEntity p " +
           "WHERE p.storeId = :storeId AND p.syncStatus = :syncStatus " +
           "ORDER BY p.createdAt ASC, p.id ASC")
    List<PersonEntity> findByStoreAndSyncStatus(
        @Param("storeId") String storeId,
        @Param("syncStatus") SyncStatus syncStatus,
        Pageable pageable
    );
    
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PersonEntity p SET p.syncStatus = :syncStatus, p.updatedAt = :now WHERE p.id = :id")
    int updateSyncStatus(
        @Param("id") String id,
        @Param("syncStatus") SyncStatus syncStatus,
        @Param("now") Instant now
    );
}
