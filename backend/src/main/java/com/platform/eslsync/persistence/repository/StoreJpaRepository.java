package com.platform.eslsync.persistence.repository;

import com.platform.eslsync.persistence.entity.StoreEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for stores.
 */
@Repository
public interface StoreJpaRepository extends JpaRepository<StoreEntity, String> {
    
    List<StoreEntity> findBySyncEnabledTrue();
}
