package com.platform.eslsync.persistence;

import com.platform.eslsync.model.LocalEntityRecord;
import com.platform.eslsync.model.Store;
import com.platform.eslsync.model.SyncStatus;
import com.platform.eslsync.persistence.repository.PersonJpaRepository;
import com.platform.eslsync.persistence.repository.StoreJpaRepository;
import com.platform.eslsync.verification.VerificationPersistence;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Verification reads backed by JPA. People are the verified entity.
 */
@Component
public class JpaVerificationPersistence implements VerificationPersistence {
    
    private final StoreJpaRepository storeRepository;
    private final PersonJpaRepository personRepository;
    private final EntityMappers entityMappers;
    
    public JpaVerificationPersistence(
            StoreJpaRepository storeRepository,
            PersonJpaRepository personRepository,
            EntityMappers entityMappers) {
        this.storeRepository = storeRepository;
        this.personRepository = personRepository;
        this.entityMappers = entityMappers;
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<Store> listSyncEnabledStores() {
        return storeRepository.findBySyncEnabledTrue().stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<LocalEntityRecord> listSyncedLocalRecords(String storeId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return personRepository.findByStoreAndSyncStatus(storeId, SyncStatus.SYNCED, PageRequest.of(0, limit))
            .stream()
            .map(entityMappers::toDomain)
            .toList();
    }
}
