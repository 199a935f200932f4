package com.platform.eslsync.persistence;

import com.platform.eslsync.model.LocalEntityRecord;
import com.platform.eslsync.model.Store;
import com.platform.eslsync.persistence.entity.PersonEntity;
import com.platform.eslsync.persistence.entity.StoreEntity;
import org.springframework.stereotype.Component;

/**
 * Mappers from JPA entities to the read-only verification model.
 */
@Component
public class EntityMappers {
    
    // ==================== Store ====================
    
    public Store toDomain(StoreEntity entity) {
        return new Store(
            entity.getId(),
            entity.getCode(),
            entity.getName(),
            entity.getCompanyId(),
            entity.isSyncEnabled()
        );
    }
    
    // ==================== Person ====================
    
    public LocalEntityRecord toDomain(PersonEntity entity) {
        return new LocalEntityRecord(
            entity.getId(),
            entity.getExternalId(),
            entity.getVirtualSpaceId(),
            entity.getSyncStatus(),
            entity.getData()
        );
    }
}
