package com.platform.eslsync.verification;

import com.platform.eslsync.error.SystemUnavailableException;
import com.platform.eslsync.model.Store;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Selects the stores that take part in a verification run.
 */
@Slf4j
@Component
public class StoreEnumerator {
    
    private final VerificationPersistence persistence;
    
    public StoreEnumerator(VerificationPersistence persistence) {
        this.persistence = persistence;
    }
    
    /**
     * Every store with sync enabled. Not paginated.
     *
     * @throws SystemUnavailableException when the store list cannot be read
     */
    public List<Store> list() {
        try {
            List<Store> stores = persistence.listSyncEnabledStores();
            log.debug("Found {} sync-enabled stores", stores.size());
            return stores;
        } catch (RuntimeException e) {
            throw SystemUnavailableException.database("Failed to list sync-enabled stores: " + e.getMessage(), e);
        }
    }
}
