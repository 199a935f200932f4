package com.platform.eslsync.verification;

import com.platform.eslsync.model.LocalEntityRecord;
import com.platform.eslsync.model.Store;

import java.util.List;

/**
 * Read access to the local replica needed by verification.
 */
public interface VerificationPersistence {
    
    /**
     * All stores with sync enabled, unpaginated.
     */
    List<Store> listSyncEnabledStores();
    
    /**
     * At most {@code limit} SYNCED records of the store.
     */
    List<LocalEntityRecord> listSyncedLocalRecords(String storeId, int limit);
}
