package com.platform.eslsync.gateway;

import com.platform.eslsync.error.RemoteGatewayException;
import com.platform.eslsync.model.RemoteRecord;

import java.util.List;

/**
 * Read access to the authoritative record set held by AIMS.
 */
public interface RemoteRecordGateway {
    
    /**
     * Fetch every record AIMS holds for the store.
     *
     * @throws RemoteGatewayException on transport or application errors
     */
    List<RemoteRecord> fetchRemoteRecords(String storeId);
}
