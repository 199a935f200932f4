package com.platform.eslsync.queue;

import com.platform.eslsync.model.EntityType;

import java.util.Map;

/**
 * Accepts corrective sync jobs for the asynchronous sync worker.
 * Repeated submissions for the same (storeId, entityType, entityId) must be harmless.
 */
public interface ResyncQueue {
    
    void enqueue(String storeId, EntityType entityType, String entityId, Map<String, Object> metadata);
}
