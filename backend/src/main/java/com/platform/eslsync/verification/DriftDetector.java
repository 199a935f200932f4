package com.platform.eslsync.verification;

import com.platform.eslsync.config.VerificationProperties;
import com.platform.eslsync.gateway.RemoteRecordGateway;
import com.platform.eslsync.model.EntityType;
import com.platform.eslsync.model.LocalEntityRecord;
import com.platform.eslsync.model.RemoteRecord;
import com.platform.eslsync.model.Store;
import com.platform.eslsync.model.VerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compares one store's SYNCED local records with the AIMS article set.
 * 
 * Local records without a correlation key were never linked to AIMS and are skipped.
 * Local records sharing a key are each reported when the key has no AIMS match.
 * A failed AIMS fetch yields an error result, never drift.
 */
@Slf4j
@Component
public class DriftDetector {
    
    private final VerificationPersistence persistence;
    private final RemoteRecordGateway gateway;
    private final VerificationProperties properties;
    
    public DriftDetector(
            VerificationPersistence persistence,
            RemoteRecordGateway gateway,
            VerificationProperties properties) {
        this.persistence = persistence;
        this.gateway = gateway;
        this.properties = properties;
    }
    
    public VerificationResult verify(Store store, EntityType entityType) {
        List<LocalEntityRecord> localRecords =
            persistence.listSyncedLocalRecords(store.id(), properties.getMaxLocalRecordsPerStore());
        
        List<RemoteRecord> remoteRecords;
        try {
            remoteRecords = gateway.fetchRemoteRecords(store.id());
        } catch (RuntimeException e) {
            log.warn("Could not fetch AIMS articles for {}: {}", store.displayName(), e.getMessage());
            return VerificationResult.fetchFailed(store, entityType, localRecords.size(),
                "Failed to fetch AIMS articles: " + e.getMessage());
        }
        
        Set<String> remoteKeys = new LinkedHashSet<>();
        for (RemoteRecord record : remoteRecords) {
            CorrelationKeys.forRemote(record).ifPresent(remoteKeys::add);
        }
        
        Set<String> localKeys = new LinkedHashSet<>();
        List<String> missingInRemote = new ArrayList<>();
        for (LocalEntityRecord record : localRecords) {
            Optional<String> key = CorrelationKeys.forLocal(record);
            if (key.isEmpty()) {
                continue;
            }
            localKeys.add(key.get());
            if (!remoteKeys.contains(key.get())) {
                missingInRemote.add(record.id());
            }
        }
        
        List<String> extraInRemote = new ArrayList<>();
        for (String key : remoteKeys) {
            if (!localKeys.contains(key)) {
                extraInRemote.add(key);
            }
        }
        
        log.debug("{}: local={} (keyed {}), remote={} (keyed {}), missing={}, extra={}",
            store.displayName(), localRecords.size(), localKeys.size(),
            remoteRecords.size(), remoteKeys.size(), missingInRemote.size(), extraInRemote.size());
        
        return VerificationResult.completed(store, entityType, localRecords.size(), remoteRecords.size(),
            missingInRemote, extraInRemote);
    }
}
