package com.platform.eslsync.persistence;

import com.platform.eslsync.model.LocalEntityRecord;
import com.platform.eslsync.model.Store;
import com.platform.eslsync.model.SyncStatus;
import com.platform.eslsync.persistence.entity.PersonEntity;
import com.platform.eslsync.persistence.entity.StoreEntity;
import com.platform.eslsync.persistence.repository.PersonJpaRepository;
import com.platform.eslsync.persistence.repository.StoreJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class JpaVerificationPersistenceTest {

    @Autowired
    private StoreJpaRepository storeRepository;

    @Autowired
    private PersonJpaRepository personRepository;

    private JpaVerificationPersistence persistence;

    @BeforeEach
    void setUp() {
        persistence = new JpaVerificationPersistence(storeRepository, personRepository, new EntityMappers());
    }

    @Test
    void listsOnlySyncEnabledStores() {
        storeRepository.save(store("s1", "S001", true));
        storeRepository.save(store("s2", "S002", false));
        storeRepository.save(store("s3", "S003", true));

        List<Store> stores = persistence.listSyncEnabledStores();

        assertEquals(2, stores.size());
        assertTrue(stores.stream().allMatch(Store::syncEnabled));
        assertTrue(stores.stream().noneMatch(s -> s.id().equals("s2")));
    }

    @Test
    void capsSyncedRecordsPerStore() {
        storeRepository.save(store("s1", "S001", true));
        List<PersonEntity> people = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            people.add(person(String.format("p%03d", i), "s1", SyncStatus.SYNCED));
        }
        personRepository.saveAll(people);

        List<LocalEntityRecord> records = persistence.listSyncedLocalRecords("s1", 100);

        assertEquals(100, records.size());
    }

    @Test
    void readsOnlySyncedRecordsOfTheStore() {
        personRepository.save(person("p1", "s1", SyncStatus.SYNCED));
        personRepository.save(person("p2", "s1", SyncStatus.PENDING));
        personRepository.save(person("p3", "s1", SyncStatus.FAILED));
        personRepository.save(person("p4", "s2", SyncStatus.SYNCED));

        List<LocalEntityRecord> records = persistence.listSyncedLocalRecords("s1", 100);

        assertEquals(1, records.size());
        assertEquals("p1", records.get(0).id());
        assertEquals("EXT-p1", records.get(0).externalId());
        assertEquals(SyncStatus.SYNCED, records.get(0).syncStatus());
    }

    @Test
    void nonPositiveLimitReadsNothing() {
        personRepository.save(person("p1", "s1", SyncStatus.SYNCED));

        assertTrue(persistence.listSyncedLocalRecords("s1", 0).isEmpty());
    }

    private static StoreEntity store(String id, String code, boolean syncEnabled) {
        return StoreEntity.builder()
            .id(id)
            .code(code)
            .name("Store " + code)
            .companyId("c1")
            .syncEnabled(syncEnabled)
            .build();
    }

    private static PersonEntity person(String id, String storeId, SyncStatus status) {
        return PersonEntity.builder()
            .id(id)
            .storeId(storeId)
            .externalId("EXT-" + id)
            .syncStatus(status)
            .data("{}")
            .build();
    }
}
