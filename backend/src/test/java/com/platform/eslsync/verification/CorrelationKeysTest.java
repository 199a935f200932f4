package com.platform.eslsync.verification;

import com.platform.eslsync.model.LocalEntityRecord;
import com.platform.eslsync.model.RemoteRecord;
import com.platform.eslsync.model.SyncStatus;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CorrelationKeysTest {

    @Test
    void localKeyPrefersExternalId() {
        LocalEntityRecord record = new LocalEntityRecord("p1", "EXT-1", "VS-1", SyncStatus.SYNCED, null);

        assertEquals(Optional.of("EXT-1"), CorrelationKeys.forLocal(record));
    }

    @Test
    void localKeyFallsBackToVirtualSpaceIdWhenExternalIdBlank() {
        LocalEntityRecord record = new LocalEntityRecord("p1", "   ", "VS-1", SyncStatus.SYNCED, null);

        assertEquals(Optional.of("VS-1"), CorrelationKeys.forLocal(record));
    }

    @Test
    void unlinkedLocalRecordHasNoKey() {
        LocalEntityRecord record = new LocalEntityRecord("p1", null, "", SyncStatus.SYNCED, null);

        assertEquals(Optional.empty(), CorrelationKeys.forLocal(record));
    }

    @Test
    void remoteKeyFollowsAliasOrder() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("id", "from-id");
        fields.put("ARTICLE_ID", "from-upper");
        fields.put("article_id", "from-snake");

        assertEquals(Optional.of("from-snake"), CorrelationKeys.forRemote(RemoteRecord.of(fields)));

        fields.put("articleId", "from-camel");
        assertEquals(Optional.of("from-camel"), CorrelationKeys.forRemote(RemoteRecord.of(fields)));
    }

    @Test
    void blankAliasFallsThroughToNextOne() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("articleId", " ");
        fields.put("id", "A-42");

        assertEquals(Optional.of("A-42"), CorrelationKeys.forRemote(RemoteRecord.of(fields)));
    }

    @Test
    void remoteKeyIsTrimmedAndNumericIdsAreStringified() {
        assertEquals(Optional.of("P-7"), CorrelationKeys.forRemote(RemoteRecord.of(Map.of("articleId", "  P-7 "))));
        assertEquals(Optional.of("1001"), CorrelationKeys.forRemote(RemoteRecord.of(Map.of("id", 1001))));
    }

    @Test
    void nonScalarIdentityIsIgnored() {
        RemoteRecord record = RemoteRecord.of(Map.of(
            "articleId", List.of("a", "b"),
            "data", Map.of("NAME", "x")
        ));

        assertEquals(Optional.empty(), CorrelationKeys.forRemote(record));
    }
}
