package com.recaprio.projection.integration;

import com.recaprio.projection.ProjectionSyncApplication;
import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.MutationEvent;
import com.recaprio.projection.model.SyncState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = ProjectionSyncApplication.class, properties = "app.sync.mode=indexed-view")
@ActiveProfiles("test")
@DisplayName("indexed-view mode integration tests")
class IndexedViewModeIntegrationTest extends ProjectionScenarios {

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    void deleteLeavesATombstoneThatBlocksOlderWrites() {
        long key = nextKey();
        MutationEvent insert = baseRelationService.replace(key, Map.of("FreeGHz", 2.4)).orElseThrow();
        awaitProjection(key);
        baseRelationService.delete(key);
        awaitCondition(() -> store.get(key).isEmpty());

        assertThat(store.upsert(key, DerivedAttributes.of("FreeCores", 1.0), insert.sequence())).isFalse();
        assertThat(store.get(key)).isEmpty();
    }

    @Test
    void rolledBackProjectionDoesNotBlockTheNextCommit() {
        long key = nextKey();
        BaseRow phantom = new BaseRow(key, Map.of("FreeGHz", 9.6), 1_000_000L, Instant.now());
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            synchronizer.applyInTransaction(MutationEvent.insert(phantom, phantom.updatedAt()));
            status.setRollbackOnly();
        });

        MutationEvent insert = baseRelationService.replace(key, Map.of("FreeGHz", 4.8)).orElseThrow();

        DerivedRow row = awaitProjection(key);
        assertThat(row.sourceVersion()).isEqualTo(insert.sequence());
        assertThat(synchronizer.status(key).state()).isEqualTo(SyncState.CONSISTENT);
        assertThat(synchronizer.status(key).latestSequence()).isEqualTo(insert.sequence());
    }
}
