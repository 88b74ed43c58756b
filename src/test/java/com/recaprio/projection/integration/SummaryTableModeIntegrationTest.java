package com.recaprio.projection.integration;

import com.recaprio.projection.ProjectionSyncApplication;
import com.recaprio.projection.model.ProjectionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = ProjectionSyncApplication.class, properties = "app.sync.mode=summary-table")
@ActiveProfiles("test")
@DisplayName("summary-table mode integration tests")
class SummaryTableModeIntegrationTest extends ProjectionScenarios {

    @Test
    void removedRowsArePurgedAfterRetention() {
        long key = nextKey();
        baseRelationService.replace(key, Map.of("FreeGHz", 2.4));
        awaitProjection(key);
        baseRelationService.delete(key);
        awaitCondition(() -> store.get(key).isEmpty());

        assertThat(store.purgeRemovedBefore(Instant.now().plusSeconds(60))).isPositive();
        assertThat(store.mode()).isEqualTo(ProjectionMode.SUMMARY_TABLE);
    }
}
