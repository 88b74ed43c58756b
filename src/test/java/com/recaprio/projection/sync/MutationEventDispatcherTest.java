package com.recaprio.projection.sync;

import com.recaprio.projection.config.SyncProperties;
import com.recaprio.projection.exception.StoreUnavailableException;
import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.MutationEvent;
import com.recaprio.projection.model.ProjectionMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MutationEventDispatcher Tests")
class MutationEventDispatcherTest {

    @Mock
    private Synchronizer synchronizer;

    private SyncProperties properties;
    private MutationEventDispatcher dispatcher;
    private MutationEvent event;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.setUpsertTimeout(Duration.ofMillis(100));
        dispatcher = new MutationEventDispatcher(synchronizer, properties);
        BaseRow row = new BaseRow(1L, Map.of("FreeGHz", 4.8), 1, Instant.now());
        event = MutationEvent.insert(row, row.updatedAt());
    }

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void synchronousInlineModeAppliesInsideTheTransaction() {
        properties.setMode(ProjectionMode.INLINE);
        when(synchronizer.applyInTransaction(event)).thenReturn(SyncOutcome.APPLIED);

        dispatcher.onMutation(event);

        verify(synchronizer).applyInTransaction(event);
        verify(synchronizer, never()).submitOnCommit(any());
    }

    @Test
    void storeFailureInsideTheTransactionReachesTheWriter() {
        properties.setMode(ProjectionMode.INDEXED_VIEW);
        when(synchronizer.applyInTransaction(event))
                .thenThrow(new StoreUnavailableException("down", null));

        assertThatThrownBy(() -> dispatcher.onMutation(event))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void synchronousSummaryModeWritesAfterCommit() {
        properties.setMode(ProjectionMode.SUMMARY_TABLE);
        when(synchronizer.submitOnCommit(event)).thenReturn(CompletableFuture.completedFuture(SyncOutcome.APPLIED));

        dispatcher.onMutation(event);

        assertThat(dispatcher.appliesInTransaction()).isFalse();
        verify(synchronizer, never()).applyInTransaction(any());
        verify(synchronizer).submitOnCommit(event);
    }

    @Test
    void summaryModeQueuesBeforeCommitAndWaitsAfterIt() {
        properties.setMode(ProjectionMode.SUMMARY_TABLE);
        CompletableFuture<SyncOutcome> outcome = new CompletableFuture<>();
        when(synchronizer.submitOnCommit(event)).thenReturn(outcome);
        TransactionSynchronizationManager.initSynchronization();

        dispatcher.onMutation(event);

        verify(synchronizer).submitOnCommit(event);
        List<TransactionSynchronization> registered = TransactionSynchronizationManager.getSynchronizations();
        assertThat(registered).hasSize(1);
        outcome.complete(SyncOutcome.APPLIED);
        assertThatCode(() -> registered.get(0).afterCommit()).doesNotThrowAnyException();
    }

    @Test
    void slowProjectionDoesNotFailTheWriter() {
        properties.setMode(ProjectionMode.SUMMARY_TABLE);
        when(synchronizer.submitOnCommit(event)).thenReturn(new CompletableFuture<>());

        assertThatCode(() -> dispatcher.onMutation(event)).doesNotThrowAnyException();
    }

    @Test
    void nonZeroWindowDefersEveryMode() {
        properties.setMode(ProjectionMode.INLINE);
        properties.setStalenessWindow(Duration.ofSeconds(30));
        when(synchronizer.submitOnCommit(event)).thenReturn(new CompletableFuture<>());
        TransactionSynchronizationManager.initSynchronization();

        dispatcher.onMutation(event);

        verify(synchronizer, never()).applyInTransaction(any());
        verify(synchronizer).submitOnCommit(event);
        assertThat(TransactionSynchronizationManager.getSynchronizations()).isEmpty();
    }
}
