package com.recaprio.projection.monitor;

import com.recaprio.projection.domain.DriftRecordEntity;
import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DriftReason;
import com.recaprio.projection.model.DriftRecord;
import com.recaprio.projection.repository.DriftRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DriftLedger Tests")
class DriftLedgerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private DriftRecordRepository repository;

    @Mock
    private DriftReportSink sink;

    private DriftLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new DriftLedger(repository, sink, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void firstDetectionIsStoredAndReported() {
        DriftRecord record = mismatch(1L);
        when(repository.findFirstByRowKeyAndReasonAndResolvedFalse(1L, DriftReason.MISMATCH))
                .thenReturn(Optional.empty());

        boolean created = ledger.report(record);

        assertThat(created).isTrue();
        assertThat(ledger.hasOpenDrift(1L)).isTrue();
        verify(repository).save(any(DriftRecordEntity.class));
        verify(sink).report(record);
    }

    @Test
    void repeatedDetectionBumpsTheOpenEntry() {
        DriftRecordEntity open = new DriftRecordEntity(mismatch(1L));
        when(repository.findFirstByRowKeyAndReasonAndResolvedFalse(1L, DriftReason.MISMATCH))
                .thenReturn(Optional.of(open));

        boolean created = ledger.report(mismatch(1L));

        assertThat(created).isFalse();
        assertThat(open.getOccurrences()).isEqualTo(2);
        verify(repository, never()).save(any());
        verifyNoInteractions(sink);
    }

    @Test
    void resolveClosesOpenEntries() {
        when(repository.findOpenKeys()).thenReturn(List.of(2L));
        ledger.loadOpenKeys();
        DriftRecordEntity open = new DriftRecordEntity(mismatch(2L));
        when(repository.findByRowKeyAndResolvedFalse(2L)).thenReturn(List.of(open));

        int resolved = ledger.resolveOpen(2L);

        assertThat(resolved).isEqualTo(1);
        assertThat(open.isResolved()).isTrue();
        assertThat(open.getResolvedAt()).isEqualTo(NOW);
        assertThat(ledger.hasOpenDrift(2L)).isFalse();
    }

    @Test
    void resolvingAKeyWithoutOpenDriftSkipsTheRepository() {
        assertThat(ledger.resolveOpen(3L)).isZero();

        verify(repository, never()).findByRowKeyAndResolvedFalse(any());
    }

    @Test
    void rolledBackReportLeavesNoOpenKey() {
        when(repository.findFirstByRowKeyAndReasonAndResolvedFalse(4L, DriftReason.MISMATCH))
                .thenReturn(Optional.empty());
        TransactionSynchronizationManager.initSynchronization();
        try {
            ledger.report(mismatch(4L));

            assertThat(ledger.hasOpenDrift(4L)).isFalse();
            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        assertThat(ledger.hasOpenDrift(4L)).isFalse();
    }

    @Test
    void resolvedKeyStaysOpenUntilCommit() {
        when(repository.findOpenKeys()).thenReturn(List.of(5L));
        ledger.loadOpenKeys();
        when(repository.findByRowKeyAndResolvedFalse(5L)).thenReturn(List.of(new DriftRecordEntity(mismatch(5L))));
        TransactionSynchronizationManager.initSynchronization();
        try {
            ledger.resolveOpen(5L);

            assertThat(ledger.hasOpenDrift(5L)).isTrue();
            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        assertThat(ledger.hasOpenDrift(5L)).isFalse();
    }

    private static DriftRecord mismatch(Long key) {
        return new DriftRecord(key, DerivedAttributes.of("FreeCores", 2.0), DerivedAttributes.of("FreeCores", 1.0),
                NOW, DriftReason.MISMATCH, null);
    }
}
