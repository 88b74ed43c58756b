package com.recaprio.projection.sync;

import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.KeyStatus;
import com.recaprio.projection.model.MutationEvent;
import com.recaprio.projection.model.SyncState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KeyTracker Tests")
class KeyTrackerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final KeyTracker tracker = new KeyTracker();

    @Test
    void firstMutationIsAcceptedFromAbsent() {
        KeyTracker.Admission admission = tracker.admit(feed(1L, 5), T0);

        assertThat(admission.decision()).isEqualTo(KeyTracker.Decision.ACCEPTED);
        assertThat(admission.previousState()).isEqualTo(SyncState.ABSENT);
        assertThat(admission.lastSequence()).isZero();
        assertThat(tracker.state(1L)).isEqualTo(SyncState.PENDING);
    }

    @Test
    void evaluationAloneLeavesTheKeyUntracked() {
        KeyTracker.Admission admission = tracker.evaluate(feed(1L, 900));

        assertThat(admission.decision()).isEqualTo(KeyTracker.Decision.ACCEPTED);
        assertThat(tracker.isTracked(1L)).isFalse();
        assertThat(tracker.admit(feed(1L, 3), T0).decision()).isEqualTo(KeyTracker.Decision.ACCEPTED);
    }

    @Test
    void lateRecordOfAnOlderSequenceKeepsTheNewerState() {
        tracker.admit(feed(1L, 8), T0);
        tracker.markSettled(1L, 8, SyncState.CONSISTENT, T0);

        tracker.record(feed(1L, 6), T0);

        assertThat(tracker.state(1L)).isEqualTo(SyncState.CONSISTENT);
        assertThat(tracker.status(1L).latestSequence()).isEqualTo(8);
    }

    @Test
    void sameFeedSequenceIsADuplicate() {
        tracker.admit(feed(1L, 5), T0);
        tracker.markSettled(1L, 5, SyncState.CONSISTENT, T0);

        assertThat(tracker.admit(feed(1L, 5), T0).decision()).isEqualTo(KeyTracker.Decision.DUPLICATE);
        assertThat(tracker.state(1L)).isEqualTo(SyncState.CONSISTENT);
    }

    @Test
    void olderFeedSequenceIsOutOfOrder() {
        tracker.admit(feed(1L, 7), T0);

        KeyTracker.Admission admission = tracker.admit(feed(1L, 4), T0);

        assertThat(admission.decision()).isEqualTo(KeyTracker.Decision.OUT_OF_ORDER);
        assertThat(admission.lastSequence()).isEqualTo(7);
    }

    @Test
    void olderReplayIsSupersededRatherThanAViolation() {
        tracker.admit(feed(1L, 7), T0);

        KeyTracker.Admission admission = tracker.admit(SyncTask.of(event(1L, 4), SyncTask.Origin.REPLAY), T0);

        assertThat(admission.decision()).isEqualTo(KeyTracker.Decision.SUPERSEDED);
        assertThat(tracker.isSuperseded(1L, 4)).isTrue();
        assertThat(tracker.isSuperseded(1L, 7)).isFalse();
    }

    @Test
    void retryOfTheLatestSequenceIsAccepted() {
        SyncTask first = feed(2L, 3);
        tracker.admit(first, T0);
        tracker.markFailed(2L, 3, 1, "boom", T0);

        KeyTracker.Admission admission = tracker.admit(first.retry(), T0);

        assertThat(admission.decision()).isEqualTo(KeyTracker.Decision.ACCEPTED);
        assertThat(admission.previousState()).isEqualTo(SyncState.FAILED);
    }

    @Test
    void staleSettleDoesNotOverrideANewerPendingMutation() {
        tracker.admit(feed(3L, 1), T0);
        tracker.admit(feed(3L, 2), T0);

        tracker.markSettled(3L, 1, SyncState.CONSISTENT, T0);

        KeyStatus status = tracker.status(3L);
        assertThat(status.state()).isEqualTo(SyncState.PENDING);
        assertThat(status.appliedSequence()).isEqualTo(1);
        assertThat(status.latestSequence()).isEqualTo(2);
    }

    @Test
    void failureKeepsTheErrorUntilTheKeySettles() {
        tracker.admit(feed(4L, 1), T0);
        tracker.markFailed(4L, 1, 2, "store unavailable", T0);

        assertThat(tracker.status(4L).lastError()).isEqualTo("store unavailable");
        assertThat(tracker.status(4L).attempts()).isEqualTo(2);

        tracker.markSettled(4L, 1, SyncState.CONSISTENT, T0);

        assertThat(tracker.status(4L).lastError()).isNull();
        assertThat(tracker.status(4L).attempts()).isZero();
    }

    @Test
    void stateCountsCoverEveryState() {
        tracker.admit(feed(1L, 1), T0);
        tracker.admit(feed(2L, 2), T0);
        tracker.markSettled(2L, 2, SyncState.CONSISTENT, T0);

        Map<SyncState, Long> counts = tracker.stateCounts();

        assertThat(counts).containsOnlyKeys(SyncState.values());
        assertThat(counts.get(SyncState.PENDING)).isEqualTo(1L);
        assertThat(counts.get(SyncState.CONSISTENT)).isEqualTo(1L);
        assertThat(counts.get(SyncState.FAILED)).isZero();
    }

    @Test
    void evictionDropsOnlyIdleSettledKeys() {
        tracker.admit(feed(1L, 1), T0);
        tracker.markSettled(1L, 1, SyncState.CONSISTENT, T0);
        tracker.admit(feed(2L, 2), T0);
        tracker.markFailed(2L, 2, 1, "boom", T0);
        tracker.admit(feed(3L, 3), T0.plusSeconds(600));
        tracker.markSettled(3L, 3, SyncState.ABSENT, T0.plusSeconds(600));

        int evicted = tracker.evictSettledBefore(T0.plusSeconds(60));

        assertThat(evicted).isEqualTo(1);
        assertThat(tracker.isTracked(1L)).isFalse();
        assertThat(tracker.isTracked(2L)).isTrue();
        assertThat(tracker.isTracked(3L)).isTrue();
    }

    private static SyncTask feed(Long key, long sequence) {
        return SyncTask.of(event(key, sequence), SyncTask.Origin.FEED);
    }

    private static MutationEvent event(Long key, long sequence) {
        BaseRow row = new BaseRow(key, Map.of("FreeGHz", 2.4), sequence, T0);
        return MutationEvent.insert(row, T0);
    }
}
