package com.recaprio.projection.outbox;

import com.recaprio.projection.domain.MutationOutboxEntry;
import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.MutationType;
import com.recaprio.projection.repository.MutationOutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Durable log of base mutations. Appending an entry hands out the mutation's commit
 * sequence; the synchronizer reports back how each entry ended.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MutationOutboxService {

    private final MutationOutboxRepository repository;
    private final Clock clock;

    /**
     * Records a mutation in the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public MutationOutboxEntry append(MutationType type, Long key, BaseRow before, Map<String, Object> after,
                                      Instant committedAt) {
        MutationOutboxEntry entry = repository.save(new MutationOutboxEntry(type, key, before, after, committedAt));
        log.debug("[OUTBOX] Appended {} for key {} as sequence {}", type, key, entry.getId());
        return entry;
    }

    @Transactional
    public void markApplied(long sequence) {
        update(sequence, MutationOutboxEntry.Status.APPLIED, null);
    }

    @Transactional
    public void markSuperseded(long sequence) {
        update(sequence, MutationOutboxEntry.Status.SUPERSEDED, null);
    }

    @Transactional
    public void markFailed(long sequence, String error) {
        update(sequence, MutationOutboxEntry.Status.FAILED, error);
    }

    /**
     * Notes a failed attempt that will be retried. Keeps the entry PENDING and pushes
     * back the point at which the relay considers it lost.
     */
    @Transactional
    public void recordAttempt(long sequence, String error) {
        repository.findById(sequence).ifPresent(entry -> {
            if (entry.getStatus() != MutationOutboxEntry.Status.PENDING) {
                return;
            }
            entry.setAttempts(entry.getAttempts() + 1);
            entry.setLastError(truncate(error));
            entry.setLastAttempt(clock.instant());
        });
    }

    /**
     * PENDING entries untouched for longer than {@code grace}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<MutationOutboxEntry> findStalePending(Duration grace, int limit) {
        Instant before = clock.instant().minus(grace);
        return repository.findByStatusAndLastAttemptBeforeOrderByIdAsc(
                MutationOutboxEntry.Status.PENDING, before, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public Map<MutationOutboxEntry.Status, Integer> countsByStatus() {
        Map<MutationOutboxEntry.Status, Integer> counts = new EnumMap<>(MutationOutboxEntry.Status.class);
        for (MutationOutboxEntry.Status status : MutationOutboxEntry.Status.values()) {
            counts.put(status, repository.countByStatus(status));
        }
        return counts;
    }

    /**
     * Deletes finished entries (applied or superseded) last touched before {@code cutoff}.
     * Failed entries are kept for inspection.
     */
    @Transactional
    public int purgeFinishedBefore(Instant cutoff) {
        return repository.purgeByStatusBefore(
                List.of(MutationOutboxEntry.Status.APPLIED, MutationOutboxEntry.Status.SUPERSEDED), cutoff);
    }

    private void update(long sequence, MutationOutboxEntry.Status status, String error) {
        repository.findById(sequence).ifPresentOrElse(entry -> {
            entry.setStatus(status);
            entry.setLastAttempt(clock.instant());
            if (error != null) {
                entry.setLastError(truncate(error));
            }
        }, () -> log.debug("[OUTBOX] No entry for sequence {}, status {} not recorded", sequence, status));
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 1024) {
            return error;
        }
        return error.substring(0, 1024);
    }
}
