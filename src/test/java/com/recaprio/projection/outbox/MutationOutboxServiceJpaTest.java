package com.recaprio.projection.outbox;

import com.recaprio.projection.domain.MutationOutboxEntry;
import com.recaprio.projection.model.MutationType;
import com.recaprio.projection.repository.MutationOutboxRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("Mutation outbox persistence Tests")
class MutationOutboxServiceJpaTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MutationOutboxRepository repository;

    private MutationOutboxService outbox;

    @BeforeEach
    void setUp() {
        outbox = new MutationOutboxService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void stalePendingEntriesComeOldestFirstUpToTheLimit() {
        List<Long> sequences = List.of(
                append(1L, NOW.minusSeconds(600)),
                append(2L, NOW.minusSeconds(500)),
                append(3L, NOW.minusSeconds(400)),
                append(4L, NOW.minusSeconds(300)));

        List<MutationOutboxEntry> stale = outbox.findStalePending(Duration.ofMinutes(1), 2);

        assertThat(stale).extracting(MutationOutboxEntry::getId).containsExactly(sequences.get(0), sequences.get(1));
    }

    @Test
    void recentAndSettledEntriesAreNotStale() {
        long applied = append(5L, NOW.minusSeconds(600));
        append(6L, NOW.minusSeconds(10));
        long pending = append(7L, NOW.minusSeconds(600));
        outbox.markApplied(applied);

        List<MutationOutboxEntry> stale = outbox.findStalePending(Duration.ofMinutes(1), 10);

        assertThat(stale).extracting(MutationOutboxEntry::getId).containsExactly(pending);
    }

    private long append(Long key, Instant committedAt) {
        return outbox.append(MutationType.INSERT, key, null, Map.of("FreeGHz", 2.4), committedAt).getId();
    }
}
