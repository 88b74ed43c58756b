package com.recaprio.projection.store;

import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.support.InMemoryProjectionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectionScanTest {

    private InMemoryProjectionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryProjectionStore();
        for (long key = 1; key <= 10; key++) {
            store.upsert(key, DerivedAttributes.of("FreeCores", (double) key), key);
        }
    }

    @Test
    void walksTheRangeInKeyOrderAcrossPages() {
        List<Long> keys = store.scan(KeyRange.of(3L, 9L), 2).stream().map(DerivedRow::key).toList();

        assertThat(keys).containsExactly(3L, 4L, 5L, 6L, 7L, 8L);
    }

    @Test
    void skipsRemovedRows() {
        store.remove(4L, 20);

        List<Long> keys = store.scan(KeyRange.of(3L, 6L), 2).stream().map(DerivedRow::key).toList();

        assertThat(keys).containsExactly(3L, 5L);
    }

    @Test
    void restartsFromCursor() {
        KeyRange range = KeyRange.all();
        ProjectionScan first = store.scan(range, 3);
        List<Long> seen = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            seen.add(first.next().key());
        }

        ProjectionScan resumed = store.scan(range.resumeAfter(first.cursor()), 3);
        resumed.forEachRemaining(row -> seen.add(row.key()));

        assertThat(first.cursor()).isEqualTo(4L);
        assertThat(seen).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L);
    }

    @Test
    void emptyRangeYieldsNothing() {
        ProjectionScan scan = store.scan(KeyRange.of(20L, 30L));

        assertThat(scan.hasNext()).isFalse();
        assertThat(scan.cursor()).isNull();
        assertThatThrownBy(scan::next).isInstanceOf(NoSuchElementException.class);
    }
}
