package com.recaprio.projection.store;

import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.KeyRange;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy key-ordered iteration over a projection store, fetched one page at a time.
 * Rows written or removed while the scan runs may or may not be seen.
 *
 * <p>{@link #cursor()} is the last key handed out; a scan interrupted at any point
 * continues with {@code store.scan(range.resumeAfter(cursor))}.
 */
public class ProjectionScan implements Iterator<DerivedRow> {

    private final ProjectionStore store;
    private final int pageSize;
    private KeyRange remaining;
    private Iterator<DerivedRow> page = Collections.emptyIterator();
    private boolean exhausted;
    private Long cursor;

    ProjectionScan(ProjectionStore store, KeyRange range, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, was " + pageSize);
        }
        this.store = store;
        this.pageSize = pageSize;
        this.remaining = range;
        this.exhausted = range.isEmpty();
    }

    @Override
    public boolean hasNext() {
        while (!page.hasNext() && !exhausted) {
            fetch();
        }
        return page.hasNext();
    }

    @Override
    public DerivedRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        DerivedRow row = page.next();
        cursor = row.key();
        return row;
    }

    public Long cursor() {
        return cursor;
    }

    public Stream<DerivedRow> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private void fetch() {
        List<DerivedRow> rows = store.page(remaining, pageSize);
        if (rows.size() < pageSize) {
            exhausted = true;
        }
        if (!rows.isEmpty()) {
            remaining = remaining.resumeAfter(rows.get(rows.size() - 1).key());
            if (remaining.isEmpty()) {
                exhausted = true;
            }
        }
        page = rows.iterator();
    }
}
