package com.recaprio.projection.controller;

import com.recaprio.projection.config.SyncProperties;
import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.model.dto.ProjectionPage;
import com.recaprio.projection.model.dto.ProjectionView;
import com.recaprio.projection.store.ProjectionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read API over the projection store.
 */
@RestController
@RequestMapping("/api/projections")
@RequiredArgsConstructor
public class ProjectionController {

    private static final int MAX_LIMIT = 5000;

    private final ProjectionStore store;
    private final SyncProperties properties;

    @GetMapping("/{key}")
    public ResponseEntity<ProjectionView> get(@PathVariable Long key) {
        return store.get(key)
                .map(ProjectionView::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * One page of {@code [from, to)} after {@code cursor}. Pass the returned
     * {@code nextCursor} to continue.
     */
    @GetMapping
    public ProjectionPage scan(@RequestParam(required = false) Long from,
                               @RequestParam(required = false) Long to,
                               @RequestParam(required = false) Long cursor,
                               @RequestParam(required = false) Integer limit) {
        int pageSize = limit == null ? properties.getScanPageSize() : limit;
        if (pageSize < 1 || pageSize > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        KeyRange range = KeyRange.of(from, to).resumeAfter(cursor);
        List<DerivedRow> rows = store.page(range, pageSize);
        Long nextCursor = rows.size() < pageSize ? null : rows.get(rows.size() - 1).key();
        return new ProjectionPage(rows.stream().map(ProjectionView::from).toList(), nextCursor);
    }
}
