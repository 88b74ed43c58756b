package com.recaprio.projection.model.dto;

import java.util.List;

/**
 * One page of a projection scan. Pass {@code nextCursor} back as {@code cursor}
 * to continue; it is null once the range is exhausted.
 */
public record ProjectionPage(List<ProjectionView> rows, Long nextCursor) { }
