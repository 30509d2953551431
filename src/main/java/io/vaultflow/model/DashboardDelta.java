package io.vaultflow.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * One field update submitted by a non-writer role; merged by the dashboard writer, last-applied-wins.
 */
public record DashboardDelta(
        String deltaId,
        String role,
        Instant submittedAt,
        String field,
        String value
) {
    /** Merge order: submission time, then id, so every writer replays deltas identically. */
    public static final Comparator<DashboardDelta> MERGE_ORDER = Comparator
            .comparing(DashboardDelta::submittedAt)
            .thenComparing(DashboardDelta::deltaId);
}
