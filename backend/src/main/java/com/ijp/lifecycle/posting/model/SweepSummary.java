package com.ijp.lifecycle.posting.model;

import java.time.Instant;

public record SweepSummary(
    Long runId,
    Instant startedAt,
    Instant finishedAt,
    SweepRunStatus status,
    String skippedReason,
    PolicySettings policy,
    int archivedCount,
    int deletedCount,
    int skippedCount,
    int errorCount
) {

    public static SweepSummary skipped(Instant at, String reason) {
        return new SweepSummary(null, at, at, SweepRunStatus.SKIPPED, reason, null, 0, 0, 0, 0);
    }

    public boolean cancelled() {
        return status == SweepRunStatus.CANCELLED;
    }
}
