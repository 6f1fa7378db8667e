package com.ijp.lifecycle.posting.model;

import java.time.Instant;

public record SweepRunRecord(
    long id,
    Instant startedAt,
    Instant finishedAt,
    SweepRunStatus status,
    String lockOwner,
    int archivedCount,
    int deletedCount,
    int skippedCount,
    int errorCount,
    String policyJson
) {
}
