package com.ijp.lifecycle.posting.model;

public record SweeperStatusResponse(
    boolean running,
    boolean schedulerEnabled,
    long intervalMs,
    String instanceId,
    SweepSummary lastSummary,
    SweepRunRecord lastRecordedRun
) {
}
