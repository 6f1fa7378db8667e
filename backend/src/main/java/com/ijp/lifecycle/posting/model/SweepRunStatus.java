package com.ijp.lifecycle.posting.model;

public enum SweepRunStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED,
    ABORTED,
    SKIPPED
}
