package com.ijp.lifecycle.posting.model;

public record TransitionResult(
    JobPosting posting,
    LifecycleStatus previousStatus,
    int erasedDocuments
) {
}
