package com.ijp.lifecycle.posting.model;

import java.time.Instant;

public record PermanentDeletionResponse(
    long postingId,
    LifecycleStatus status,
    Instant deletedAt,
    int erasedDocuments
) {
}
