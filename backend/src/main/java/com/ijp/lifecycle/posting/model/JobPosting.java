package com.ijp.lifecycle.posting.model;

import java.time.Instant;

/**
 * A job posting as stored. {@code archivedAt} is non-null exactly when {@code status} is
 * {@link LifecycleStatus#ARCHIVED}; {@code visible} is the owner's display toggle and is
 * independent of the lifecycle status.
 */
public record JobPosting(
    long id,
    long ownerId,
    String title,
    boolean visible,
    LifecycleStatus status,
    Instant deadline,
    Instant archivedAt,
    Instant deletedAt,
    Instant createdAt,
    Instant updatedAt,
    long version
) {

    public JobPosting withLifecycle(
        LifecycleStatus nextStatus,
        Instant nextDeadline,
        Instant nextArchivedAt,
        Instant nextDeletedAt,
        Instant changedAt
    ) {
        return new JobPosting(
            id,
            ownerId,
            title,
            visible,
            nextStatus,
            nextDeadline,
            nextArchivedAt,
            nextDeletedAt,
            createdAt,
            changedAt,
            version + 1
        );
    }
}
