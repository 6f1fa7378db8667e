package com.ijp.lifecycle.posting.model;

import java.time.Instant;

public record DeletionPreviewEntry(
    long id,
    String title,
    Instant archivedAt,
    long daysArchived
) {
}
