package com.ijp.lifecycle.posting.model;

import java.time.Instant;
import java.util.List;

public record DeletionPreview(
    int days,
    Instant cutoff,
    long affectedCount,
    List<DeletionPreviewEntry> affectedSample,
    boolean warning,
    String warningMessage
) {
}
