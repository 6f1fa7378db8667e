package com.ijp.lifecycle.posting.model;

import java.time.Instant;

public record CreatePostingRequest(
    String title,
    Instant deadline,
    Boolean visible
) {
}
