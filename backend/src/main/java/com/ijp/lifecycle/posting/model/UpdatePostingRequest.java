package com.ijp.lifecycle.posting.model;

import java.time.Instant;

/**
 * Partial edit of a posting. A null field leaves the stored value as is; use
 * {@code clearDeadline} to remove the deadline. Deadline changes need a live posting, visibility
 * can also be toggled on an archived one.
 */
public record UpdatePostingRequest(
    Instant deadline,
    Boolean clearDeadline,
    Boolean visible
) {
}
