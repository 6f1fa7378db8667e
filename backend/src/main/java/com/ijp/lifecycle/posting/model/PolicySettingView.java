package com.ijp.lifecycle.posting.model;

import java.time.Instant;

public record PolicySettingView(
    String key,
    Object value,
    String description,
    boolean isDefault,
    Instant updatedAt,
    Long updatedBy
) {
}
