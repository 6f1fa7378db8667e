package com.ijp.lifecycle.posting.model;

import java.util.Locale;

public enum LifecycleStatus {
    LIVE,
    ARCHIVED,
    DELETED;

    public static LifecycleStatus fromDatabase(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing lifecycle status");
        }
        return LifecycleStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
