package com.ijp.lifecycle.posting.model;

public record PolicySettings(
    int maxJobDeadlineDays,
    int archiveDeletionDays,
    boolean autoArchiveExpired
) {
}
