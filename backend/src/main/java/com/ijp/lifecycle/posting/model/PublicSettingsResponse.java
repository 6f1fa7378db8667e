package com.ijp.lifecycle.posting.model;

public record PublicSettingsResponse(
    int maxJobDeadlineDays,
    int archiveDeletionDays
) {
}
