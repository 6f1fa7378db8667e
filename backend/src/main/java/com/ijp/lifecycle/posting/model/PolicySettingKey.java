package com.ijp.lifecycle.posting.model;

import java.util.Locale;
import java.util.Optional;

public enum PolicySettingKey {
    MAX_JOB_DEADLINE_DAYS(
        "max_job_deadline_days",
        ValueType.INTEGER,
        "Maximum number of days a job deadline may lie in the future"
    ),
    ARCHIVE_DELETION_DAYS(
        "archive_deletion_days",
        ValueType.INTEGER,
        "Days an archived posting is retained before it is permanently deleted"
    ),
    AUTO_ARCHIVE_EXPIRED_JOBS(
        "auto_archive_expired_jobs",
        ValueType.BOOLEAN,
        "Archive live postings automatically once their deadline has passed"
    );

    public enum ValueType {
        INTEGER,
        BOOLEAN
    }

    private final String key;
    private final ValueType valueType;
    private final String description;

    PolicySettingKey(String key, ValueType valueType, String description) {
        this.key = key;
        this.valueType = valueType;
        this.description = description;
    }

    public String key() {
        return key;
    }

    public ValueType valueType() {
        return valueType;
    }

    public String description() {
        return description;
    }

    public static Optional<PolicySettingKey> fromKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (PolicySettingKey candidate : values()) {
            if (candidate.key.equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
