package com.ijp.lifecycle.posting.service;

import com.ijp.lifecycle.config.LifecycleProperties;
import com.ijp.lifecycle.posting.model.PolicySettingKey;
import com.ijp.lifecycle.posting.model.PolicySettingView;
import com.ijp.lifecycle.posting.model.PolicySettings;
import com.ijp.lifecycle.posting.persistence.PolicySettingsRepository;
import com.ijp.lifecycle.posting.persistence.PolicySettingsRepository.StoredSetting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Global retention and deadline policy. Stored rows override the configured defaults; writes never
 * touch existing postings, so a new value only affects validations and sweeps that run afterwards.
 */
@Service
public class PolicyStore {
    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final PolicySettingsRepository repository;
    private final LifecycleProperties properties;
    private final Clock clock;

    public PolicyStore(PolicySettingsRepository repository, LifecycleProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public PolicySettings get() {
        return toSettings(repository.findAll());
    }

    private PolicySettings toSettings(Map<String, StoredSetting> stored) {
        LifecycleProperties.Policy defaults = properties.getPolicy();
        return new PolicySettings(
            readDays(stored, PolicySettingKey.MAX_JOB_DEADLINE_DAYS, defaults.getDefaultMaxJobDeadlineDays()),
            readDays(stored, PolicySettingKey.ARCHIVE_DELETION_DAYS, defaults.getDefaultArchiveDeletionDays()),
            readFlag(stored, PolicySettingKey.AUTO_ARCHIVE_EXPIRED_JOBS, defaults.isDefaultAutoArchiveExpired())
        );
    }

    @Transactional
    public PolicySettings set(PolicySettings settings, Long updatedBy) {
        if (settings == null) {
            throw new LifecycleValidationException("Policy settings are required");
        }
        validateDays(PolicySettingKey.MAX_JOB_DEADLINE_DAYS, settings.maxJobDeadlineDays());
        validateDays(PolicySettingKey.ARCHIVE_DELETION_DAYS, settings.archiveDeletionDays());
        Instant now = clock.instant();
        write(PolicySettingKey.MAX_JOB_DEADLINE_DAYS, Integer.toString(settings.maxJobDeadlineDays()), now, updatedBy);
        write(PolicySettingKey.ARCHIVE_DELETION_DAYS, Integer.toString(settings.archiveDeletionDays()), now, updatedBy);
        write(PolicySettingKey.AUTO_ARCHIVE_EXPIRED_JOBS, Boolean.toString(settings.autoArchiveExpired()), now, updatedBy);
        log.info(
            "Policy replaced by {}: maxJobDeadlineDays={}, archiveDeletionDays={}, autoArchiveExpired={}",
            updatedBy,
            settings.maxJobDeadlineDays(),
            settings.archiveDeletionDays(),
            settings.autoArchiveExpired()
        );
        return get();
    }

    @Transactional
    public PolicySettings set(String key, String rawValue, Long updatedBy) {
        PolicySettingKey settingKey = PolicySettingKey.fromKey(key)
            .orElseThrow(() -> new LifecycleValidationException("Unknown setting: " + key));
        String normalized = switch (settingKey.valueType()) {
            case INTEGER -> Integer.toString(validateDays(settingKey, parseInteger(settingKey, rawValue)));
            case BOOLEAN -> Boolean.toString(parseBoolean(settingKey, rawValue));
        };
        write(settingKey, normalized, clock.instant(), updatedBy);
        log.info("Policy setting {} set to {} by {}", settingKey.key(), normalized, updatedBy);
        return get();
    }

    public List<PolicySettingView> describe() {
        Map<String, StoredSetting> stored = repository.findAll();
        PolicySettings current = toSettings(stored);
        List<PolicySettingView> views = new ArrayList<>();
        for (PolicySettingKey key : PolicySettingKey.values()) {
            StoredSetting row = stored.get(key.key());
            views.add(new PolicySettingView(
                key.key(),
                valueOf(key, current),
                key.description(),
                row == null,
                row == null ? null : row.updatedAt(),
                row == null ? null : row.updatedBy()
            ));
        }
        return views;
    }

    public int validateDays(PolicySettingKey key, int days) {
        LifecycleProperties.Policy bounds = properties.getPolicy();
        if (!bounds.isWithinBounds(days)) {
            throw new LifecycleValidationException(String.format(
                Locale.ROOT,
                "%s must be between %d and %d days, got %d",
                key.key(),
                bounds.getMinDays(),
                bounds.getMaxDays(),
                days
            ));
        }
        return days;
    }

    private void write(PolicySettingKey key, String value, Instant now, Long updatedBy) {
        repository.upsert(key.key(), value, key.valueType().name(), key.description(), now, updatedBy);
    }

    private int readDays(Map<String, StoredSetting> stored, PolicySettingKey key, int fallback) {
        StoredSetting row = stored.get(key.key());
        if (row == null || row.value() == null) {
            return fallback;
        }
        int days;
        try {
            days = Integer.parseInt(row.value().trim());
        } catch (NumberFormatException e) {
            log.warn("Stored policy setting {} has non-integer value '{}'; using {}", key.key(), row.value(), fallback);
            return fallback;
        }
        if (!properties.getPolicy().isWithinBounds(days)) {
            log.warn("Stored policy setting {} value {} is out of bounds; using {}", key.key(), days, fallback);
            return fallback;
        }
        return days;
    }

    private boolean readFlag(Map<String, StoredSetting> stored, PolicySettingKey key, boolean fallback) {
        StoredSetting row = stored.get(key.key());
        if (row == null || row.value() == null) {
            return fallback;
        }
        String value = row.value().trim().toLowerCase(Locale.ROOT);
        return value.equals("true") || value.equals("1") || value.equals("yes");
    }

    private int parseInteger(PolicySettingKey key, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new LifecycleValidationException(key.key() + " requires an integer value");
        }
        try {
            return Integer.parseInt(rawValue.trim());
        } catch (NumberFormatException e) {
            throw new LifecycleValidationException(key.key() + " requires an integer value, got '" + rawValue + "'");
        }
    }

    private boolean parseBoolean(PolicySettingKey key, String rawValue) {
        String value = rawValue == null ? "" : rawValue.trim().toLowerCase(Locale.ROOT);
        if (value.equals("true")) {
            return true;
        }
        if (value.equals("false")) {
            return false;
        }
        throw new LifecycleValidationException(key.key() + " requires true or false, got '" + rawValue + "'");
    }

    private Object valueOf(PolicySettingKey key, PolicySettings settings) {
        return switch (key) {
            case MAX_JOB_DEADLINE_DAYS -> settings.maxJobDeadlineDays();
            case ARCHIVE_DELETION_DAYS -> settings.archiveDeletionDays();
            case AUTO_ARCHIVE_EXPIRED_JOBS -> settings.autoArchiveExpired();
        };
    }
}
