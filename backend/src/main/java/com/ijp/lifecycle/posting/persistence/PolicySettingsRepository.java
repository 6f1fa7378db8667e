package com.ijp.lifecycle.posting.persistence;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Repository
public class PolicySettingsRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public PolicySettingsRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Map<String, StoredSetting> findAll() {
        Map<String, StoredSetting> settings = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT setting_key,
                       setting_value,
                       value_type,
                       updated_at,
                       updated_by
                FROM policy_settings
                ORDER BY setting_key
                """,
            new MapSqlParameterSource(),
            rs -> {
                Timestamp updatedAt = rs.getTimestamp("updated_at");
                long updatedById = rs.getLong("updated_by");
                Long updatedBy = rs.wasNull() ? null : updatedById;
                StoredSetting setting = new StoredSetting(
                    rs.getString("setting_key"),
                    rs.getString("setting_value"),
                    rs.getString("value_type"),
                    updatedAt == null ? null : updatedAt.toInstant(),
                    updatedBy
                );
                settings.put(setting.key(), setting);
            }
        );
        return settings;
    }

    public void upsert(String key, String value, String valueType, String description, Instant updatedAt, Long updatedBy) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("value", value)
            .addValue("valueType", valueType)
            .addValue("description", description)
            .addValue("updatedAt", Timestamp.from(updatedAt), Types.TIMESTAMP)
            .addValue("updatedBy", updatedBy, Types.BIGINT);
        int updated = jdbc.update(
            """
                UPDATE policy_settings
                SET setting_value = :value,
                    value_type = :valueType,
                    updated_at = :updatedAt,
                    updated_by = :updatedBy
                WHERE setting_key = :key
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        jdbc.update(
            """
                INSERT INTO policy_settings (
                    setting_key,
                    setting_value,
                    value_type,
                    description,
                    updated_at,
                    updated_by
                )
                VALUES (
                    :key,
                    :value,
                    :valueType,
                    :description,
                    :updatedAt,
                    :updatedBy
                )
                """,
            params
        );
    }

    public record StoredSetting(
        String key,
        String value,
        String valueType,
        Instant updatedAt,
        Long updatedBy
    ) {
    }
}
