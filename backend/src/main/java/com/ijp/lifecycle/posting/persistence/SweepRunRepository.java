package com.ijp.lifecycle.posting.persistence;

import com.ijp.lifecycle.posting.model.SweepRunRecord;
import com.ijp.lifecycle.posting.model.SweepRunStatus;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class SweepRunRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public SweepRunRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertRun(Instant startedAt, String lockOwner, String policyJson) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", Timestamp.from(startedAt))
            .addValue("status", SweepRunStatus.RUNNING.name())
            .addValue("lockOwner", lockOwner)
            .addValue("policyJson", policyJson);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO sweep_runs (
                    started_at,
                    status,
                    lock_owner,
                    policy_json
                )
                VALUES (
                    :startedAt,
                    :status,
                    :lockOwner,
                    :policyJson
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public void completeRun(
        long runId,
        Instant finishedAt,
        SweepRunStatus status,
        int archivedCount,
        int deletedCount,
        int skippedCount,
        int errorCount
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", Timestamp.from(finishedAt))
            .addValue("status", status.name())
            .addValue("archivedCount", Math.max(0, archivedCount))
            .addValue("deletedCount", Math.max(0, deletedCount))
            .addValue("skippedCount", Math.max(0, skippedCount))
            .addValue("errorCount", Math.max(0, errorCount));
        jdbc.update(
            """
                UPDATE sweep_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    archived_count = :archivedCount,
                    deleted_count = :deletedCount,
                    skipped_count = :skippedCount,
                    error_count = :errorCount
                WHERE id = :runId
                """,
            params
        );
    }

    /**
     * Closes runs left RUNNING by a process that died mid-sweep. Only runs started before
     * {@code cutoff} are touched.
     */
    public int abortStaleRuns(Instant cutoff, Instant finishedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", Timestamp.from(cutoff))
            .addValue("finishedAt", Timestamp.from(finishedAt))
            .addValue("running", SweepRunStatus.RUNNING.name())
            .addValue("aborted", SweepRunStatus.ABORTED.name());
        return jdbc.update(
            """
                UPDATE sweep_runs
                SET status = :aborted,
                    finished_at = :finishedAt
                WHERE status = :running
                  AND started_at < :cutoff
                """,
            params
        );
    }

    public SweepRunRecord findLatest() {
        List<SweepRunRecord> rows = jdbc.query(
            """
                SELECT id,
                       started_at,
                       finished_at,
                       status,
                       lock_owner,
                       archived_count,
                       deleted_count,
                       skipped_count,
                       error_count,
                       policy_json
                FROM sweep_runs
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new SweepRunRecord(
                rs.getLong("id"),
                rs.getTimestamp("started_at").toInstant(),
                rs.getTimestamp("finished_at") == null
                    ? null
                    : rs.getTimestamp("finished_at").toInstant(),
                SweepRunStatus.valueOf(rs.getString("status")),
                rs.getString("lock_owner"),
                rs.getInt("archived_count"),
                rs.getInt("deleted_count"),
                rs.getInt("skipped_count"),
                rs.getInt("error_count"),
                rs.getString("policy_json")
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }
}
