package com.ijp.lifecycle.posting.persistence;

import com.ijp.lifecycle.posting.model.JobPosting;
import com.ijp.lifecycle.posting.model.LifecycleStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class PostingJdbcRepository {
    private static final String POSTING_COLUMNS = """
        id,
        owner_id,
        title,
        visible,
        status,
        deadline,
        archived_at,
        deleted_at,
        created_at,
        updated_at,
        version
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public PostingJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long insertPosting(long ownerId, String title, boolean visible, Instant deadline, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("title", title)
            .addValue("visible", visible)
            .addValue("status", LifecycleStatus.LIVE.name())
            .addValue("deadline", toTimestamp(deadline), Types.TIMESTAMP)
            .addValue("createdAt", toTimestamp(createdAt), Types.TIMESTAMP);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_postings (
                    owner_id,
                    title,
                    visible,
                    status,
                    deadline,
                    archived_at,
                    deleted_at,
                    created_at,
                    updated_at,
                    version
                )
                VALUES (
                    :ownerId,
                    :title,
                    :visible,
                    :status,
                    :deadline,
                    NULL,
                    NULL,
                    :createdAt,
                    :createdAt,
                    0
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public Optional<JobPosting> findById(long postingId) {
        List<JobPosting> rows = jdbc.query(
            "SELECT " + POSTING_COLUMNS + " FROM job_postings WHERE id = :id",
            new MapSqlParameterSource().addValue("id", postingId),
            postingRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<JobPosting> findByOwnerExcludingStatus(long ownerId, LifecycleStatus excluded) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("excluded", excluded.name());
        return jdbc.query(
            "SELECT " + POSTING_COLUMNS + """
                FROM job_postings
                WHERE owner_id = :ownerId
                  AND status <> :excluded
                ORDER BY created_at DESC, id DESC
                """,
            params,
            postingRowMapper()
        );
    }

    public List<JobPosting> findArchivedByOwner(long ownerId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("status", LifecycleStatus.ARCHIVED.name());
        return jdbc.query(
            "SELECT " + POSTING_COLUMNS + """
                FROM job_postings
                WHERE owner_id = :ownerId
                  AND status = :status
                ORDER BY archived_at DESC, id DESC
                """,
            params,
            postingRowMapper()
        );
    }

    /**
     * Live postings whose deadline is at or before {@code now}, in id order, starting after
     * {@code afterId}.
     */
    public List<JobPosting> findExpiredLive(Instant now, long afterId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", LifecycleStatus.LIVE.name())
            .addValue("now", toTimestamp(now), Types.TIMESTAMP)
            .addValue("afterId", Math.max(0L, afterId))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            "SELECT " + POSTING_COLUMNS + """
                FROM job_postings
                WHERE status = :status
                  AND deadline IS NOT NULL
                  AND deadline <= :now
                  AND id > :afterId
                ORDER BY id ASC
                LIMIT :limit
                """,
            params,
            postingRowMapper()
        );
    }

    /**
     * Archived postings whose archival happened at or before {@code cutoff}, in id order, starting
     * after {@code afterId}.
     */
    public List<JobPosting> findArchivedAtOrBefore(Instant cutoff, long afterId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", LifecycleStatus.ARCHIVED.name())
            .addValue("cutoff", toTimestamp(cutoff), Types.TIMESTAMP)
            .addValue("afterId", Math.max(0L, afterId))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            "SELECT " + POSTING_COLUMNS + """
                FROM job_postings
                WHERE status = :status
                  AND archived_at <= :cutoff
                  AND id > :afterId
                ORDER BY id ASC
                LIMIT :limit
                """,
            params,
            postingRowMapper()
        );
    }

    public long countArchivedAtOrBefore(Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", LifecycleStatus.ARCHIVED.name())
            .addValue("cutoff", toTimestamp(cutoff), Types.TIMESTAMP);
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM job_postings
                WHERE status = :status
                  AND archived_at <= :cutoff
                """,
            params,
            Long.class
        );
        return count == null ? 0L : count;
    }

    public List<JobPosting> findOldestArchivedAtOrBefore(Instant cutoff, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", LifecycleStatus.ARCHIVED.name())
            .addValue("cutoff", toTimestamp(cutoff), Types.TIMESTAMP)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            "SELECT " + POSTING_COLUMNS + """
                FROM job_postings
                WHERE status = :status
                  AND archived_at <= :cutoff
                ORDER BY archived_at ASC, id ASC
                LIMIT :limit
                """,
            params,
            postingRowMapper()
        );
    }

    /**
     * Writes the lifecycle columns of {@code next} only if the stored row still has
     * {@code expectedStatus} and {@code expectedVersion}. Returns the number of rows changed (0 or 1).
     */
    public int compareAndSetLifecycle(JobPosting next, LifecycleStatus expectedStatus, long expectedVersion) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", next.id())
            .addValue("status", next.status().name())
            .addValue("deadline", toTimestamp(next.deadline()), Types.TIMESTAMP)
            .addValue("archivedAt", toTimestamp(next.archivedAt()), Types.TIMESTAMP)
            .addValue("deletedAt", toTimestamp(next.deletedAt()), Types.TIMESTAMP)
            .addValue("updatedAt", toTimestamp(next.updatedAt()), Types.TIMESTAMP)
            .addValue("expectedStatus", expectedStatus.name())
            .addValue("expectedVersion", expectedVersion);
        return jdbc.update(
            """
                UPDATE job_postings
                SET status = :status,
                    deadline = :deadline,
                    archived_at = :archivedAt,
                    deleted_at = :deletedAt,
                    updated_at = :updatedAt,
                    version = version + 1
                WHERE id = :id
                  AND status = :expectedStatus
                  AND version = :expectedVersion
                """,
            params
        );
    }

    /**
     * Owner edits of a live posting, guarded by version like lifecycle transitions.
     */
    public int updateLiveFields(
        long postingId,
        long expectedVersion,
        Instant deadline,
        boolean visible,
        Instant updatedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", postingId)
            .addValue("expectedVersion", expectedVersion)
            .addValue("status", LifecycleStatus.LIVE.name())
            .addValue("deadline", toTimestamp(deadline), Types.TIMESTAMP)
            .addValue("visible", visible)
            .addValue("updatedAt", toTimestamp(updatedAt), Types.TIMESTAMP);
        return jdbc.update(
            """
                UPDATE job_postings
                SET deadline = :deadline,
                    visible = :visible,
                    updated_at = :updatedAt,
                    version = version + 1
                WHERE id = :id
                  AND status = :status
                  AND version = :expectedVersion
                """,
            params
        );
    }

    /**
     * Visibility is independent of lifecycle status, so any posting that is not deleted may toggle it.
     */
    public int updateVisibility(long postingId, long expectedVersion, boolean visible, Instant updatedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", postingId)
            .addValue("expectedVersion", expectedVersion)
            .addValue("deleted", LifecycleStatus.DELETED.name())
            .addValue("visible", visible)
            .addValue("updatedAt", toTimestamp(updatedAt), Types.TIMESTAMP);
        return jdbc.update(
            """
                UPDATE job_postings
                SET visible = :visible,
                    updated_at = :updatedAt,
                    version = version + 1
                WHERE id = :id
                  AND status <> :deleted
                  AND version = :expectedVersion
                """,
            params
        );
    }

    public int deleteDocumentsForPosting(long postingId) {
        return jdbc.update(
            "DELETE FROM posting_documents WHERE posting_id = :postingId",
            new MapSqlParameterSource().addValue("postingId", postingId)
        );
    }

    private RowMapper<JobPosting> postingRowMapper() {
        return (rs, rowNum) -> new JobPosting(
            rs.getLong("id"),
            rs.getLong("owner_id"),
            rs.getString("title"),
            rs.getBoolean("visible"),
            LifecycleStatus.fromDatabase(rs.getString("status")),
            toInstant(rs.getTimestamp("deadline")),
            toInstant(rs.getTimestamp("archived_at")),
            toInstant(rs.getTimestamp("deleted_at")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            rs.getLong("version")
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
