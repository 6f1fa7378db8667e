package com.ijp.lifecycle.posting.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * Database lease that keeps expiry sweeps on different instances from overlapping. A lease that
 * is not released expires at {@code locked_until}.
 */
@Repository
public class SweepLockRepository {
    private static final Logger log = LoggerFactory.getLogger(SweepLockRepository.class);

    private final NamedParameterJdbcTemplate jdbc;

    public SweepLockRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean tryAcquire(String lockName, String lockOwner, Instant now, long ttlSeconds) {
        ensureLockRow(lockName);
        Instant lockedUntil = now.plusSeconds(Math.max(1, ttlSeconds));
        String safeOwner = (lockOwner == null || lockOwner.isBlank()) ? "unknown" : lockOwner.trim();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lockName", lockName)
            .addValue("lockOwner", safeOwner)
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(lockedUntil));
        int updated = jdbc.update(
            """
                UPDATE sweep_locks
                SET locked_until = :lockedUntil,
                    lock_owner = :lockOwner,
                    updated_at = :now
                WHERE lock_name = :lockName
                  AND (locked_until IS NULL
                       OR locked_until < :now
                       OR lock_owner = :lockOwner)
                """,
            params
        );
        return updated > 0;
    }

    /**
     * Extends a lease the caller still holds. Returns false when the lease expired and was taken over.
     */
    public boolean renew(String lockName, String lockOwner, Instant now, long ttlSeconds) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lockName", lockName)
            .addValue("lockOwner", lockOwner)
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(now.plusSeconds(Math.max(1, ttlSeconds))));
        int updated = jdbc.update(
            """
                UPDATE sweep_locks
                SET locked_until = :lockedUntil,
                    updated_at = :now
                WHERE lock_name = :lockName
                  AND lock_owner = :lockOwner
                """,
            params
        );
        return updated > 0;
    }

    public boolean isHeld(String lockName, Instant now) {
        Integer held = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM sweep_locks
                WHERE lock_name = :lockName
                  AND locked_until IS NOT NULL
                  AND locked_until >= :now
                """,
            new MapSqlParameterSource()
                .addValue("lockName", lockName)
                .addValue("now", Timestamp.from(now)),
            Integer.class
        );
        return held != null && held > 0;
    }

    public void release(String lockName, String lockOwner, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lockName", lockName)
            .addValue("lockOwner", lockOwner)
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                UPDATE sweep_locks
                SET locked_until = NULL,
                    lock_owner = NULL,
                    updated_at = :now
                WHERE lock_name = :lockName
                  AND lock_owner = :lockOwner
                """,
            params
        );
    }

    private void ensureLockRow(String lockName) {
        try {
            jdbc.update(
                """
                    INSERT INTO sweep_locks (lock_name)
                    SELECT :lockName
                    WHERE NOT EXISTS (
                        SELECT 1 FROM sweep_locks WHERE lock_name = :lockName
                    )
                    """,
                new MapSqlParameterSource().addValue("lockName", lockName)
            );
        } catch (DataIntegrityViolationException e) {
            log.debug("Sweep lock row {} was created concurrently", lockName);
        }
    }
}
