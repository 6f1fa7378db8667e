package com.ijp.lifecycle.posting.service;

import com.ijp.lifecycle.config.LifecycleProperties;
import com.ijp.lifecycle.posting.model.SweepSummary;
import com.ijp.lifecycle.posting.persistence.PostingJdbcRepository;
import com.ijp.lifecycle.posting.persistence.SweepLockRepository;
import com.ijp.lifecycle.posting.persistence.SweepRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * On startup, closes sweep runs orphaned by a previous process and, if configured, runs one sweep
 * so postings that expired while the service was down are handled without waiting for the
 * scheduler. Runs are left alone while another instance still holds the sweep lease.
 */
@Component
public class SweepStartupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SweepStartupRunner.class);

    private final PostingJdbcRepository postingRepository;
    private final SweepRunRepository runRepository;
    private final SweepLockRepository lockRepository;
    private final ExpirySweeper sweeper;
    private final LifecycleProperties properties;
    private final Clock clock;

    public SweepStartupRunner(
        PostingJdbcRepository postingRepository,
        SweepRunRepository runRepository,
        SweepLockRepository lockRepository,
        ExpirySweeper sweeper,
        LifecycleProperties properties,
        Clock clock
    ) {
        this.postingRepository = postingRepository;
        this.runRepository = runRepository;
        this.lockRepository = lockRepository;
        this.sweeper = sweeper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = postingRepository.isDbReachable();
        } catch (Exception e) {
            log.debug("Database reachability check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping sweep startup tasks because database is unreachable");
            return;
        }

        Instant now = clock.instant();
        String lockName = properties.getSweeper().getLockName();
        if (lockRepository.isHeld(lockName, now)) {
            log.info("Sweep lease {} is held by a running sweep; leaving its run record alone", lockName);
        } else {
            Instant cutoff = now.minus(Duration.ofSeconds(properties.getSweeper().getLockTtlSeconds()));
            int aborted = runRepository.abortStaleRuns(cutoff, now);
            if (aborted > 0) {
                log.info("Aborted {} stale sweep run(s) started before {}", aborted, cutoff);
            }
        }

        if (!properties.getSweeper().isRunOnStartup()) {
            return;
        }
        SweepSummary summary = sweeper.run();
        log.info(
            "Startup expiry sweep finished with status {} (archived={}, deleted={})",
            summary.status(),
            summary.archivedCount(),
            summary.deletedCount()
        );
    }
}
