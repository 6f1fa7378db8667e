package com.ijp.lifecycle.posting.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ijp.lifecycle.config.LifecycleProperties;
import com.ijp.lifecycle.posting.model.JobPosting;
import com.ijp.lifecycle.posting.model.LifecycleStatus;
import com.ijp.lifecycle.posting.model.PolicySettings;
import com.ijp.lifecycle.posting.model.SweepRunStatus;
import com.ijp.lifecycle.posting.model.SweepSummary;
import com.ijp.lifecycle.posting.model.SweeperStatusResponse;
import com.ijp.lifecycle.posting.persistence.PostingJdbcRepository;
import com.ijp.lifecycle.posting.persistence.SweepLockRepository;
import com.ijp.lifecycle.posting.persistence.SweepRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Applies the time-triggered transitions: live postings past their deadline are archived, archived
 * postings past the retention window are deleted. One run uses one policy snapshot and one
 * "now". Each posting is handled on its own, so a lost race or a failed write on one posting never
 * stops the scan; lost races are not retried within the run.
 */
@Service
public class ExpirySweeper {
    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final PostingJdbcRepository repository;
    private final PolicyStore policyStore;
    private final LifecycleStateMachine stateMachine;
    private final SweepLockRepository lockRepository;
    private final SweepRunRepository runRepository;
    private final LifecycleProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final String instanceId;

    private volatile SweepSummary lastSummary;

    public ExpirySweeper(
        PostingJdbcRepository repository,
        PolicyStore policyStore,
        LifecycleStateMachine stateMachine,
        SweepLockRepository lockRepository,
        SweepRunRepository runRepository,
        LifecycleProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.repository = repository;
        this.policyStore = policyStore;
        this.stateMachine = stateMachine;
        this.lockRepository = lockRepository;
        this.runRepository = runRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.instanceId = "sweeper-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    public SweepSummary run() {
        Instant startedAt = clock.instant();
        if (!running.compareAndSet(false, true)) {
            log.info("Expiry sweep skipped: a sweep is already running on {}", instanceId);
            return SweepSummary.skipped(startedAt, "already_running");
        }
        try {
            String lockName = properties.getSweeper().getLockName();
            if (!lockRepository.tryAcquire(lockName, instanceId, startedAt, properties.getSweeper().getLockTtlSeconds())) {
                log.info("Expiry sweep skipped: lease {} is held by another instance", lockName);
                return SweepSummary.skipped(startedAt, "lease_held");
            }
            try {
                SweepSummary summary = sweep(startedAt);
                lastSummary = summary;
                return summary;
            } finally {
                releaseLease(lockName);
            }
        } finally {
            running.set(false);
            cancelRequested.set(false);
        }
    }

    /**
     * Asks the running sweep to stop before its next posting. Returns false when nothing is running.
     */
    public boolean cancel() {
        if (!running.get()) {
            return false;
        }
        cancelRequested.set(true);
        log.info("Cancellation requested for the running expiry sweep");
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public SweeperStatusResponse getStatus() {
        return new SweeperStatusResponse(
            running.get(),
            properties.getSweeper().isEnabled(),
            properties.getSweeper().getIntervalMs(),
            instanceId,
            lastSummary,
            runRepository.findLatest()
        );
    }

    private SweepSummary sweep(Instant now) {
        PolicySettings policy = policyStore.get();
        long runId = runRepository.insertRun(now, instanceId, writePolicy(policy));
        Counters counters = new Counters();
        SweepRunStatus status = SweepRunStatus.COMPLETED;
        try {
            boolean cancelled = false;
            if (policy.autoArchiveExpired()) {
                cancelled = sweepBatches(
                    (afterId, limit) -> repository.findExpiredLive(now, afterId, limit),
                    LifecycleStatus.ARCHIVED,
                    counters
                );
            }
            if (!cancelled) {
                Instant cutoff = now.minus(Duration.ofDays(policy.archiveDeletionDays()));
                cancelled = sweepBatches(
                    (afterId, limit) -> repository.findArchivedAtOrBefore(cutoff, afterId, limit),
                    LifecycleStatus.DELETED,
                    counters
                );
            }
            if (cancelled) {
                status = SweepRunStatus.CANCELLED;
            }
        } catch (RuntimeException e) {
            status = SweepRunStatus.FAILED;
            log.warn("Expiry sweep {} aborted while scanning postings", runId, e);
        }

        Instant finishedAt = clock.instant();
        try {
            runRepository.completeRun(
                runId,
                finishedAt,
                status,
                counters.archived,
                counters.deleted,
                counters.skipped,
                counters.errors
            );
        } catch (RuntimeException e) {
            log.warn("Failed to record completion of expiry sweep {}", runId, e);
        }
        log.info(
            "Expiry sweep {} {}: archived={}, deleted={}, skipped={}, errors={}, archiveDeletionDays={}, autoArchiveExpired={}",
            runId,
            status,
            counters.archived,
            counters.deleted,
            counters.skipped,
            counters.errors,
            policy.archiveDeletionDays(),
            policy.autoArchiveExpired()
        );
        return new SweepSummary(
            runId,
            now,
            finishedAt,
            status,
            null,
            policy,
            counters.archived,
            counters.deleted,
            counters.skipped,
            counters.errors
        );
    }

    /**
     * Walks the candidates in id order. Returns true if the sweep was cancelled part way.
     */
    private boolean sweepBatches(CandidateSource source, LifecycleStatus target, Counters counters) {
        int batchSize = properties.getSweeper().getBatchSize();
        long lastId = 0L;
        while (true) {
            renewLease();
            List<JobPosting> batch = source.fetch(lastId, batchSize);
            if (batch.isEmpty()) {
                return false;
            }
            for (JobPosting candidate : batch) {
                if (isCancelled()) {
                    return true;
                }
                lastId = candidate.id();
                attempt(candidate, target, counters);
            }
        }
    }

    private void attempt(JobPosting candidate, LifecycleStatus target, Counters counters) {
        try {
            stateMachine.transition(candidate.id(), candidate.status(), target, candidate.version());
            if (target == LifecycleStatus.ARCHIVED) {
                counters.archived++;
            } else {
                counters.deleted++;
            }
        } catch (ConcurrentPostingUpdateException | InvalidTransitionException | PostingNotFoundException e) {
            counters.skipped++;
            log.debug("Sweep skipped posting {} ({} -> {}): {}", candidate.id(), candidate.status(), target, e.getMessage());
        } catch (RuntimeException e) {
            counters.errors++;
            log.warn("Sweep failed to move posting {} from {} to {}", candidate.id(), candidate.status(), target, e);
        }
    }

    private boolean isCancelled() {
        return cancelRequested.get() || Thread.currentThread().isInterrupted();
    }

    /**
     * Pushes {@code locked_until} forward before each batch so a long sweep keeps its lease. Losing
     * the lease ends the run as failed.
     */
    private void renewLease() {
        LifecycleProperties.Sweeper config = properties.getSweeper();
        if (!lockRepository.renew(config.getLockName(), instanceId, clock.instant(), config.getLockTtlSeconds())) {
            throw new IllegalStateException("Sweep lease " + config.getLockName() + " is no longer held by " + instanceId);
        }
    }

    private void releaseLease(String lockName) {
        try {
            lockRepository.release(lockName, instanceId, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Failed to release sweep lease {}; it expires on its own", lockName, e);
        }
    }

    private String writePolicy(PolicySettings policy) {
        try {
            return objectMapper.writeValueAsString(policy);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize policy snapshot {}", policy, e);
            return null;
        }
    }

    @FunctionalInterface
    private interface CandidateSource {
        List<JobPosting> fetch(long afterId, int limit);
    }

    private static final class Counters {
        private int archived;
        private int deleted;
        private int skipped;
        private int errors;
    }
}
