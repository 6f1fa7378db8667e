package com.ijp.lifecycle.posting.service;

import com.ijp.lifecycle.posting.model.JobPosting;
import com.ijp.lifecycle.posting.model.LifecycleStatus;
import com.ijp.lifecycle.posting.persistence.PostingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Brings an archived posting back to live. The new deadline is always the fixed reactivation window
 * from now and deliberately ignores {@code maxJobDeadlineDays}.
 */
@Service
public class ReactivationHandler {
    private static final Logger log = LoggerFactory.getLogger(ReactivationHandler.class);

    private final PostingJdbcRepository repository;
    private final LifecycleStateMachine stateMachine;

    public ReactivationHandler(PostingJdbcRepository repository, LifecycleStateMachine stateMachine) {
        this.repository = repository;
        this.stateMachine = stateMachine;
    }

    @Transactional
    public JobPosting reactivate(long postingId) {
        JobPosting current = repository.findById(postingId)
            .orElseThrow(() -> new PostingNotFoundException(postingId));
        return reactivate(current);
    }

    @Transactional
    public JobPosting reactivate(JobPosting current) {
        if (current.status() != LifecycleStatus.ARCHIVED) {
            throw new InvalidTransitionException(
                current.id(),
                current.status(),
                LifecycleStatus.LIVE,
                "Posting " + current.id() + " is not archived (status " + current.status() + ")"
            );
        }
        JobPosting reactivated = stateMachine
            .transition(current.id(), LifecycleStatus.ARCHIVED, LifecycleStatus.LIVE, current.version())
            .posting();
        log.info(
            "Reactivated posting {} for owner {} with deadline {}",
            reactivated.id(),
            reactivated.ownerId(),
            reactivated.deadline()
        );
        return reactivated;
    }
}
