package com.ijp.lifecycle.posting.service;

import com.ijp.lifecycle.posting.model.CreatePostingRequest;
import com.ijp.lifecycle.posting.model.JobPosting;
import com.ijp.lifecycle.posting.model.LifecycleStatus;
import com.ijp.lifecycle.posting.model.PermanentDeletionResponse;
import com.ijp.lifecycle.posting.model.PolicySettings;
import com.ijp.lifecycle.posting.model.TransitionResult;
import com.ijp.lifecycle.posting.model.UpdatePostingRequest;
import com.ijp.lifecycle.posting.persistence.PostingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Owner-scoped posting operations. A posting owned by another company is reported as not found.
 */
@Service
public class PostingService {
    private static final Logger log = LoggerFactory.getLogger(PostingService.class);
    private static final int MAX_TITLE_LENGTH = 255;

    private final PostingJdbcRepository repository;
    private final PolicyStore policyStore;
    private final LifecycleStateMachine stateMachine;
    private final ReactivationHandler reactivationHandler;
    private final Clock clock;

    public PostingService(
        PostingJdbcRepository repository,
        PolicyStore policyStore,
        LifecycleStateMachine stateMachine,
        ReactivationHandler reactivationHandler,
        Clock clock
    ) {
        this.repository = repository;
        this.policyStore = policyStore;
        this.stateMachine = stateMachine;
        this.reactivationHandler = reactivationHandler;
        this.clock = clock;
    }

    @Transactional
    public JobPosting create(long ownerId, CreatePostingRequest request) {
        if (request == null) {
            throw new LifecycleValidationException("Request body is required");
        }
        String title = request.title() == null ? "" : request.title().trim();
        if (title.isEmpty()) {
            throw new LifecycleValidationException("title is required");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new LifecycleValidationException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        Instant now = clock.instant();
        validateDeadline(request.deadline(), now);
        boolean visible = request.visible() == null || request.visible();

        long id = repository.insertPosting(ownerId, title, visible, request.deadline(), now);
        log.info("Created posting {} for owner {} with deadline {}", id, ownerId, request.deadline());
        return repository.findById(id).orElseThrow(() -> new PostingNotFoundException(id));
    }

    @Transactional
    public JobPosting update(long ownerId, long postingId, UpdatePostingRequest request) {
        if (request == null) {
            throw new LifecycleValidationException("Request body is required");
        }
        JobPosting current = requireOwned(ownerId, postingId);
        if (current.status() == LifecycleStatus.DELETED) {
            throw new InvalidTransitionException(
                postingId,
                current.status(),
                current.status(),
                "Posting " + postingId + " is deleted and can no longer be edited"
            );
        }
        Instant now = clock.instant();
        boolean touchesDeadline = Boolean.TRUE.equals(request.clearDeadline()) || request.deadline() != null;
        if (current.status() != LifecycleStatus.LIVE) {
            if (touchesDeadline) {
                throw new InvalidTransitionException(
                    postingId,
                    current.status(),
                    LifecycleStatus.LIVE,
                    "Only live postings can change their deadline; posting " + postingId + " is " + current.status()
                );
            }
            if (request.visible() == null) {
                return current;
            }
            if (repository.updateVisibility(postingId, current.version(), request.visible(), now) == 0) {
                throw new ConcurrentPostingUpdateException(postingId);
            }
            return repository.findById(postingId).orElseThrow(() -> new PostingNotFoundException(postingId));
        }
        Instant deadline = current.deadline();
        if (Boolean.TRUE.equals(request.clearDeadline())) {
            deadline = null;
        } else if (request.deadline() != null) {
            validateDeadline(request.deadline(), now);
            deadline = request.deadline();
        }
        boolean visible = request.visible() == null ? current.visible() : request.visible();

        int updated = repository.updateLiveFields(postingId, current.version(), deadline, visible, now);
        if (updated == 0) {
            throw new ConcurrentPostingUpdateException(postingId);
        }
        return repository.findById(postingId).orElseThrow(() -> new PostingNotFoundException(postingId));
    }

    public List<JobPosting> listMine(long ownerId) {
        return repository.findByOwnerExcludingStatus(ownerId, LifecycleStatus.DELETED);
    }

    public List<JobPosting> listArchived(long ownerId) {
        return repository.findArchivedByOwner(ownerId);
    }

    @Transactional
    public JobPosting archive(long ownerId, long postingId) {
        JobPosting current = requireOwned(ownerId, postingId);
        TransitionResult result = stateMachine.transition(
            postingId,
            LifecycleStatus.LIVE,
            LifecycleStatus.ARCHIVED,
            current.version()
        );
        log.info("Owner {} archived posting {}", ownerId, postingId);
        return result.posting();
    }

    @Transactional
    public JobPosting reactivate(long ownerId, long postingId) {
        return reactivationHandler.reactivate(requireOwned(ownerId, postingId));
    }

    @Transactional
    public PermanentDeletionResponse deletePermanently(long ownerId, long postingId) {
        JobPosting current = requireOwned(ownerId, postingId);
        TransitionResult result = stateMachine.transition(
            postingId,
            LifecycleStatus.ARCHIVED,
            LifecycleStatus.DELETED,
            current.version()
        );
        log.info(
            "Owner {} permanently deleted posting {} ({} document(s) erased)",
            ownerId,
            postingId,
            result.erasedDocuments()
        );
        return new PermanentDeletionResponse(
            postingId,
            result.posting().status(),
            result.posting().deletedAt(),
            result.erasedDocuments()
        );
    }

    private JobPosting requireOwned(long ownerId, long postingId) {
        return repository.findById(postingId)
            .filter(posting -> posting.ownerId() == ownerId)
            .orElseThrow(() -> new PostingNotFoundException(postingId));
    }

    private void validateDeadline(Instant deadline, Instant now) {
        if (deadline == null) {
            return;
        }
        if (deadline.isBefore(now)) {
            throw new LifecycleValidationException("deadline must not be in the past");
        }
        PolicySettings policy = policyStore.get();
        Instant latest = now.plus(Duration.ofDays(policy.maxJobDeadlineDays()));
        if (deadline.isAfter(latest)) {
            throw new LifecycleValidationException(
                "deadline must be at most " + policy.maxJobDeadlineDays() + " days in the future"
            );
        }
    }
}
