package com.ijp.lifecycle.posting.service;

import com.ijp.lifecycle.config.LifecycleProperties;
import com.ijp.lifecycle.posting.model.JobPosting;
import com.ijp.lifecycle.posting.model.LifecycleStatus;
import com.ijp.lifecycle.posting.model.TransitionResult;
import com.ijp.lifecycle.posting.persistence.PostingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The only writer of {@code job_postings.status}. Every transition is a compare-and-swap on
 * {@code (status, version)}, so manual actions and the expiry sweep can race freely: the loser gets
 * {@link ConcurrentPostingUpdateException} and the row is left as the winner wrote it.
 *
 * <pre>
 * LIVE     -> ARCHIVED   archivedAt = now
 * ARCHIVED -> LIVE       archivedAt = null, deadline = now + reactivation window
 * ARCHIVED -> DELETED    tombstone, owned documents erased
 * DELETED  -> (none)
 * </pre>
 */
@Service
public class LifecycleStateMachine {
    private static final Logger log = LoggerFactory.getLogger(LifecycleStateMachine.class);
    private static final Map<LifecycleStatus, Set<LifecycleStatus>> ALLOWED = new EnumMap<>(LifecycleStatus.class);

    static {
        ALLOWED.put(LifecycleStatus.LIVE, EnumSet.of(LifecycleStatus.ARCHIVED));
        ALLOWED.put(LifecycleStatus.ARCHIVED, EnumSet.of(LifecycleStatus.LIVE, LifecycleStatus.DELETED));
        ALLOWED.put(LifecycleStatus.DELETED, EnumSet.noneOf(LifecycleStatus.class));
    }

    private final PostingJdbcRepository repository;
    private final LifecycleProperties properties;
    private final Clock clock;

    public LifecycleStateMachine(PostingJdbcRepository repository, LifecycleProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public static boolean isAllowed(LifecycleStatus from, LifecycleStatus to) {
        return from != null && to != null && ALLOWED.get(from).contains(to);
    }

    public Duration reactivationWindow() {
        return Duration.ofDays(properties.getReactivation().getWindowDays());
    }

    @Transactional
    public TransitionResult transition(long postingId, LifecycleStatus from, LifecycleStatus to) {
        return transition(postingId, from, to, null);
    }

    /**
     * Applies {@code from -> to}. When {@code expectedVersion} is given the posting must still be at
     * that version, which lets a caller that decided on an earlier read (the sweeper) refuse to act
     * on a posting that has changed since.
     */
    @Transactional
    public TransitionResult transition(long postingId, LifecycleStatus from, LifecycleStatus to, Long expectedVersion) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        JobPosting current = repository.findById(postingId)
            .orElseThrow(() -> new PostingNotFoundException(postingId));
        if (current.status() != from) {
            throw new InvalidTransitionException(
                postingId,
                current.status(),
                to,
                "Posting " + postingId + " is " + current.status() + ", cannot move " + from + " -> " + to
            );
        }
        if (!isAllowed(from, to)) {
            throw new InvalidTransitionException(
                postingId,
                current.status(),
                to,
                "Transition " + from + " -> " + to + " is not allowed"
            );
        }
        if (expectedVersion != null && current.version() != expectedVersion) {
            throw new ConcurrentPostingUpdateException(postingId);
        }

        Instant now = clock.instant();
        JobPosting next = switch (to) {
            case ARCHIVED -> current.withLifecycle(LifecycleStatus.ARCHIVED, current.deadline(), now, null, now);
            case LIVE -> current.withLifecycle(LifecycleStatus.LIVE, now.plus(reactivationWindow()), null, null, now);
            case DELETED -> current.withLifecycle(LifecycleStatus.DELETED, current.deadline(), null, now, now);
        };

        int updated = repository.compareAndSetLifecycle(next, from, current.version());
        if (updated == 0) {
            throw new ConcurrentPostingUpdateException(postingId);
        }
        int erasedDocuments = to == LifecycleStatus.DELETED ? repository.deleteDocumentsForPosting(postingId) : 0;
        log.debug("Posting {} moved {} -> {} (version {})", postingId, from, to, next.version());
        return new TransitionResult(next, from, erasedDocuments);
    }
}
