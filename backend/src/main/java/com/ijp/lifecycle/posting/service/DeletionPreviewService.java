package com.ijp.lifecycle.posting.service;

import com.ijp.lifecycle.config.LifecycleProperties;
import com.ijp.lifecycle.posting.model.DeletionPreview;
import com.ijp.lifecycle.posting.model.DeletionPreviewEntry;
import com.ijp.lifecycle.posting.model.JobPosting;
import com.ijp.lifecycle.posting.model.PolicySettingKey;
import com.ijp.lifecycle.posting.persistence.PostingJdbcRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Dry run of a retention change: which archived postings the next sweep would delete if
 * {@code archiveDeletionDays} were set to the candidate value. Nothing is written.
 */
@Service
public class DeletionPreviewService {
    private final PostingJdbcRepository repository;
    private final PolicyStore policyStore;
    private final LifecycleProperties properties;
    private final Clock clock;

    public DeletionPreviewService(
        PostingJdbcRepository repository,
        PolicyStore policyStore,
        LifecycleProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.policyStore = policyStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public DeletionPreview preview(int candidateRetentionDays) {
        int days = policyStore.validateDays(PolicySettingKey.ARCHIVE_DELETION_DAYS, candidateRetentionDays);
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(days));

        long affectedCount = repository.countArchivedAtOrBefore(cutoff);
        List<DeletionPreviewEntry> sample = repository
            .findOldestArchivedAtOrBefore(cutoff, properties.getPreview().getSampleLimit())
            .stream()
            .map(posting -> toEntry(posting, now))
            .toList();

        boolean warning = affectedCount > 0;
        String warningMessage = warning
            ? String.format(
                Locale.ROOT,
                "Setting the retention to %d days would delete %d archived posting(s) on the next sweep",
                days,
                affectedCount
            )
            : null;
        return new DeletionPreview(days, cutoff, affectedCount, sample, warning, warningMessage);
    }

    private DeletionPreviewEntry toEntry(JobPosting posting, Instant now) {
        return new DeletionPreviewEntry(
            posting.id(),
            posting.title(),
            posting.archivedAt(),
            Duration.between(posting.archivedAt(), now).toDays()
        );
    }
}
