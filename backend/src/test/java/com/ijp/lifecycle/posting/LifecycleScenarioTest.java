package com.ijp.lifecycle.posting;

import com.ijp.lifecycle.posting.model.CreatePostingRequest;
import com.ijp.lifecycle.posting.model.DeletionPreview;
import com.ijp.lifecycle.posting.model.JobPosting;
import com.ijp.lifecycle.posting.model.LifecycleStatus;
import com.ijp.lifecycle.posting.model.SweepRunStatus;
import com.ijp.lifecycle.posting.model.SweepSummary;
import com.ijp.lifecycle.posting.persistence.PostingJdbcRepository;
import com.ijp.lifecycle.posting.service.DeletionPreviewService;
import com.ijp.lifecycle.posting.service.ExpirySweeper;
import com.ijp.lifecycle.posting.service.InvalidTransitionException;
import com.ijp.lifecycle.posting.service.LifecycleValidationException;
import com.ijp.lifecycle.posting.service.PolicyStore;
import com.ijp.lifecycle.posting.service.PostingService;
import com.ijp.lifecycle.support.MutableClock;
import com.ijp.lifecycle.support.TestClockConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@Transactional
class LifecycleScenarioTest {
    private static final long COMPANY = 501L;
    private static final Instant DAY_0 = TestClockConfiguration.START;

    @Autowired
    private MutableClock clock;
    @Autowired
    private PostingService postingService;
    @Autowired
    private ExpirySweeper sweeper;
    @Autowired
    private PolicyStore policyStore;
    @Autowired
    private DeletionPreviewService previewService;
    @Autowired
    private PostingJdbcRepository repository;
    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @BeforeEach
    void resetClock() {
        clock.setInstant(DAY_0);
    }

    @Test
    void deadlineIsBoundedByPolicyAtCreation() {
        JobPosting accepted = createWithDeadline(day(10));

        assertThat(accepted.status()).isEqualTo(LifecycleStatus.LIVE);
        assertThatThrownBy(() -> createWithDeadline(day(100)))
            .isInstanceOf(LifecycleValidationException.class);
    }

    @Test
    void sweepArchivesOnDeadlineAndPreviewFlagsItForShorterRetention() {
        long id = createWithDeadline(day(10)).id();

        clock.setInstant(day(11));
        SweepSummary summary = sweeper.run();

        JobPosting archived = load(id);
        assertThat(summary.status()).isEqualTo(SweepRunStatus.COMPLETED);
        assertThat(archived.status()).isEqualTo(LifecycleStatus.ARCHIVED);
        assertThat(archived.archivedAt()).isEqualTo(day(11));

        policyStore.set("archive_deletion_days", "30", 1L);
        clock.setInstant(day(50));
        DeletionPreview preview = previewService.preview(30);

        assertThat(preview.affectedCount()).isGreaterThanOrEqualTo(1L);
        assertThat(preview.affectedSample()).anySatisfy(entry -> {
            assertThat(entry.id()).isEqualTo(id);
            assertThat(entry.daysArchived()).isEqualTo(39L);
        });
        assertThat(preview.warning()).isTrue();
    }

    @Test
    void reactivationGrantsFixedWindowRegardlessOfDeadlinePolicy() {
        long id = createWithDeadline(day(10)).id();
        clock.setInstant(day(11));
        sweeper.run();
        policyStore.set("max_job_deadline_days", "7", 1L);

        clock.setInstant(day(60));
        JobPosting reactivated = postingService.reactivate(COMPANY, id);

        assertThat(reactivated.status()).isEqualTo(LifecycleStatus.LIVE);
        assertThat(reactivated.archivedAt()).isNull();
        assertThat(reactivated.deadline()).isEqualTo(day(90));
        assertThat(load(id).deadline()).isEqualTo(day(90));
    }

    @Test
    void retentionSweepDeletesOnceAndLaterSweepsAreNoOps() {
        long id = createWithDeadline(day(10)).id();
        insertDocument(id, "job-ad.pdf");
        policyStore.set("archive_deletion_days", "30", 1L);
        clock.setInstant(day(11));
        sweeper.run();

        clock.setInstant(day(41));
        SweepSummary purge = sweeper.run();

        JobPosting deleted = load(id);
        assertThat(purge.deletedCount()).isEqualTo(1);
        assertThat(deleted.status()).isEqualTo(LifecycleStatus.DELETED);
        assertThat(deleted.archivedAt()).isNull();
        assertThat(deleted.deletedAt()).isEqualTo(day(41));
        assertThat(countDocuments(id)).isZero();

        clock.setInstant(day(100));
        SweepSummary later = sweeper.run();

        assertThat(later.archivedCount()).isZero();
        assertThat(later.deletedCount()).isZero();
        assertThat(load(id)).isEqualTo(deleted);
    }

    @Test
    void sweepIsIdempotentWithoutTimePassing() {
        createWithDeadline(day(1));
        createWithDeadline(day(20));
        createWithDeadline(null);
        clock.setInstant(day(5));

        sweeper.run();
        List<JobPosting> afterFirst = postingService.listMine(COMPANY);
        SweepSummary second = sweeper.run();
        List<JobPosting> afterSecond = postingService.listMine(COMPANY);

        assertThat(second.archivedCount()).isZero();
        assertThat(second.deletedCount()).isZero();
        assertThat(afterSecond).isEqualTo(afterFirst);
    }

    @Test
    void deletedPostingStaysDeleted() {
        long id = createWithDeadline(null).id();
        postingService.archive(COMPANY, id);
        postingService.deletePermanently(COMPANY, id);

        assertThatThrownBy(() -> postingService.reactivate(COMPANY, id))
            .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> postingService.archive(COMPANY, id))
            .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> postingService.deletePermanently(COMPANY, id))
            .isInstanceOf(InvalidTransitionException.class);
        clock.setInstant(day(400));
        sweeper.run();

        assertThat(load(id).status()).isEqualTo(LifecycleStatus.DELETED);
        assertThat(postingService.listMine(COMPANY)).extracting(JobPosting::id).doesNotContain(id);
    }

    @Test
    void policyChangesNeverRewriteStoredDeadlines() {
        JobPosting posting = createWithDeadline(day(80));

        policyStore.set("max_job_deadline_days", "10", 1L);
        policyStore.set("archive_deletion_days", "5", 1L);

        JobPosting reloaded = load(posting.id());
        assertThat(reloaded.deadline()).isEqualTo(day(80));
        assertThat(reloaded.version()).isEqualTo(posting.version());
    }

    @Test
    void previewNeverChangesStoredPostings() {
        long id = createWithDeadline(day(2)).id();
        clock.setInstant(day(3));
        sweeper.run();
        clock.setInstant(day(200));
        JobPosting before = load(id);

        DeletionPreview first = previewService.preview(1);
        DeletionPreview second = previewService.preview(1);

        assertThat(load(id)).isEqualTo(before);
        assertThat(second.affectedCount()).isEqualTo(first.affectedCount());
        assertThat(before.status()).isEqualTo(LifecycleStatus.ARCHIVED);
    }

    @Test
    void disablingAutoArchiveLeavesExpiredPostingsLive() {
        long id = createWithDeadline(day(1)).id();
        policyStore.set("auto_archive_expired_jobs", "false", 1L);
        clock.setInstant(day(30));

        sweeper.run();

        assertThat(load(id).status()).isEqualTo(LifecycleStatus.LIVE);
    }

    @Test
    void archivedAtIsSetExactlyWhenArchived() {
        long keptLive = createWithDeadline(null).id();
        long archived = createWithDeadline(null).id();
        long reactivated = createWithDeadline(null).id();
        long deleted = createWithDeadline(null).id();
        postingService.archive(COMPANY, archived);
        postingService.archive(COMPANY, reactivated);
        postingService.reactivate(COMPANY, reactivated);
        postingService.archive(COMPANY, deleted);
        postingService.deletePermanently(COMPANY, deleted);

        for (long id : List.of(keptLive, archived, reactivated, deleted)) {
            JobPosting posting = load(id);
            assertThat(posting.archivedAt() != null)
                .as("posting %d in status %s", id, posting.status())
                .isEqualTo(posting.status() == LifecycleStatus.ARCHIVED);
        }
    }

    private JobPosting createWithDeadline(Instant deadline) {
        return postingService.create(COMPANY, new CreatePostingRequest("Harvest helper", deadline, true));
    }

    private JobPosting load(long id) {
        return repository.findById(id).orElseThrow();
    }

    private static Instant day(int n) {
        return DAY_0.plus(Duration.ofDays(n));
    }

    private void insertDocument(long postingId, String fileName) {
        jdbc.update(
            "INSERT INTO posting_documents (posting_id, file_name, created_at) VALUES (:postingId, :fileName, :createdAt)",
            new MapSqlParameterSource()
                .addValue("postingId", postingId)
                .addValue("fileName", fileName)
                .addValue("createdAt", Timestamp.from(DAY_0))
        );
    }

    private int countDocuments(long postingId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM posting_documents WHERE posting_id = :postingId",
            new MapSqlParameterSource().addValue("postingId", postingId),
            Integer.class
        );
        return count == null ? 0 : count;
    }
}
