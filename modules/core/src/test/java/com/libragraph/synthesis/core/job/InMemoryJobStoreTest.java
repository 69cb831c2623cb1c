package com.libragraph.synthesis.core.job;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class InMemoryJobStoreTest {

    private static final Duration TTL = Duration.ofHours(24);

    private MutableClock clock;
    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new InMemoryJobStore(clock, TTL);
    }

    private Job job(String id, JobType type) {
        return new Job(id, type, Map.of("pipeline_id", "p-1"), 0, clock.instant());
    }

    @Test
    void enqueue_writesQueuedStatusWithZeroProgress() {
        store.enqueue(job("j1", JobType.DEPENDENCY_INFERENCE));

        JobStatusRecord status = store.getStatus("j1").orElseThrow();
        assertThat(status.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(status.progress()).isZero();
        assertThat(status.error()).isNull();
        assertThat(status.expiresAt()).isEqualTo(clock.instant().plus(TTL));
        assertThat(store.queueLength(JobType.DEPENDENCY_INFERENCE)).isEqualTo(1);
    }

    @Test
    void dequeue_isFifoWithinType() throws InterruptedException {
        store.enqueue(job("first", JobType.DEPENDENCY_INFERENCE));
        store.enqueue(job("other-type", JobType.CLAIM_EXTRACTION));
        store.enqueue(job("second", JobType.DEPENDENCY_INFERENCE));

        assertThat(store.dequeue(JobType.DEPENDENCY_INFERENCE, Duration.ZERO)).map(Job::id).contains("first");
        assertThat(store.dequeue(JobType.DEPENDENCY_INFERENCE, Duration.ZERO)).map(Job::id).contains("second");
        assertThat(store.dequeue(JobType.CLAIM_EXTRACTION, Duration.ZERO)).map(Job::id).contains("other-type");
    }

    @Test
    void dequeue_emptyQueueReturnsEmptyAfterTimeout() throws InterruptedException {
        Optional<Job> none = store.dequeue(JobType.REPORT_GENERATION, Duration.ofMillis(20));
        assertThat(none).isEmpty();
    }

    @Test
    void dequeue_removesJobButKeepsStatus() throws InterruptedException {
        store.enqueue(job("j1", JobType.CLAIM_EXTRACTION));
        store.dequeue(JobType.CLAIM_EXTRACTION, Duration.ZERO);

        assertThat(store.queueLength(JobType.CLAIM_EXTRACTION)).isZero();
        assertThat(store.getStatus("j1")).map(JobStatusRecord::status).contains(JobStatus.QUEUED);
    }

    @Test
    void getStatus_unknownIdIsEmpty() {
        assertThat(store.getStatus("never-enqueued")).isEmpty();
    }

    @Test
    void status_expiresAfterTtl() {
        store.enqueue(job("j1", JobType.DEPENDENCY_INFERENCE));

        clock.advance(TTL.minusSeconds(1));
        assertThat(store.getStatus("j1")).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.getStatus("j1")).isEmpty();
    }

    @Test
    void setStatus_refreshesExpiry() {
        Job job = job("j1", JobType.DEPENDENCY_INFERENCE);
        store.enqueue(job);

        clock.advance(Duration.ofHours(20));
        store.setStatus(JobStatusUpdate.active(job, 40));
        clock.advance(Duration.ofHours(20));

        JobStatusRecord status = store.getStatus("j1").orElseThrow();
        assertThat(status.status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(status.progress()).isEqualTo(40);
    }

    @Test
    void requeue_keepsIdAttemptsAndLastError() throws InterruptedException {
        Job job = job("j1", JobType.DEPENDENCY_INFERENCE);
        store.requeue(job.nextAttempt(), "classifier down");

        JobStatusRecord status = store.getStatus("j1").orElseThrow();
        assertThat(status.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(status.attempts()).isEqualTo(1);
        assertThat(status.error()).isEqualTo("classifier down");

        Job dequeued = store.dequeue(JobType.DEPENDENCY_INFERENCE, Duration.ZERO).orElseThrow();
        assertThat(dequeued.id()).isEqualTo("j1");
        assertThat(dequeued.attempts()).isEqualTo(1);
        assertThat(dequeued.payload()).containsEntry("pipeline_id", "p-1");
    }

    @Test
    void purgeExpiredStatuses_removesOnlyExpired() {
        store.enqueue(job("old", JobType.DEPENDENCY_INFERENCE));
        clock.advance(Duration.ofHours(23));
        store.enqueue(job("new", JobType.DEPENDENCY_INFERENCE));
        clock.advance(Duration.ofHours(2));

        assertThat(store.purgeExpiredStatuses()).isEqualTo(1);
        assertThat(store.getStatus("old")).isEmpty();
        assertThat(store.getStatus("new")).isPresent();
    }

    @Test
    void findActiveNotUpdatedSince_returnsOnlyStaleActiveJobs() {
        Job stale = job("stale", JobType.DEPENDENCY_INFERENCE);
        Job fresh = job("fresh", JobType.DEPENDENCY_INFERENCE);
        Job done = job("done", JobType.DEPENDENCY_INFERENCE);
        store.setStatus(JobStatusUpdate.active(stale, 20));
        store.setStatus(JobStatusUpdate.completed(done, null));
        clock.advance(Duration.ofMinutes(45));
        store.setStatus(JobStatusUpdate.active(fresh, 10));

        Instant cutoff = clock.instant().minus(Duration.ofMinutes(30));
        assertThat(store.findActiveNotUpdatedSince(cutoff))
                .extracting(JobStatusRecord::jobId)
                .containsExactly("stale");
    }
}
