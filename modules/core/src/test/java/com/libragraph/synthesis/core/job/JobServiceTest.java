package com.libragraph.synthesis.core.job;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class JobServiceTest {

    private InMemoryJobStore store;
    private JobService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        service = new JobService(store, new JobIdGenerator());
    }

    @Test
    void enqueueDependencyInference_queuesJobWithPipelinePayload() throws InterruptedException {
        UUID pipelineId = UUID.randomUUID();

        String jobId = service.enqueueDependencyInference(pipelineId);

        assertThat(jobId).startsWith("dependency_inference:");
        JobStatusRecord status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(status.progress()).isZero();
        assertThat(status.attempts()).isZero();

        Job job = store.dequeue(JobType.DEPENDENCY_INFERENCE, Duration.ZERO).orElseThrow();
        assertThat(job.id()).isEqualTo(jobId);
        assertThat(job.payload()).containsOnly(Map.entry("pipeline_id", pipelineId.toString()));
    }

    @Test
    void enqueueClaimExtraction_carriesPipelineAndDocument() throws InterruptedException {
        UUID pipelineId = UUID.randomUUID();
        UUID documentId = UUID.randomUUID();

        service.enqueueClaimExtraction(pipelineId, documentId);

        Job job = store.dequeue(JobType.CLAIM_EXTRACTION, Duration.ZERO).orElseThrow();
        assertThat(job.payload())
                .containsEntry("pipeline_id", pipelineId.toString())
                .containsEntry("document_id", documentId.toString());
    }

    @Test
    void queueStats_reportsEveryType() {
        service.enqueueDependencyInference(UUID.randomUUID());
        service.enqueueDependencyInference(UUID.randomUUID());
        service.enqueueReportGeneration(UUID.randomUUID(), "summary");

        Map<JobType, Long> stats = service.queueStats();

        assertThat(stats)
                .containsEntry(JobType.DEPENDENCY_INFERENCE, 2L)
                .containsEntry(JobType.REPORT_GENERATION, 1L)
                .containsEntry(JobType.CLAIM_EXTRACTION, 0L);
        assertThat(service.queueLength(JobType.DEPENDENCY_INFERENCE)).isEqualTo(2);
    }

    @Test
    void getJobStatus_unknownIdIsEmpty() {
        assertThat(service.getJobStatus("dependency_inference:1-0000")).isEmpty();
    }

    @Test
    void jobIds_areUniqueAcrossEnqueues() {
        String first = service.enqueueDependencyInference(UUID.randomUUID());
        String second = service.enqueueDependencyInference(UUID.randomUUID());

        assertThat(first).isNotEqualTo(second);
    }
}
