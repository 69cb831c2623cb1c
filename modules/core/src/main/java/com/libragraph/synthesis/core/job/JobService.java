package com.libragraph.synthesis.core.job;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for the request layer: enqueues typed jobs and reads their status.
 */
@ApplicationScoped
public class JobService {

    private static final Logger log = Logger.getLogger(JobService.class);

    private final JobStore jobStore;
    private final JobIdGenerator idGenerator;

    @Inject
    public JobService(JobStore jobStore, JobIdGenerator idGenerator) {
        this.jobStore = jobStore;
        this.idGenerator = idGenerator;
    }

    public String enqueue(JobType type, Map<String, Object> payload) {
        Job job = new Job(idGenerator.next(type), type, payload, 0, Instant.now());
        jobStore.enqueue(job);
        log.infof("Enqueued job %s to %s", job.id(), type.wireName());
        return job.id();
    }

    public String enqueueDependencyInference(UUID pipelineId) {
        return enqueue(JobType.DEPENDENCY_INFERENCE, Map.of("pipeline_id", pipelineId.toString()));
    }

    public String enqueueClaimExtraction(UUID pipelineId, UUID documentId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pipeline_id", pipelineId.toString());
        payload.put("document_id", documentId.toString());
        return enqueue(JobType.CLAIM_EXTRACTION, payload);
    }

    public String enqueueReportGeneration(UUID pipelineId, String reportType) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pipeline_id", pipelineId.toString());
        payload.put("report_type", reportType);
        return enqueue(JobType.REPORT_GENERATION, payload);
    }

    public Optional<JobStatusRecord> getJobStatus(String jobId) {
        return jobStore.getStatus(jobId);
    }

    public long queueLength(JobType type) {
        return jobStore.queueLength(type);
    }

    public Map<JobType, Long> queueStats() {
        Map<JobType, Long> stats = new EnumMap<>(JobType.class);
        for (JobType type : JobType.values()) {
            stats.put(type, jobStore.queueLength(type));
        }
        return stats;
    }
}
