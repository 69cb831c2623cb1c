package com.libragraph.synthesis.core.job;

import com.fasterxml.jackson.databind.ObjectMapper;

class DefaultJobContext implements JobContext {

    private final Job job;
    private final JobStore jobStore;
    private final ObjectMapper objectMapper;
    private int progress;

    DefaultJobContext(Job job, JobStore jobStore, ObjectMapper objectMapper) {
        this.job = job;
        this.jobStore = jobStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public String jobId() {
        return job.id();
    }

    @Override
    public JobType jobType() {
        return job.type();
    }

    @Override
    public int attempt() {
        return job.attempts();
    }

    @Override
    public <T> T payloadAs(Class<T> type) {
        try {
            return objectMapper.convertValue(job.payload(), type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid payload for job " + job.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void reportProgress(int percent) {
        int clamped = Math.max(0, Math.min(100, percent));
        if (clamped <= progress) {
            return;
        }
        progress = clamped;
        jobStore.setStatus(JobStatusUpdate.active(job, clamped));
    }

    synchronized int progress() {
        return progress;
    }
}
