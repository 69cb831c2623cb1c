package com.libragraph.synthesis.core.job;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/** {@link JobContext} for handler tests: keeps every progress report. */
public class RecordingJobContext implements JobContext {

    private final Job job;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Integer> progress = new ArrayList<>();

    public RecordingJobContext(Job job) {
        this.job = job;
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
        return objectMapper.convertValue(job.payload(), type);
    }

    @Override
    public void reportProgress(int percent) {
        progress.add(percent);
    }

    public List<Integer> progress() {
        return progress;
    }
}
