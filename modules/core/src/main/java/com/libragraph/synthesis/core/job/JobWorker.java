package com.libragraph.synthesis.core.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * Sequential dequeue-dispatch loop for one job type.
 * <p>
 * Each attempt goes {@code active(0)} then {@code completed(100)} or {@code failed(error)}. A failed
 * job is re-enqueued with {@code attempts + 1} while {@code attempts < maxRetries}; after that the
 * failure is terminal and reported to the {@link JobFailureListener}. Errors raised by the store
 * itself are logged and followed by a fixed backoff; they never consume an attempt.
 */
public class JobWorker implements Runnable {

    private static final Logger log = Logger.getLogger(JobWorker.class);

    private final JobHandler handler;
    private final JobStore jobStore;
    private final ObjectMapper objectMapper;
    private final WorkerSettings settings;
    private final JobFailureListener failureListener;
    private volatile boolean running;

    public JobWorker(JobHandler handler, JobStore jobStore, ObjectMapper objectMapper,
                     WorkerSettings settings, JobFailureListener failureListener) {
        this.handler = handler;
        this.jobStore = jobStore;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.failureListener = failureListener;
    }

    public JobType jobType() {
        return handler.jobType();
    }

    @Override
    public void run() {
        running = true;
        log.infof("Worker started for %s", jobType().wireName());
        while (running && !Thread.currentThread().isInterrupted()) {
            if (!iterate()) {
                break;
            }
        }
        running = false;
        log.infof("Worker stopped for %s", jobType().wireName());
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One turn of the loop. Returns false once the thread has been interrupted.
     */
    boolean iterate() {
        try {
            pollOnce();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.errorf(e, "Error in %s worker loop", jobType().wireName());
            try {
                Thread.sleep(settings.errorBackoff().toMillis());
                return true;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /**
     * Dequeues and runs at most one job.
     *
     * @return true if a job was processed
     */
    public boolean pollOnce() throws InterruptedException {
        Optional<Job> next = jobStore.dequeue(jobType(), settings.pollTimeout());
        if (next.isEmpty()) {
            return false;
        }
        process(next.get());
        return true;
    }

    void process(Job job) {
        log.infof("Processing job %s (attempt %d)", job.id(), job.attempts());
        jobStore.setStatus(JobStatusUpdate.active(job, 0));
        log.debugf("Job %s → %s", job.id(), JobStatus.ACTIVE.label());

        DefaultJobContext ctx = new DefaultJobContext(job, jobStore, objectMapper);
        Map<String, Object> result;
        try {
            result = handler.handle(job, ctx);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            onFailure(job, e);
            return;
        }

        jobStore.setStatus(JobStatusUpdate.completed(job, serializeResult(job, result)));
        log.debugf("Job %s → %s", job.id(), JobStatus.COMPLETED.label());
        log.infof("Job %s completed successfully", job.id());
    }

    private void onFailure(Job job, Exception e) {
        String error = describe(e);
        log.errorf(e, "Job %s failed on attempt %d: %s", job.id(), job.attempts(), error);
        jobStore.setStatus(JobStatusUpdate.failed(job, error));
        log.debugf("Job %s → %s", job.id(), JobStatus.FAILED.label());

        if (job.attempts() < settings.maxRetries()) {
            Job retry = job.nextAttempt();
            jobStore.requeue(retry, error);
            log.infof("Re-queued job %s (attempt %d of %d retries)",
                    job.id(), retry.attempts(), settings.maxRetries());
        } else {
            log.errorf("Job %s failed permanently after %d attempts", job.id(), job.attempts() + 1);
            failureListener.onTerminalFailure(job, error);
        }
    }

    private String serializeResult(Job job, Map<String, Object> result) {
        if (result == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warnf(e, "Result of job %s is not serializable, storing none", job.id());
            return null;
        }
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
