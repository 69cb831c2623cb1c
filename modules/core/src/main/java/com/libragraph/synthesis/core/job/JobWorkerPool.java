package com.libragraph.synthesis.core.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.synthesis.core.db.DatabaseService;
import com.libragraph.synthesis.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Runs {@code workers-per-type} {@link JobWorker} loops on platform threads for every configured
 * job type that has a registered handler.
 */
@ApplicationScoped
@Startup
public class JobWorkerPool extends AbstractManagedService {

    @Inject
    DatabaseService databaseService;

    @Inject
    JobStore jobStore;

    @Inject
    JobHandlerRegistry handlerRegistry;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Event<JobFailedEvent> jobFailedEvent;

    @ConfigProperty(name = "synthesis.jobs.worker-types", defaultValue = "dependency_inference,claim_extraction")
    List<String> workerTypes;

    @ConfigProperty(name = "synthesis.jobs.workers-per-type", defaultValue = "1")
    int workersPerType;

    @ConfigProperty(name = "synthesis.jobs.poll-timeout-seconds", defaultValue = "5")
    int pollTimeoutSeconds;

    @ConfigProperty(name = "synthesis.jobs.error-backoff-ms", defaultValue = "1000")
    long errorBackoffMs;

    @ConfigProperty(name = "synthesis.jobs.max-retries", defaultValue = "3")
    int maxRetries;

    private final List<JobWorker> workers = Collections.synchronizedList(new ArrayList<>());
    private final List<Thread> threads = Collections.synchronizedList(new ArrayList<>());

    @Override
    public String serviceId() {
        return "job-worker-pool";
    }

    @Override
    protected void doStart() {
        if (!databaseService.isRunning()) {
            throw new IllegalStateException("Database is not running");
        }

        WorkerSettings settings = new WorkerSettings(
                Duration.ofSeconds(pollTimeoutSeconds), Duration.ofMillis(errorBackoffMs), maxRetries);

        for (String wireName : workerTypes) {
            JobType type = JobType.fromWireName(wireName.trim());
            Optional<JobHandler> handler = handlerRegistry.lookup(type);
            if (handler.isEmpty()) {
                log.warnf("No handler for job type '%s', not serving it", type.wireName());
                continue;
            }
            for (int i = 0; i < workersPerType; i++) {
                JobWorker worker = new JobWorker(handler.get(), jobStore, objectMapper, settings,
                        this::onTerminalFailure);
                Thread thread = new Thread(worker, "job-worker-" + type.wireName() + "-" + i);
                thread.setDaemon(true);
                workers.add(worker);
                threads.add(thread);
                thread.start();
            }
        }

        log.infof("JobWorkerPool started with %d workers (%d per type, max retries %d)",
                workers.size(), workersPerType, maxRetries);
    }

    @Override
    protected void doStop() throws InterruptedException {
        for (JobWorker worker : workers) {
            worker.stop();
        }
        for (Thread thread : threads) {
            thread.interrupt();
        }
        for (Thread thread : threads) {
            thread.join(Duration.ofSeconds(pollTimeoutSeconds + 1).toMillis());
        }
        workers.clear();
        threads.clear();
        log.info("JobWorkerPool stopped");
    }

    private void onTerminalFailure(Job job, String error) {
        jobFailedEvent.fire(new JobFailedEvent(job.id(), job.type(), job.attempts() + 1, error, Instant.now()));
    }

    public int workerCount() {
        return workers.size();
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("JobWorkerPool failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping JobWorkerPool", e);
        }
    }
}
