package com.libragraph.synthesis.core.job;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Drops expired status records and reports jobs stuck in {@code active}. Stuck jobs are not
 * requeued: an in-flight attempt may still be running on another node.
 */
@ApplicationScoped
public class StaleJobSweep {

    private static final Logger log = Logger.getLogger(StaleJobSweep.class);

    @Inject
    JobStore jobStore;

    @ConfigProperty(name = "synthesis.jobs.stuck-after-minutes", defaultValue = "30")
    int stuckAfterMinutes;

    @Scheduled(every = "60s", concurrentExecution = SKIP)
    public void sweep() {
        purgeExpired();
        reportStuck(Instant.now());
    }

    int purgeExpired() {
        int purged = jobStore.purgeExpiredStatuses();
        if (purged > 0) {
            log.debugf("Purged %d expired job status records", purged);
        }
        return purged;
    }

    List<JobStatusRecord> reportStuck(Instant now) {
        Instant cutoff = now.minus(Duration.ofMinutes(stuckAfterMinutes));
        List<JobStatusRecord> stuck = jobStore.findActiveNotUpdatedSince(cutoff);
        for (JobStatusRecord record : stuck) {
            log.warnf("Job %s (type=%s) active without progress since %s (progress %d%%, attempt %d)",
                    record.jobId(), record.jobType().wireName(), record.updatedAt(),
                    record.progress(), record.attempts());
        }
        return stuck;
    }
}
