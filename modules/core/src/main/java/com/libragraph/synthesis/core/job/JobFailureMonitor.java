package com.libragraph.synthesis.core.job;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Operator-facing sink for terminal job failures: logs each one at ERROR and keeps
 * per-type counts.
 */
@ApplicationScoped
public class JobFailureMonitor {

    private static final Logger log = Logger.getLogger(JobFailureMonitor.class);

    private final Map<JobType, AtomicLong> failures = new EnumMap<>(JobType.class);

    public JobFailureMonitor() {
        for (JobType type : JobType.values()) {
            failures.put(type, new AtomicLong());
        }
    }

    void onJobFailed(@Observes JobFailedEvent event) {
        long total = failures.get(event.type()).incrementAndGet();
        log.errorf("Job %s (type=%s) permanently failed after %d attempts: %s [%d terminal failures for type]",
                event.jobId(), event.type().wireName(), event.attempts(), event.error(), total);
    }

    public long terminalFailures(JobType type) {
        return failures.get(type).get();
    }
}
