package com.libragraph.synthesis.core.store;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

import java.time.Duration;

/** Pairs the pipeline lock with the job store mode: cluster-wide for postgres, local for memory. */
@ApplicationScoped
public class PipelineLockProducer {

    @Produces
    @Singleton
    @IfBuildProperty(name = "synthesis.jobs.store", stringValue = "postgres", enableIfMissing = true)
    PipelineLock advisoryLock(Jdbi jdbi) {
        return new PostgresAdvisoryPipelineLock(jdbi, Duration.ofMillis(200));
    }

    @Produces
    @Singleton
    @IfBuildProperty(name = "synthesis.jobs.store", stringValue = "memory")
    PipelineLock localLock() {
        return new LocalPipelineLock();
    }
}
