package com.libragraph.synthesis.core.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agroal.api.AgroalDataSource;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Duration;

/**
 * Selects the {@link JobStore} at build time from {@code synthesis.jobs.store}:
 * {@code postgres} (default) or {@code memory}.
 */
@ApplicationScoped
public class JobStoreProducer {

    private static final Logger log = Logger.getLogger(JobStoreProducer.class);

    @ConfigProperty(name = "synthesis.jobs.queue-name", defaultValue = "llm_synthesis")
    String queueName;

    @ConfigProperty(name = "synthesis.jobs.status-ttl-hours", defaultValue = "24")
    int statusTtlHours;

    private JobNotificationListener notificationListener;

    @Produces
    @Singleton
    @IfBuildProperty(name = "synthesis.jobs.store", stringValue = "postgres", enableIfMissing = true)
    JobStore postgresJobStore(Jdbi jdbi, ObjectMapper objectMapper, AgroalDataSource dataSource) {
        notificationListener = new JobNotificationListener(dataSource);
        notificationListener.start();
        log.infof("Using PostgreSQL job store (queue=%s, status TTL=%dh)", queueName, statusTtlHours);
        return new PostgresJobStore(jdbi, objectMapper, notificationListener, queueName,
                Duration.ofHours(statusTtlHours), Clock.systemUTC());
    }

    @Produces
    @Singleton
    @IfBuildProperty(name = "synthesis.jobs.store", stringValue = "memory")
    JobStore memoryJobStore() {
        log.infof("Using in-memory job store (status TTL=%dh)", statusTtlHours);
        return new InMemoryJobStore(Clock.systemUTC(), Duration.ofHours(statusTtlHours));
    }

    void close(@Disposes JobStore store) {
        if (notificationListener != null) {
            notificationListener.stop();
        }
    }
}
