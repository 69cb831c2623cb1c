package com.libragraph.synthesis.core.job;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Table of {@link JobHandler}s keyed by {@link JobType}, built once from every handler bean.
 * A second handler for the same type is a deployment error.
 */
@ApplicationScoped
public class JobHandlerRegistry {

    private static final Logger log = Logger.getLogger(JobHandlerRegistry.class);

    private final Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);

    @Inject
    public JobHandlerRegistry(Instance<JobHandler> handlers) {
        this((Iterable<JobHandler>) handlers);
    }

    public JobHandlerRegistry(Iterable<? extends JobHandler> handlers) {
        for (JobHandler handler : handlers) {
            JobType type = handler.jobType();
            JobHandler existing = registry.put(type, handler);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate handler for job type '" + type.wireName() + "': " +
                                existing.getClass().getName() + " and " + handler.getClass().getName());
            }
            log.infof("Registered job handler: %s → %s", type.wireName(), handler.getClass().getSimpleName());
        }
        log.infof("JobHandlerRegistry initialized with %d job types", registry.size());
    }

    public Optional<JobHandler> lookup(JobType type) {
        return Optional.ofNullable(registry.get(type));
    }

    public JobHandler require(JobType type) {
        return lookup(type).orElseThrow(() -> new IllegalStateException(
                "No handler registered for job type: " + type.wireName()));
    }

    public Set<JobType> types() {
        return Collections.unmodifiableSet(registry.keySet());
    }
}
