package com.libragraph.synthesis.core.store;

import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * {@link PipelineLock} backed by a PostgreSQL session advisory lock, so it excludes workers on
 * every node sharing the database. The lock lives on one pooled connection held for the duration
 * of the work.
 */
public class PostgresAdvisoryPipelineLock implements PipelineLock {

    private static final Logger log = Logger.getLogger(PostgresAdvisoryPipelineLock.class);

    private final Jdbi jdbi;
    private final Duration retryInterval;

    public PostgresAdvisoryPipelineLock(Jdbi jdbi, Duration retryInterval) {
        this.jdbi = jdbi;
        this.retryInterval = retryInterval;
    }

    static long lockKey(UUID pipelineId) {
        return pipelineId.getMostSignificantBits() ^ pipelineId.getLeastSignificantBits();
    }

    @Override
    public <T> T withLock(UUID pipelineId, Callable<T> work) throws Exception {
        long key = lockKey(pipelineId);
        try (Handle handle = jdbi.open()) {
            acquire(handle, key, pipelineId);
            try {
                return work.call();
            } finally {
                boolean released = handle.createQuery("SELECT pg_advisory_unlock(:key)")
                        .bind("key", key)
                        .mapTo(Boolean.class)
                        .one();
                if (!released) {
                    log.warnf("Advisory lock for pipeline %s was not held at release", pipelineId);
                }
            }
        }
    }

    private void acquire(Handle handle, long key, UUID pipelineId) throws InterruptedException {
        boolean waited = false;
        while (!handle.createQuery("SELECT pg_try_advisory_lock(:key)")
                .bind("key", key)
                .mapTo(Boolean.class)
                .one()) {
            if (!waited) {
                log.infof("Waiting for pipeline lock on %s", pipelineId);
                waited = true;
            }
            Thread.sleep(retryInterval.toMillis());
        }
    }
}
