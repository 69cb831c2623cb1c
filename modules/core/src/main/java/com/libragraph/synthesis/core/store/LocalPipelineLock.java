package com.libragraph.synthesis.core.store;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/** JVM-local {@link PipelineLock}; only excludes workers of the same process. */
public class LocalPipelineLock implements PipelineLock {

    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T withLock(UUID pipelineId, Callable<T> work) throws Exception {
        ReentrantLock lock = locks.computeIfAbsent(pipelineId, id -> new ReentrantLock());
        lock.lockInterruptibly();
        try {
            return work.call();
        } finally {
            lock.unlock();
        }
    }
}
