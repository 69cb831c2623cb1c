package com.libragraph.synthesis.core.store;

import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Mutual exclusion per pipeline. Two callers holding the same pipeline id run one after the other.
 */
public interface PipelineLock {

    <T> T withLock(UUID pipelineId, Callable<T> work) throws Exception;
}
