package com.libragraph.synthesis.core.job;

/** Told about jobs that failed with no retries left. */
@FunctionalInterface
public interface JobFailureListener {

    void onTerminalFailure(Job job, String error);
}
