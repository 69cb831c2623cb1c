package com.libragraph.synthesis.core.job;

/**
 * The queue or status store is unreachable or rejected an operation.
 * Worker loops treat it as transient: log, back off, continue.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobStoreException(String message) {
        super(message);
    }
}
