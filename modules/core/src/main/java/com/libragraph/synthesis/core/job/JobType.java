package com.libragraph.synthesis.core.job;

/**
 * Closed set of job types served by the worker substrate. Each type has its own FIFO queue.
 */
public enum JobType {
    CLAIM_EXTRACTION("claim_extraction"),
    DEPENDENCY_INFERENCE("dependency_inference"),
    REPORT_GENERATION("report_generation");

    private final String wireName;

    JobType(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in queue keys, job ids and configuration. */
    public String wireName() {
        return wireName;
    }

    public static JobType fromWireName(String wireName) {
        for (JobType t : values()) {
            if (t.wireName.equals(wireName)) return t;
        }
        throw new IllegalArgumentException("Unknown JobType: " + wireName);
    }
}
