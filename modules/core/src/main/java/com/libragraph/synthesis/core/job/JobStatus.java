package com.libragraph.synthesis.core.job;

public enum JobStatus {
    QUEUED(0, "queued"),
    ACTIVE(1, "active"),
    COMPLETED(2, "completed"),
    FAILED(3, "failed");

    private final int id;
    private final String label;

    JobStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static JobStatus fromId(int id) {
        for (JobStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown JobStatus id: " + id);
    }
}
