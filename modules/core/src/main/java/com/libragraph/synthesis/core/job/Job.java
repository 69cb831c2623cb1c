package com.libragraph.synthesis.core.job;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical unit of queued work. The id is stable across retries; {@code attempts} counts
 * how many times the job has been re-enqueued after a failure.
 */
public record Job(
        String id,
        JobType type,
        Map<String, Object> payload,
        int attempts,
        Instant createdAt
) {
    public Job {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload == null ? Map.of() : payload));
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0: " + attempts);
        }
    }

    /** The same job with its attempt counter advanced by one. */
    public Job nextAttempt() {
        return new Job(id, type, payload, attempts + 1, createdAt);
    }
}
