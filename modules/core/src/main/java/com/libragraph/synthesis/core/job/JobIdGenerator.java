package com.libragraph.synthesis.core.job;

import jakarta.enterprise.context.ApplicationScoped;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mints job ids of the form {@code <type>:<epochMicros>-<node>}. The timestamp part never
 * repeats or goes backwards within one generator; the node tag separates processes.
 */
@ApplicationScoped
public class JobIdGenerator {

    private final Clock clock;
    private final String nodeTag;
    private final AtomicLong lastMicros = new AtomicLong();

    public JobIdGenerator() {
        this(Clock.systemUTC(), String.format("%04x", new SecureRandom().nextInt(0x10000)));
    }

    public JobIdGenerator(Clock clock, String nodeTag) {
        this.clock = clock;
        this.nodeTag = nodeTag;
    }

    public String next(JobType type) {
        Instant now = clock.instant();
        long micros = now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000;
        long stamp = lastMicros.updateAndGet(prev -> Math.max(prev + 1, micros));
        return type.wireName() + ":" + stamp + "-" + nodeTag;
    }
}
