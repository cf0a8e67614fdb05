package com.gpufleet.governor.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Spaces provider calls made with the same credential at least {@code minInterval} apart.
 * <p>
 * Each caller reserves the next free slot for its credential atomically, then sleeps without
 * holding any lock, so a back-off on one credential never delays another.
 */
@Component
public class CredentialRateLimiter {

    private final Clock clock;
    private final Duration minInterval;
    private final ConcurrentMap<String, Instant> reserved = new ConcurrentHashMap<>();

    @Autowired
    public CredentialRateLimiter(Clock clock) {
        this(clock, Duration.ofSeconds(1));
    }

    public CredentialRateLimiter(Clock clock, Duration minInterval) {
        this.clock = clock;
        this.minInterval = minInterval;
    }

    /**
     * Blocks until a call with {@code credential} is allowed, then records it.
     *
     * @return how long the caller was held back
     */
    public Duration acquire(String credential) throws InterruptedException {
        Instant now = clock.instant();
        Instant slot = reserved.compute(credential, (key, last) -> {
            if (last == null) return now;
            Instant next = last.plus(minInterval);
            return next.isAfter(now) ? next : now;
        });
        Duration waited = Duration.between(now, slot);
        if (!waited.isZero()) {
            pause(waited);
        }
        return waited;
    }

    protected void pause(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }
}
