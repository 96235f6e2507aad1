package com.cvjudge.engine.orchestrator;

import java.time.Duration;

/**
 * Waits out a retry backoff. Swapped for a recording fake in tests so
 * backoff timing can be asserted without real delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            if (!duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
