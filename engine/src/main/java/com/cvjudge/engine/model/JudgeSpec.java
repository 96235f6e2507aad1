package com.cvjudge.engine.model;

import java.time.Duration;

/**
 * Scheduling and weighting configuration for one judge.
 *
 * @param id          stable identifier, e.g. "gemini"; also the key into the client registry
 * @param weight      relative influence on the consensus score; renormalised over
 *                    the judges that actually contribute a result
 * @param maxAttempts upper bound on call attempts (repair calls do not count)
 * @param timeout     wall-clock limit for a single provider call
 * @param baseBackoff delay after the first retryable failure; doubles after each further one
 */
public record JudgeSpec(
        String   id,
        double   weight,
        int      maxAttempts,
        Duration timeout,
        Duration baseBackoff) {

    public JudgeSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("judge id must not be blank");
        }
        if (Double.isNaN(weight) || weight < 0) {
            throw new IllegalArgumentException("weight of judge '" + id + "' must be non-negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts of judge '" + id + "' must be at least 1");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout of judge '" + id + "' must be positive");
        }
        if (baseBackoff == null || baseBackoff.isNegative()) {
            throw new IllegalArgumentException("baseBackoff of judge '" + id + "' must not be negative");
        }
    }

    /** Convenience factory with three attempts, a 60 s timeout and a 1 s base backoff. */
    public static JudgeSpec of(String id, double weight) {
        return new JudgeSpec(id, weight, 3, Duration.ofSeconds(60), Duration.ofSeconds(1));
    }

    /**
     * Backoff to wait after the given (1-based) attempt failed:
     * {@code baseBackoff * 2^(attempt-1)}.
     */
    public Duration backoffAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based, got " + attempt);
        }
        return baseBackoff.multipliedBy(1L << Math.min(attempt - 1, 30));
    }
}
