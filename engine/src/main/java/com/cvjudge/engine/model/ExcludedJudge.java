package com.cvjudge.engine.model;

/**
 * A judge that ended the evaluation without a usable result.
 *
 * @param attempts call attempts made before giving up (0 when the judge
 *                 was cancelled or never reached a provider)
 */
public record ExcludedJudge(String judgeId, String reason, int attempts) {

    public static final String CANCELLED = "cancelled";

    public static ExcludedJudge cancelled(String judgeId) {
        return new ExcludedJudge(judgeId, CANCELLED, 0);
    }

    public boolean wasCancelled() {
        return CANCELLED.equals(reason);
    }
}
