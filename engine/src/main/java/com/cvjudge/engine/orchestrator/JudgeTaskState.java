package com.cvjudge.engine.orchestrator;

/**
 * State of one judge's attempt sequence.
 *
 * Transitions:
 *   PENDING    → IN_FLIGHT  (first attempt starts)
 *   IN_FLIGHT  → SUCCEEDED  (valid payload accepted)
 *   IN_FLIGHT  → RETRY_WAIT (retryable failure, attempts left)
 *   IN_FLIGHT  → FAILED     (terminal failure or attempts exhausted)
 *   RETRY_WAIT → IN_FLIGHT  (backoff elapsed, attempt counter incremented)
 */
public enum JudgeTaskState {
    PENDING,
    IN_FLIGHT,
    RETRY_WAIT,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
