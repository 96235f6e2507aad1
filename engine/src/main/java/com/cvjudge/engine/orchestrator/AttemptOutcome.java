package com.cvjudge.engine.orchestrator;

import com.cvjudge.engine.model.JudgeResult;

/**
 * Result of a single call attempt for one judge. Drives the retry state
 * machine in {@link JudgeAttemptLoop} and never leaves this package.
 */
sealed interface AttemptOutcome {

    record Success(JudgeResult result) implements AttemptOutcome {}

    /** Worth another attempt after backoff, if the judge has attempts left. */
    record RetryableFailure(String reason) implements AttemptOutcome {}

    /** Ends the judge's participation immediately. */
    record TerminalFailure(String reason) implements AttemptOutcome {}
}
