package com.cvjudge.engine.orchestrator;

/**
 * A judge answered, but the answer is not a structurally valid evaluation
 * (no JSON object, missing or out-of-range score, malformed list field).
 * Triggers the one repair call an attempt is allowed.
 */
public class JudgePayloadException extends RuntimeException {

    public JudgePayloadException(String message) {
        super(message);
    }

    public JudgePayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
