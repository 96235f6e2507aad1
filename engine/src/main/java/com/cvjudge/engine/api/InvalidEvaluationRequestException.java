package com.cvjudge.engine.api;

/**
 * The request body cannot be turned into an evaluation (missing or blank
 * text). Mapped to HTTP 400; any other IllegalArgumentException is a
 * server-side fault.
 */
public class InvalidEvaluationRequestException extends RuntimeException {

    public InvalidEvaluationRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
