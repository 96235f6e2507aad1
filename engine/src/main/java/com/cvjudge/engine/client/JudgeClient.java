package com.cvjudge.engine.client;

import java.time.Duration;

/**
 * The capability every evaluation provider adapter implements.
 *
 * <p>An adapter owns everything provider-specific: authentication, request
 * shape, model selection, response envelope. It hands back the judge's
 * answer as unvalidated text; the orchestrator decides whether that text is
 * a usable evaluation.
 *
 * <p>Adapters must be safe to call from several threads at once, since one
 * adapter instance may serve overlapping evaluations.
 */
public interface JudgeClient {

    /**
     * Ask the provider to evaluate the CV against the job description.
     *
     * @param guidance optional extra instruction, may be null
     * @param timeout  wall-clock budget for this call; the orchestrator also
     *                 enforces it, adapters should pass it to their transport
     * @return the raw answer text
     * @throws ProviderException classified as TRANSIENT, MALFORMED or FATAL
     */
    RawJudgePayload call(String cvText, String jdText, String guidance, Duration timeout)
            throws ProviderException;
}
