package com.cvjudge.engine.api.dto;

import com.cvjudge.engine.api.InvalidEvaluationRequestException;
import com.cvjudge.engine.model.EvaluationRequest;

/**
 * Request body for POST /evaluations.
 *
 * Required: cvText, jdText (already extracted plain text)
 * Optional: guidance
 */
public record EvaluateRequest(String cvText, String jdText, String guidance) {

    /** @throws InvalidEvaluationRequestException if a text is missing or blank */
    public EvaluationRequest toModel() {
        try {
            return new EvaluationRequest(cvText, jdText, guidance);
        } catch (IllegalArgumentException e) {
            throw new InvalidEvaluationRequestException(e.getMessage(), e);
        }
    }
}
