package com.cvjudge.engine.model;

/**
 * One candidate/role pair to be judged.
 *
 * Created once per evaluation and shared read-only with every judge task.
 * guidance is optional free text (e.g. "focus on leadership experience")
 * forwarded verbatim into every judge's prompt.
 */
public record EvaluationRequest(String cvText, String jdText, String guidance) {

    public EvaluationRequest {
        if (cvText == null || cvText.isBlank()) {
            throw new IllegalArgumentException("cvText must not be blank");
        }
        if (jdText == null || jdText.isBlank()) {
            throw new IllegalArgumentException("jdText must not be blank");
        }
        if (guidance != null && guidance.isBlank()) guidance = null;
    }

    public EvaluationRequest(String cvText, String jdText) {
        this(cvText, jdText, null);
    }
}
