package com.cvjudge.engine.model;

import java.util.List;

/**
 * A validated evaluation produced by one judge.
 *
 * Only ever built from a payload that passed structural validation, so
 * score is guaranteed to lie in 0..100 and every list is non-null.
 */
public record JudgeResult(
        String       judgeId,
        int          score,
        List<String> matchedRequirements,
        List<String> gaps,
        List<String> redFlags,
        List<String> strengths,
        String       rationale,
        int          rawAttempts) {

    public JudgeResult {
        if (judgeId == null || judgeId.isBlank()) {
            throw new IllegalArgumentException("judgeId must not be blank");
        }
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within 0..100, got " + score);
        }
        matchedRequirements = matchedRequirements == null ? List.of() : List.copyOf(matchedRequirements);
        gaps                = gaps == null                ? List.of() : List.copyOf(gaps);
        redFlags            = redFlags == null            ? List.of() : List.copyOf(redFlags);
        strengths           = strengths == null           ? List.of() : List.copyOf(strengths);
        rationale           = rationale == null ? "" : rationale;
    }

    /** Copy of this result stamped with the number of attempts it took. */
    public JudgeResult withAttempts(int attempts) {
        return new JudgeResult(judgeId, score, matchedRequirements, gaps,
                redFlags, strengths, rationale, attempts);
    }
}
