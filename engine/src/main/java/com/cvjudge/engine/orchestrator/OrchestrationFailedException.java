package com.cvjudge.engine.orchestrator;

import com.cvjudge.engine.model.ExcludedJudge;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no judge produced a usable result: every judge failed
 * terminally, exhausted its attempts, or was cancelled.
 *
 * This is the only failure that escapes the orchestrator; partial failures
 * are reported as data on the consensus report instead.
 */
public class OrchestrationFailedException extends RuntimeException {

    private final List<ExcludedJudge> excludedJudges;

    public OrchestrationFailedException(List<ExcludedJudge> excludedJudges) {
        super("All judges failed: " + excludedJudges.stream()
                .map(e -> e.judgeId() + " (" + e.reason() + ")")
                .collect(Collectors.joining(", ")));
        this.excludedJudges = List.copyOf(excludedJudges);
    }

    public List<ExcludedJudge> getExcludedJudges() { return excludedJudges; }
}
