package com.cvjudge.engine.orchestrator;

import com.cvjudge.engine.model.ExcludedJudge;
import com.cvjudge.engine.model.JudgeResult;

import java.util.List;

/**
 * Everything the orchestrator collected: the usable results (never empty)
 * and the judges that dropped out, both in configured judge order.
 */
public record OrchestrationOutcome(List<JudgeResult> perJudge, List<ExcludedJudge> excluded) {

    public OrchestrationOutcome {
        perJudge = List.copyOf(perJudge);
        excluded = List.copyOf(excluded);
    }
}
