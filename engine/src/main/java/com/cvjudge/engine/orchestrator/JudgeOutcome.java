package com.cvjudge.engine.orchestrator;

import com.cvjudge.engine.model.ExcludedJudge;
import com.cvjudge.engine.model.JudgeResult;

/**
 * How one judge's participation ended: exactly one of result / exclusion is set.
 */
public record JudgeOutcome(String judgeId, JudgeResult result, ExcludedJudge exclusion) {

    public static JudgeOutcome success(JudgeResult result) {
        return new JudgeOutcome(result.judgeId(), result, null);
    }

    public static JudgeOutcome excluded(ExcludedJudge exclusion) {
        return new JudgeOutcome(exclusion.judgeId(), null, exclusion);
    }

    public boolean succeeded() {
        return result != null;
    }
}
