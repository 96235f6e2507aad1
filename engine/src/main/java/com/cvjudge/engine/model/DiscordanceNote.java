package com.cvjudge.engine.model;

/**
 * Two judges whose scores are further apart than the discordance threshold.
 * The first judge is the one that appears earlier in the result list.
 */
public record DiscordanceNote(
        String firstJudgeId,
        int    firstScore,
        String secondJudgeId,
        int    secondScore,
        int    gap) {

    public String describe() {
        return "%s rated %d, while %s rated %d (gap %d)"
                .formatted(firstJudgeId, firstScore, secondJudgeId, secondScore, gap);
    }
}
