package com.cvjudge.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final verdict of one ensemble evaluation.
 *
 * Immutable: every collection is copied on construction. Two reports built
 * from the same inputs compare equal, which the aggregator relies on for
 * its idempotence guarantee.
 *
 * @param weightedScore       renormalised weighted mean of contributing scores, one decimal
 * @param recommendation      label of the band weightedScore falls into
 * @param consensusHighlights requirements named by at least half of the contributing judges
 * @param sharedConcerns      red flags named by at least half of the contributing judges
 * @param uniqueFindings      per judge, requirements no other contributing judge named
 * @param agreement           verdict shared by every judge when their scores lie within
 *                            10 points of each other, null otherwise
 * @param discordant          true when max - min score exceeds the threshold
 * @param discordanceNotes    every judge pair whose gap exceeds the threshold
 * @param perJudge            contributing results, in configured judge order
 * @param excludedJudges      judges that failed or were cancelled, with reasons
 * @param summary             one-line human-readable verdict
 */
public record ConsensusReport(
        double                    weightedScore,
        String                    recommendation,
        List<String>              consensusHighlights,
        List<String>              sharedConcerns,
        Map<String, List<String>> uniqueFindings,
        String                    agreement,
        boolean                   discordant,
        List<DiscordanceNote>     discordanceNotes,
        List<JudgeResult>         perJudge,
        List<ExcludedJudge>       excludedJudges,
        String                    summary) {

    public ConsensusReport {
        if (perJudge == null || perJudge.isEmpty()) {
            throw new IllegalArgumentException("a consensus report needs at least one judge result");
        }
        consensusHighlights = List.copyOf(consensusHighlights);
        sharedConcerns      = List.copyOf(sharedConcerns);
        discordanceNotes    = List.copyOf(discordanceNotes);
        perJudge            = List.copyOf(perJudge);
        excludedJudges      = excludedJudges == null ? List.of() : List.copyOf(excludedJudges);

        // Map.copyOf loses iteration order; keep judge order for rendering.
        Map<String, List<String>> findings = new LinkedHashMap<>();
        uniqueFindings.forEach((judge, items) -> findings.put(judge, List.copyOf(items)));
        uniqueFindings = Collections.unmodifiableMap(findings);
    }

    /** Number of judges whose result went into the consensus. */
    public int contributingJudges() {
        return perJudge.size();
    }
}
