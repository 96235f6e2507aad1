package com.cvjudge.engine.consensus;

import com.cvjudge.engine.model.ConsensusReport;
import com.cvjudge.engine.model.DiscordanceNote;
import com.cvjudge.engine.model.ExcludedJudge;
import com.cvjudge.engine.model.JudgeResult;
import com.cvjudge.engine.model.JudgeSpec;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Reduces the results of the judges that answered into one verdict.
 *
 * Pure and deterministic: no clock, no randomness, no dependence on the
 * order in which judges finished. The same inputs always yield an equal
 * {@link ConsensusReport}.
 */
public class ConsensusAggregator {

    public static final double DEFAULT_DISCORDANCE_THRESHOLD = 25;

    /** Judges whose scores span at most this many points are said to agree. */
    static final int AGREEMENT_RANGE = 10;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RecommendationBands bands;

    public ConsensusAggregator() {
        this(RecommendationBands.defaults());
    }

    public ConsensusAggregator(RecommendationBands bands) {
        this.bands = bands;
    }

    public ConsensusReport aggregate(List<JudgeResult> results,
                                     List<JudgeSpec> specs,
                                     double discordanceThreshold) {
        return aggregate(results, specs, discordanceThreshold, List.of());
    }

    /**
     * @param results              contributing results, in the order to report them
     * @param specs                configuration of every judge (contributing or not)
     * @param discordanceThreshold score gap that must be exceeded to flag disagreement
     * @param excluded             judges that dropped out, passed through unchanged
     * @throws AggregationException     if results is empty or names an unconfigured judge
     * @throws IllegalArgumentException if the threshold is negative
     */
    public ConsensusReport aggregate(List<JudgeResult> results,
                                     List<JudgeSpec> specs,
                                     double discordanceThreshold,
                                     List<ExcludedJudge> excluded) {
        if (results == null || results.isEmpty()) {
            throw new AggregationException("cannot aggregate zero judge results");
        }
        if (Double.isNaN(discordanceThreshold) || discordanceThreshold < 0) {
            throw new IllegalArgumentException(
                    "discordance threshold must not be negative, got " + discordanceThreshold);
        }

        double weightedScore = weightedScore(results, specs);

        List<String> highlights = majorityItems(results, JudgeResult::matchedRequirements);
        List<String> concerns   = majorityItems(results, JudgeResult::redFlags);
        Map<String, List<String>> unique = uniqueFindings(results);
        String agreement = agreement(results);

        List<DiscordanceNote> notes = discordantPairs(results, discordanceThreshold);
        // A lone judge cannot disagree with anyone.
        boolean discordant = results.size() > 1 && scoreRange(results) > discordanceThreshold;

        String recommendation = bands.labelFor(weightedScore);
        String summary = summarise(weightedScore, recommendation, discordant,
                results.size(), results.size() + (excluded == null ? 0 : excluded.size()));

        return new ConsensusReport(
                weightedScore,
                recommendation,
                highlights,
                concerns,
                unique,
                agreement,
                discordant,
                notes,
                results,
                excluded,
                summary
        );
    }

    // ------------------------------------------------------------------
    // Score
    // ------------------------------------------------------------------

    /**
     * Weighted mean over the contributing judges only: weights are divided by
     * their own sum, so an excluded judge neither counts nor distorts the rest.
     * If every contributing judge has weight zero they are weighted equally.
     */
    static double weightedScore(List<JudgeResult> results, List<JudgeSpec> specs) {
        Map<String, Double> weights = new HashMap<>();
        for (JudgeSpec spec : specs) {
            weights.put(spec.id(), spec.weight());
        }

        double total = 0;
        for (JudgeResult result : results) {
            Double weight = weights.get(result.judgeId());
            if (weight == null) {
                throw new AggregationException("no configuration for judge '" + result.judgeId() + "'");
            }
            total += weight;
        }

        double score = 0;
        for (JudgeResult result : results) {
            double normalised = total > 0
                    ? weights.get(result.judgeId()) / total
                    : 1.0 / results.size();
            score += result.score() * normalised;
        }
        return round1(score);
    }

    private static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    // ------------------------------------------------------------------
    // Evidence
    // ------------------------------------------------------------------

    /**
     * Items named by at least half of the contributing judges.
     *
     * Items are compared case-insensitively with whitespace collapsed; each
     * judge counts an item at most once. The spelling reported is the first
     * one seen. Ordered by how many judges named the item, then by first
     * appearance.
     */
    static List<String> majorityItems(List<JudgeResult> results,
                                      Function<JudgeResult, List<String>> field) {
        Map<String, String>  spelling = new LinkedHashMap<>();
        Map<String, Integer> counts   = new HashMap<>();

        for (JudgeResult result : results) {
            for (String key : distinctKeys(field.apply(result), spelling)) {
                counts.merge(key, 1, Integer::sum);
            }
        }

        // sorted() is stable, so equal counts keep first-appearance order
        int judges = results.size();
        return spelling.keySet().stream()
                .filter(key -> 2 * counts.get(key) >= judges)
                .sorted(Comparator.comparingInt((String key) -> counts.get(key)).reversed())
                .map(spelling::get)
                .toList();
    }

    /**
     * Requirements each judge named that no other contributing judge did.
     * Empty with a single judge, since there is nobody to differ from.
     */
    static Map<String, List<String>> uniqueFindings(List<JudgeResult> results) {
        Map<String, List<String>> findings = new LinkedHashMap<>();
        if (results.size() < 2) {
            return findings;
        }

        Map<String, String> spelling = new HashMap<>();
        List<Set<String>> keysPerJudge = results.stream()
                .map(r -> distinctKeys(r.matchedRequirements(), spelling))
                .toList();

        for (int i = 0; i < results.size(); i++) {
            Set<String> others = new LinkedHashSet<>();
            for (int j = 0; j < results.size(); j++) {
                if (j != i) others.addAll(keysPerJudge.get(j));
            }
            List<String> unique = new ArrayList<>();
            for (String key : keysPerJudge.get(i)) {
                if (!others.contains(key)) {
                    unique.add(firstSpelling(results.get(i).matchedRequirements(), key));
                }
            }
            if (!unique.isEmpty()) {
                findings.put(results.get(i).judgeId(), unique);
            }
        }
        return findings;
    }

    /** Normalised keys of one judge's list, deduplicated, in order; records first spellings. */
    private static Set<String> distinctKeys(List<String> items, Map<String, String> spelling) {
        Set<String> keys = new LinkedHashSet<>();
        for (String item : items) {
            String key = normalise(item);
            if (key.isEmpty()) continue;
            spelling.putIfAbsent(key, item.strip());
            keys.add(key);
        }
        return keys;
    }

    private static String firstSpelling(List<String> items, String key) {
        return items.stream()
                .filter(item -> normalise(item).equals(key))
                .map(String::strip)
                .findFirst()
                .orElse(key);
    }

    static String normalise(String item) {
        return WHITESPACE.matcher(item.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Shared verdict when every score lies within {@link #AGREEMENT_RANGE}
     * points: judged on the plain mean of the scores, not the weighted one.
     *
     * @return null when the judges are further apart than that
     */
    static String agreement(List<JudgeResult> results) {
        if (scoreRange(results) > AGREEMENT_RANGE) {
            return null;
        }
        double mean = results.stream().mapToInt(JudgeResult::score).average().orElse(0);
        if (mean >= 80) {
            return "All judges strongly recommend this candidate";
        }
        if (mean <= 40) {
            return "All judges have significant concerns about fit";
        }
        return "All judges agree on a moderate fit";
    }

    // ------------------------------------------------------------------
    // Discordance
    // ------------------------------------------------------------------

    private static int scoreRange(List<JudgeResult> results) {
        int max = results.stream().mapToInt(JudgeResult::score).max().orElse(0);
        int min = results.stream().mapToInt(JudgeResult::score).min().orElse(0);
        return max - min;
    }

    /** Every pair (in result order) whose score gap exceeds the threshold. */
    static List<DiscordanceNote> discordantPairs(List<JudgeResult> results, double threshold) {
        List<DiscordanceNote> notes = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            for (int j = i + 1; j < results.size(); j++) {
                JudgeResult first  = results.get(i);
                JudgeResult second = results.get(j);
                int gap = Math.abs(first.score() - second.score());
                if (gap > threshold) {
                    notes.add(new DiscordanceNote(first.judgeId(), first.score(),
                            second.judgeId(), second.score(), gap));
                }
            }
        }
        return notes;
    }

    // ------------------------------------------------------------------
    // Summary
    // ------------------------------------------------------------------

    private static String summarise(double score, String recommendation, boolean discordant,
                                    int contributing, int configured) {
        String coverage = contributing == configured
                ? contributing + (contributing == 1 ? " judge" : " judges")
                : contributing + " of " + configured + " judges";
        String formatted = String.format(Locale.ROOT, "%.1f", score);

        if (discordant) {
            return "Manual review required: judges disagree significantly. "
                    + "Consensus score " + formatted + " (" + recommendation + ") from " + coverage + ".";
        }
        return recommendation + ": consensus score " + formatted + " from " + coverage + ".";
    }
}
