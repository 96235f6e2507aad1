package com.cvjudge.engine.service;

import com.cvjudge.engine.config.JudgeProperties;
import com.cvjudge.engine.consensus.ConsensusAggregator;
import com.cvjudge.engine.model.ConsensusReport;
import com.cvjudge.engine.model.EvaluationRequest;
import com.cvjudge.engine.model.JudgeSpec;
import com.cvjudge.engine.orchestrator.JudgeOrchestrator;
import com.cvjudge.engine.orchestrator.OrchestrationFailedException;
import com.cvjudge.engine.orchestrator.OrchestrationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for callers: one request in, one consensus report out.
 *
 * Reads the judge line-up and thresholds from configuration, runs the
 * orchestrator, and hands whatever it collected to the aggregator.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final JudgeOrchestrator   orchestrator;
    private final ConsensusAggregator aggregator;
    private final JudgeProperties     properties;

    public EvaluationService(JudgeOrchestrator orchestrator,
                             ConsensusAggregator aggregator,
                             JudgeProperties properties) {
        this.orchestrator = orchestrator;
        this.aggregator   = aggregator;
        this.properties   = properties;
    }

    /**
     * @throws OrchestrationFailedException if every judge failed or was cancelled
     */
    public ConsensusReport evaluate(EvaluationRequest request) {
        List<JudgeSpec> judges = properties.judgeSpecs();

        OrchestrationOutcome outcome = orchestrator.evaluate(request, judges, properties.getDeadline());

        ConsensusReport report = aggregator.aggregate(
                outcome.perJudge(),
                judges,
                properties.getDiscordanceThreshold(),
                outcome.excluded());

        log.info("Consensus {} ({}) from {}/{} judges{}",
                report.weightedScore(), report.recommendation(),
                report.contributingJudges(), judges.size(),
                report.discordant() ? ", DISCORDANT" : "");
        report.discordanceNotes().forEach(note -> log.warn("Discordant judges: {}", note.describe()));
        return report;
    }
}
