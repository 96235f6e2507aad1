package com.cvjudge.engine.config;

import com.cvjudge.engine.client.AnthropicJudgeClient;
import com.cvjudge.engine.client.JudgeClient;
import com.cvjudge.engine.client.JudgeClientRegistry;
import com.cvjudge.engine.client.OpenRouterJudgeClient;
import com.cvjudge.engine.consensus.ConsensusAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires provider adapters and the aggregator from {@link JudgeProperties}.
 *
 * Adapters are built once at startup, one per configured judge, so the
 * orchestrator can stay provider-agnostic: it only ever asks the registry
 * for "the client of judge X".
 */
@Configuration
@EnableConfigurationProperties(JudgeProperties.class)
public class JudgeEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(JudgeEngineConfig.class);

    @Bean
    JudgeClientRegistry judgeClientRegistry(JudgeProperties properties, ObjectMapper objectMapper) {
        // Fail at startup rather than on the first request.
        properties.judgeSpecs();

        Map<String, JudgeClient> clients = new LinkedHashMap<>();
        for (JudgeProperties.JudgeConfig judge : properties.getJudges()) {
            clients.put(judge.getId(), createClient(judge, properties, objectMapper));
            log.info("Judge '{}' is {} via {} (model {}, weight {})", judge.getId(), judge.getName(),
                    judge.getProvider(), judge.getModel(), judge.getWeight());
        }
        return new JudgeClientRegistry(clients);
    }

    @Bean
    ConsensusAggregator consensusAggregator(JudgeProperties properties) {
        return new ConsensusAggregator(properties.recommendationBands());
    }

    static JudgeClient createClient(JudgeProperties.JudgeConfig judge,
                                    JudgeProperties properties,
                                    ObjectMapper objectMapper) {
        JudgeProperties.ProviderConfig provider = switch (judge.getProvider()) {
            case OPENROUTER -> properties.getOpenrouter();
            case ANTHROPIC  -> properties.getAnthropic();
        };
        if (provider.getApiKey() == null || provider.getApiKey().isBlank()) {
            // Not fatal at startup: the judge will fail with 401 and be excluded.
            log.warn("No API key configured for provider {} (judge '{}')",
                    judge.getProvider(), judge.getId());
        }
        return switch (judge.getProvider()) {
            case OPENROUTER -> new OpenRouterJudgeClient(provider.getBaseUrl(), provider.getApiKey(),
                    judge.getModel(), judge.getTemperature(), objectMapper);
            case ANTHROPIC  -> new AnthropicJudgeClient(provider.getBaseUrl(), provider.getApiKey(),
                    judge.getModel(), judge.getTemperature(), objectMapper);
        };
    }
}
