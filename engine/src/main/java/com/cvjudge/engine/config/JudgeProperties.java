package com.cvjudge.engine.config;

import com.cvjudge.engine.consensus.ConsensusAggregator;
import com.cvjudge.engine.consensus.RecommendationBands;
import com.cvjudge.engine.model.JudgeSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the engine reads from {@code application.yml} under {@code cvjudge.*}.
 *
 * The judge list is ordered: that order is the order judges appear in a
 * report. API keys are normally supplied through environment variables
 * (see application.yml).
 */
@ConfigurationProperties(prefix = "cvjudge")
public class JudgeProperties {

    public enum Provider { OPENROUTER, ANTHROPIC }

    private double discordanceThreshold = ConsensusAggregator.DEFAULT_DISCORDANCE_THRESHOLD;
    private Duration deadline = Duration.ofMinutes(3);
    private List<BandConfig> bands = new ArrayList<>();
    private List<JudgeConfig> judges = new ArrayList<>();
    private ProviderConfig openrouter = new ProviderConfig("https://openrouter.ai/api/v1");
    private ProviderConfig anthropic  = new ProviderConfig("https://api.anthropic.com");

    // ------------------------------------------------------------------
    // Nested config types
    // ------------------------------------------------------------------

    public static class ProviderConfig {
        private String apiKey;
        private String baseUrl;

        public ProviderConfig() {}

        public ProviderConfig(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    public static class BandConfig {
        private String label;
        private double lowerBound;

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
        public double getLowerBound() { return lowerBound; }
        public void setLowerBound(double lowerBound) { this.lowerBound = lowerBound; }
    }

    public static class JudgeConfig {
        private String id;
        private String name;
        private Provider provider = Provider.OPENROUTER;
        private String model;
        private double weight = 1.0;
        private int maxAttempts = 3;
        private Duration timeout = Duration.ofSeconds(60);
        private Duration baseBackoff = Duration.ofSeconds(1);
        private double temperature = 0.3;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name != null ? name : id; }
        public void setName(String name) { this.name = name; }
        public Provider getProvider() { return provider; }
        public void setProvider(Provider provider) { this.provider = provider; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getBaseBackoff() { return baseBackoff; }
        public void setBaseBackoff(Duration baseBackoff) { this.baseBackoff = baseBackoff; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public JudgeSpec toSpec() {
            return new JudgeSpec(id, weight, maxAttempts, timeout, baseBackoff);
        }
    }

    // ------------------------------------------------------------------
    // Derived views
    // ------------------------------------------------------------------

    /**
     * Judge specs in configured order.
     *
     * @throws IllegalStateException if no judge is configured, ids repeat,
     *                               or no judge has a positive weight
     */
    public List<JudgeSpec> judgeSpecs() {
        if (judges.isEmpty()) {
            throw new IllegalStateException("cvjudge.judges: at least one judge must be configured");
        }
        Set<String> ids = new HashSet<>();
        List<JudgeSpec> specs = new ArrayList<>(judges.size());
        for (JudgeConfig judge : judges) {
            JudgeSpec spec;
            try {
                spec = judge.toSpec();
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("cvjudge.judges: " + e.getMessage(), e);
            }
            if (!ids.add(spec.id())) {
                throw new IllegalStateException("cvjudge.judges: duplicate judge id '" + spec.id() + "'");
            }
            specs.add(spec);
        }
        if (specs.stream().noneMatch(s -> s.weight() > 0)) {
            throw new IllegalStateException("cvjudge.judges: at least one judge needs a positive weight");
        }
        return specs;
    }

    /** Configured bands, or the defaults when none are configured. */
    public RecommendationBands recommendationBands() {
        if (bands.isEmpty()) {
            return RecommendationBands.defaults();
        }
        return new RecommendationBands(bands.stream()
                .map(b -> new RecommendationBands.Band(b.getLabel(), b.getLowerBound()))
                .toList());
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public double getDiscordanceThreshold() { return discordanceThreshold; }
    public void setDiscordanceThreshold(double discordanceThreshold) {
        if (Double.isNaN(discordanceThreshold) || discordanceThreshold < 0) {
            throw new IllegalArgumentException(
                    "cvjudge.discordance-threshold must not be negative, got " + discordanceThreshold);
        }
        this.discordanceThreshold = discordanceThreshold;
    }
    public Duration getDeadline() { return deadline; }
    public void setDeadline(Duration deadline) { this.deadline = deadline; }
    public List<BandConfig> getBands() { return bands; }
    public void setBands(List<BandConfig> bands) { this.bands = bands; }
    public List<JudgeConfig> getJudges() { return judges; }
    public void setJudges(List<JudgeConfig> judges) { this.judges = judges; }
    public ProviderConfig getOpenrouter() { return openrouter; }
    public void setOpenrouter(ProviderConfig openrouter) { this.openrouter = openrouter; }
    public ProviderConfig getAnthropic() { return anthropic; }
    public void setAnthropic(ProviderConfig anthropic) { this.anthropic = anthropic; }
}
