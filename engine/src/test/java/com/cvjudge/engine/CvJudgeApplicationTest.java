package com.cvjudge.engine;

import com.cvjudge.engine.client.JudgeClientRegistry;
import com.cvjudge.engine.config.JudgeProperties;
import com.cvjudge.engine.service.EvaluationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context from application.yml. No judge is called: the
 * context only builds adapters, it never sends a request.
 */
@SpringBootTest
class CvJudgeApplicationTest {

    @Autowired JudgeClientRegistry registry;
    @Autowired JudgeProperties     properties;
    @Autowired EvaluationService   evaluationService;

    @Test
    void contextLoads_withConfiguredJudges() {
        assertThat(evaluationService).isNotNull();
        assertThat(registry.judgeIds()).containsExactly("gemini", "kimi", "glm");
        assertThat(properties.getDeadline()).isEqualTo(Duration.ofMinutes(3));
        assertThat(properties.judgeSpecs()).extracting(s -> s.weight()).containsExactly(0.35, 0.35, 0.30);
    }
}
