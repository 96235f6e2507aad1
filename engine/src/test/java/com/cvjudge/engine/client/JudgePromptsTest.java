package com.cvjudge.engine.client;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JudgePromptsTest {

    @Test
    void evaluationPrompt_embedsCvJdAndSchema() {
        String prompt = JudgePrompts.evaluationPrompt("CV: 8 years Python", "JD: Senior Python dev", null);

        assertThat(prompt)
                .contains("CV: 8 years Python")
                .contains("JD: Senior Python dev")
                .contains("\"matching_skills\"")
                .contains("\"red_flags\"")
                .doesNotContain("Special Guidance")
                .doesNotContain("{{");
    }

    @Test
    void evaluationPrompt_withGuidance_addsGuidanceSection() {
        String prompt = JudgePrompts.evaluationPrompt("cv", "jd", "Weigh leadership heavily");

        assertThat(prompt).contains("**Special Guidance:** Weigh leadership heavily");
    }

    @Test
    void repairGuidance_withoutGuidance_isJustTheCorrection() {
        String repair = JudgePrompts.repairGuidance(null, "missing score");

        assertThat(repair).startsWith("IMPORTANT: your previous answer could not be used (missing score)");
    }

    @Test
    void repairGuidance_keepsOriginalGuidanceFirst() {
        String repair = JudgePrompts.repairGuidance("Focus on Go", "invalid JSON");

        assertThat(repair)
                .startsWith("Focus on Go\n\n")
                .contains("(invalid JSON)");
    }
}
