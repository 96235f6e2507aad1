package com.cvjudge.engine.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationRequestTest {

    @Test
    void blankGuidance_treatedAsAbsent() {
        EvaluationRequest request = new EvaluationRequest("cv", "jd", "   ");

        assertThat(request.guidance()).isNull();
    }

    @Test
    void blankCvOrJd_rejected() {
        assertThatThrownBy(() -> new EvaluationRequest("", "jd"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cvText");
        assertThatThrownBy(() -> new EvaluationRequest("cv", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jdText");
    }
}
