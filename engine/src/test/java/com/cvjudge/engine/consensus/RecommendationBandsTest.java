package com.cvjudge.engine.consensus;

import com.cvjudge.engine.consensus.RecommendationBands.Band;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecommendationBandsTest {

    private final RecommendationBands bands = RecommendationBands.defaults();

    @ParameterizedTest
    @CsvSource({
            "0,     Not Recommended",
            "49.9,  Not Recommended",
            "50,    Consider",
            "69.9,  Consider",
            "70,    Recommend",
            "84.9,  Recommend",
            "85,    Strong Recommend",
            "100,   Strong Recommend"
    })
    void labelFor_defaultBands_lowerBoundInclusive(double score, String expected) {
        assertThat(bands.labelFor(score)).isEqualTo(expected);
    }

    @Test
    void labelFor_outsideRange_throws() {
        assertThatThrownBy(() -> bands.labelFor(100.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bands.labelFor(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_firstBandNotAtZero_rejected() {
        assertThatThrownBy(() -> new RecommendationBands(List.of(new Band("Maybe", 10))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("start at 0");
    }

    @Test
    void constructor_boundsNotIncreasing_rejected() {
        assertThatThrownBy(() -> new RecommendationBands(List.of(
                new Band("Low", 0), new Band("High", 70), new Band("Mid", 50))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_noBands_rejected() {
        assertThatThrownBy(() -> new RecommendationBands(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
