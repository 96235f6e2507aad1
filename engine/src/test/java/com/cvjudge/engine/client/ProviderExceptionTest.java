package com.cvjudge.engine.client;

import com.cvjudge.engine.client.ProviderException.Kind;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderExceptionTest {

    @ParameterizedTest
    @CsvSource({
            "408, TRANSIENT",
            "429, TRANSIENT",
            "500, TRANSIENT",
            "502, TRANSIENT",
            "503, TRANSIENT",
            "400, FATAL",
            "401, FATAL",
            "403, FATAL",
            "404, FATAL"
    })
    void fromStatus_classifiesByStatus(int status, Kind expected) {
        assertThat(ProviderException.fromStatus("OpenRouter", status, "{}").getKind()).isEqualTo(expected);
    }

    @Test
    void fromStatus_longBody_abbreviatedInMessage() {
        String body = "x".repeat(1_000);

        ProviderException e = ProviderException.fromStatus("Anthropic", 500, body);

        assertThat(e.getMessage())
                .startsWith("[TRANSIENT] Anthropic API error 500: ")
                .endsWith("...")
                .hasSizeLessThan(400);
    }

    @Test
    void fromStatus_nullBody_tolerated() {
        assertThat(ProviderException.fromStatus("OpenRouter", 401, null).getMessage())
                .isEqualTo("[FATAL] OpenRouter API error 401: ");
    }
}
