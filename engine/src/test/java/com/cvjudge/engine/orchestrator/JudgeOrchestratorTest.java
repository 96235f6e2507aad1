package com.cvjudge.engine.orchestrator;

import com.cvjudge.engine.client.JudgeClientRegistry;
import com.cvjudge.engine.client.ProviderException.Kind;
import com.cvjudge.engine.client.RawJudgePayload;
import com.cvjudge.engine.model.EvaluationRequest;
import com.cvjudge.engine.model.ExcludedJudge;
import com.cvjudge.engine.model.JudgeResult;
import com.cvjudge.engine.model.JudgeSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.cvjudge.engine.orchestrator.ScriptedJudgeClient.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the fan-out / join over several judges.
 *
 * Judges are scripted in-process clients; backoff is recorded, not slept.
 * Only the deadline and cancellation cases take real wall-clock time.
 */
class JudgeOrchestratorTest {

    private static final EvaluationRequest REQUEST =
            new EvaluationRequest("Python, Kubernetes, 8 years backend", "Senior backend engineer");

    RecordingSleeper    sleeper;
    SimpleMeterRegistry meters;
    JudgePayloadParser  parser;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        meters  = new SimpleMeterRegistry();
        parser  = new JudgePayloadParser(new ObjectMapper());
    }

    private JudgeOrchestrator orchestrator(Map<String, ScriptedJudgeClient> clients) {
        return new JudgeOrchestrator(new JudgeClientRegistry(clients), parser, meters, sleeper);
    }

    private static Map<String, ScriptedJudgeClient> clients(Object... idAndClient) {
        Map<String, ScriptedJudgeClient> map = new LinkedHashMap<>();
        for (int i = 0; i < idAndClient.length; i += 2) {
            map.put((String) idAndClient[i], (ScriptedJudgeClient) idAndClient[i + 1]);
        }
        return map;
    }

    private static JudgeSpec judge(String id, Duration timeout) {
        return new JudgeSpec(id, 1.0, 3, timeout, Duration.ofMillis(10));
    }

    private static List<String> ids(List<JudgeResult> results) {
        return results.stream().map(JudgeResult::judgeId).toList();
    }

    // ------------------------------------------------------------------
    // Collecting results
    // ------------------------------------------------------------------

    @Test
    void evaluate_allJudgesSucceed_resultsInConfiguredOrder() {
        // The first judge answers last; order must still follow configuration.
        JudgeOrchestrator orchestrator = orchestrator(clients(
                "gemini", new ScriptedJudgeClient(delayed(Duration.ofMillis(150), evaluation(88))),
                "kimi",   new ScriptedJudgeClient(evaluation(85)),
                "glm",    new ScriptedJudgeClient(evaluation(89))));

        OrchestrationOutcome outcome = orchestrator.evaluate(REQUEST, List.of(
                JudgeSpec.of("gemini", 0.4), JudgeSpec.of("kimi", 0.3), JudgeSpec.of("glm", 0.3)));

        assertThat(ids(outcome.perJudge())).containsExactly("gemini", "kimi", "glm");
        assertThat(outcome.perJudge()).extracting(JudgeResult::score).containsExactly(88, 85, 89);
        assertThat(outcome.excluded()).isEmpty();
    }

    @Test
    void evaluate_oneJudgeFailsFatally_excludedWhileOthersContribute() {
        JudgeOrchestrator orchestrator = orchestrator(clients(
                "gemini", new ScriptedJudgeClient(evaluation(80)),
                "kimi",   new ScriptedJudgeClient(fail(Kind.FATAL, "OpenRouter API error 403: forbidden")),
                "glm",    new ScriptedJudgeClient(evaluation(70))));

        OrchestrationOutcome outcome = orchestrator.evaluate(REQUEST, List.of(
                JudgeSpec.of("gemini", 1), JudgeSpec.of("kimi", 1), JudgeSpec.of("glm", 1)));

        assertThat(ids(outcome.perJudge())).containsExactly("gemini", "glm");
        assertThat(outcome.excluded()).singleElement().satisfies(e -> {
            assertThat(e.judgeId()).isEqualTo("kimi");
            assertThat(e.reason()).contains("403");
            assertThat(e.attempts()).isEqualTo(1);
        });
    }

    @Test
    void evaluate_transientFailuresOnOneJudge_retriesWithoutAffectingOthers() {
        ScriptedJudgeClient flaky = new ScriptedJudgeClient(
                fail(Kind.TRANSIENT, "429"), fail(Kind.TRANSIENT, "429"), evaluation(74));
        ScriptedJudgeClient steady = new ScriptedJudgeClient(evaluation(79));

        OrchestrationOutcome outcome = orchestrator(clients("flaky", flaky, "steady", steady))
                .evaluate(REQUEST, List.of(judge("flaky", Duration.ofSeconds(5)), judge("steady", Duration.ofSeconds(5))));

        assertThat(outcome.perJudge()).extracting(JudgeResult::rawAttempts).containsExactly(3, 1);
        assertThat(steady.calls()).isEqualTo(1);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }

    @Test
    void evaluate_judgeWithoutClient_excludedWithZeroAttempts() {
        OrchestrationOutcome outcome = orchestrator(clients("gemini", new ScriptedJudgeClient(evaluation(80))))
                .evaluate(REQUEST, List.of(JudgeSpec.of("gemini", 1), JudgeSpec.of("mistral", 1)));

        assertThat(ids(outcome.perJudge())).containsExactly("gemini");
        assertThat(outcome.excluded()).containsExactly(
                new ExcludedJudge("mistral", "no client registered for judge", 0));
    }

    @Test
    void evaluate_judgesRunConcurrently() {
        // Each call waits for the other judge's call to start; a sequential
        // orchestrator would make both fail.
        CountDownLatch bothStarted = new CountDownLatch(2);
        Step rendezvous = () -> {
            bothStarted.countDown();
            if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                return new RawJudgePayload("never met the other judge");
            }
            return new RawJudgePayload(evaluationJson(81, "Python"));
        };
        JudgeSpec oneShot = new JudgeSpec("a", 1.0, 1, Duration.ofSeconds(10), Duration.ZERO);

        OrchestrationOutcome outcome = orchestrator(clients(
                "a", new ScriptedJudgeClient(rendezvous, evaluation(0)),
                "b", new ScriptedJudgeClient(rendezvous, evaluation(0))))
                .evaluate(REQUEST, List.of(oneShot,
                        new JudgeSpec("b", 1.0, 1, Duration.ofSeconds(10), Duration.ZERO)));

        assertThat(outcome.perJudge()).extracting(JudgeResult::score).containsExactly(81, 81);
    }

    @Test
    void evaluate_recordsDurationPerJudge() {
        orchestrator(clients(
                "gemini", new ScriptedJudgeClient(evaluation(80)),
                "kimi",   new ScriptedJudgeClient(fail(Kind.FATAL, "401"))))
                .evaluate(REQUEST, List.of(JudgeSpec.of("gemini", 1), JudgeSpec.of("kimi", 1)));

        assertThat(meters.timer("cvjudge.judge.duration", "judge", "gemini", "status", "success").count())
                .isEqualTo(1);
        assertThat(meters.timer("cvjudge.judge.duration", "judge", "kimi", "status", "failed").count())
                .isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Total failure
    // ------------------------------------------------------------------

    @Test
    void evaluate_everyJudgeFails_throwsWithAllExclusions() {
        JudgeOrchestrator orchestrator = orchestrator(clients(
                "gemini", new ScriptedJudgeClient(fail(Kind.FATAL, "401 bad key")),
                "kimi",   new ScriptedJudgeClient(fail(Kind.TRANSIENT, "503"))));

        assertThatThrownBy(() -> orchestrator.evaluate(REQUEST, List.of(
                judge("gemini", Duration.ofSeconds(5)), judge("kimi", Duration.ofSeconds(5)))))
                .isInstanceOf(OrchestrationFailedException.class)
                .hasMessageContaining("gemini ([FATAL] 401 bad key)")
                .satisfies(e -> assertThat(((OrchestrationFailedException) e).getExcludedJudges())
                        .extracting(ExcludedJudge::judgeId)
                        .containsExactly("gemini", "kimi"));
    }

    // ------------------------------------------------------------------
    // Deadline and cancellation
    // ------------------------------------------------------------------

    @Test
    void evaluate_deadlinePasses_hangingJudgeCancelledOthersKept() {
        ScriptedJudgeClient stuck = new ScriptedJudgeClient(hang());

        OrchestrationOutcome outcome = orchestrator(clients(
                "gemini", new ScriptedJudgeClient(evaluation(80)),
                "kimi",   stuck))
                .evaluate(REQUEST,
                        List.of(judge("gemini", Duration.ofSeconds(30)), judge("kimi", Duration.ofSeconds(30))),
                        Duration.ofMillis(300));

        assertThat(ids(outcome.perJudge())).containsExactly("gemini");
        assertThat(outcome.excluded()).containsExactly(ExcludedJudge.cancelled("kimi"));
        assertThat(stuck.calls()).isEqualTo(1);
    }

    @Test
    void evaluate_deadlinePassesWithNoResults_throwsWithCancelledJudges() {
        JudgeOrchestrator orchestrator = orchestrator(clients(
                "gemini", new ScriptedJudgeClient(hang()),
                "kimi",   new ScriptedJudgeClient(hang())));

        assertThatThrownBy(() -> orchestrator.evaluate(REQUEST,
                List.of(judge("gemini", Duration.ofSeconds(30)), judge("kimi", Duration.ofSeconds(30))),
                Duration.ofMillis(200)))
                .isInstanceOf(OrchestrationFailedException.class)
                .satisfies(e -> assertThat(((OrchestrationFailedException) e).getExcludedJudges())
                        .allMatch(ExcludedJudge::wasCancelled)
                        .hasSize(2));
    }

    @Test
    void evaluate_callerInterrupted_unfinishedJudgesCancelled() throws Exception {
        CountDownLatch fastDone = new CountDownLatch(1);
        Step fast = () -> {
            fastDone.countDown();
            return new RawJudgePayload(evaluationJson(77));
        };
        JudgeOrchestrator orchestrator = orchestrator(clients(
                "gemini", new ScriptedJudgeClient(fast),
                "kimi",   new ScriptedJudgeClient(hang())));

        AtomicReference<OrchestrationOutcome> outcome = new AtomicReference<>();
        AtomicReference<Boolean> interruptFlag = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            outcome.set(orchestrator.evaluate(REQUEST, List.of(
                    judge("gemini", Duration.ofSeconds(30)), judge("kimi", Duration.ofSeconds(30)))));
            interruptFlag.set(Thread.interrupted());
        });
        caller.start();

        assertThat(fastDone.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(200);
        caller.interrupt();
        caller.join(5_000);

        assertThat(caller.isAlive()).isFalse();
        assertThat(ids(outcome.get().perJudge())).containsExactly("gemini");
        assertThat(outcome.get().excluded()).containsExactly(ExcludedJudge.cancelled("kimi"));
        assertThat(interruptFlag.get()).isTrue();
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    @Test
    void evaluate_noJudges_rejected() {
        assertThatThrownBy(() -> orchestrator(clients()).evaluate(REQUEST, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void evaluate_duplicateJudgeIds_rejected() {
        assertThatThrownBy(() -> orchestrator(clients()).evaluate(REQUEST,
                List.of(JudgeSpec.of("gemini", 1), JudgeSpec.of("gemini", 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    void evaluate_allWeightsZero_rejected() {
        assertThatThrownBy(() -> orchestrator(clients()).evaluate(REQUEST,
                List.of(JudgeSpec.of("gemini", 0), JudgeSpec.of("kimi", 0))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive weight");
    }
}
