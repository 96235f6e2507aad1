package com.cvjudge.engine.orchestrator;

import com.cvjudge.engine.client.JudgeClient;
import com.cvjudge.engine.client.JudgePrompts;
import com.cvjudge.engine.client.ProviderException;
import com.cvjudge.engine.client.RawJudgePayload;
import com.cvjudge.engine.model.EvaluationRequest;
import com.cvjudge.engine.model.ExcludedJudge;
import com.cvjudge.engine.model.JudgeResult;
import com.cvjudge.engine.model.JudgeSpec;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The attempt sequence for one judge, written as an explicit state machine
 * (see {@link JudgeTaskState}).
 *
 * For each attempt:
 *   1. Call the provider on a separate pooled thread and wait at most
 *      spec.timeout() for the answer
 *   2. Validate the answer; if it is malformed, make one repair call with a
 *      corrective instruction (same attempt number)
 *   3. Classify the outcome: success, retryable or terminal
 *   4. On a retryable failure with attempts left, sleep
 *      baseBackoff * 2^(attempt-1) and go again
 *
 * One instance per judge per evaluation; not reusable and not shared
 * between threads. An interrupt (caller cancellation) propagates out of
 * {@link #run()} as InterruptedException.
 */
public class JudgeAttemptLoop {

    private static final Logger log = LoggerFactory.getLogger(JudgeAttemptLoop.class);

    private final JudgeSpec          spec;
    private final JudgeClient        client;
    private final EvaluationRequest  request;
    private final ExecutorService    callExecutor;
    private final JudgePayloadParser parser;
    private final Sleeper            sleeper;
    private final MeterRegistry      meterRegistry;

    private final List<JudgeTaskState> transitions = new ArrayList<>();
    private JudgeTaskState state = JudgeTaskState.PENDING;

    public JudgeAttemptLoop(JudgeSpec spec,
                            JudgeClient client,
                            EvaluationRequest request,
                            ExecutorService callExecutor,
                            JudgePayloadParser parser,
                            Sleeper sleeper,
                            MeterRegistry meterRegistry) {
        this.spec          = spec;
        this.client        = client;
        this.request       = request;
        this.callExecutor  = callExecutor;
        this.parser        = parser;
        this.sleeper       = sleeper;
        this.meterRegistry = meterRegistry;
        transitions.add(state);
    }

    /**
     * Drive the state machine until SUCCEEDED or FAILED.
     *
     * @throws InterruptedException if the evaluation was cancelled while this
     *                              judge was waiting on a call or a backoff
     */
    public JudgeOutcome run() throws InterruptedException {
        int attempt = 0;
        String lastReason = null;
        JudgeResult result = null;

        while (!state.isTerminal()) {
            switch (state) {
                case PENDING -> {
                    attempt = 1;
                    moveTo(JudgeTaskState.IN_FLIGHT);
                }
                case IN_FLIGHT -> {
                    AttemptOutcome outcome = attempt(attempt);
                    record(outcome);
                    if (outcome instanceof AttemptOutcome.Success success) {
                        result = success.result().withAttempts(attempt);
                        log.info("Judge '{}' scored {} on attempt {}/{}",
                                spec.id(), result.score(), attempt, spec.maxAttempts());
                        moveTo(JudgeTaskState.SUCCEEDED);
                    } else if (outcome instanceof AttemptOutcome.TerminalFailure terminal) {
                        lastReason = terminal.reason();
                        log.warn("Judge '{}' failed terminally on attempt {}/{}: {}",
                                spec.id(), attempt, spec.maxAttempts(), lastReason);
                        moveTo(JudgeTaskState.FAILED);
                    } else {
                        lastReason = ((AttemptOutcome.RetryableFailure) outcome).reason();
                        if (attempt < spec.maxAttempts()) {
                            log.warn("Judge '{}' attempt {}/{} failed, will retry in {}: {}",
                                    spec.id(), attempt, spec.maxAttempts(),
                                    spec.backoffAfter(attempt), lastReason);
                            moveTo(JudgeTaskState.RETRY_WAIT);
                        } else {
                            lastReason = "exhausted %d attempts, last error: %s"
                                    .formatted(spec.maxAttempts(), lastReason);
                            log.warn("Judge '{}' {}", spec.id(), lastReason);
                            moveTo(JudgeTaskState.FAILED);
                        }
                    }
                }
                case RETRY_WAIT -> {
                    sleeper.sleep(spec.backoffAfter(attempt));
                    attempt++;
                    moveTo(JudgeTaskState.IN_FLIGHT);
                }
                default -> throw new IllegalStateException("unexpected state " + state);
            }
        }

        return state == JudgeTaskState.SUCCEEDED
                ? JudgeOutcome.success(result)
                : JudgeOutcome.excluded(new ExcludedJudge(spec.id(), lastReason, attempt));
    }

    /** Every state visited so far, starting with PENDING. */
    public List<JudgeTaskState> transitions() {
        return List.copyOf(transitions);
    }

    public JudgeTaskState state() {
        return state;
    }

    // ------------------------------------------------------------------
    // One attempt
    // ------------------------------------------------------------------

    private AttemptOutcome attempt(int attempt) throws InterruptedException {
        String problem;
        try {
            return new AttemptOutcome.Success(callAndValidate(request.guidance()));
        } catch (JudgePayloadException malformed) {
            problem = malformed.getMessage();
            log.warn("Judge '{}' attempt {} returned an unusable payload ({}), requesting a repair",
                    spec.id(), attempt, problem);
        } catch (ProviderException e) {
            return classify(e);
        }

        // Repair call: same attempt number, corrective instruction appended.
        String repairGuidance = JudgePrompts.repairGuidance(request.guidance(), problem);
        try {
            return new AttemptOutcome.Success(callAndValidate(repairGuidance));
        } catch (JudgePayloadException stillMalformed) {
            return new AttemptOutcome.RetryableFailure(
                    "malformed payload after repair: " + stillMalformed.getMessage());
        } catch (ProviderException e) {
            return classify(e);
        }
    }

    /**
     * Make one provider call bounded by the judge's timeout and validate the answer.
     *
     * @throws JudgePayloadException if the answer (or the provider envelope) is malformed
     * @throws ProviderException     on transient or fatal provider failure, including timeout
     */
    private JudgeResult callAndValidate(String guidance) throws InterruptedException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<RawJudgePayload> call = callExecutor.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return client.call(request.cvText(), request.jdText(), guidance, spec.timeout());
            } finally {
                MDC.clear();
            }
        });

        RawJudgePayload payload;
        try {
            payload = call.get(spec.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ProviderException(ProviderException.Kind.TRANSIENT,
                    "no response within " + spec.timeout());
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException providerError) {
                if (providerError.getKind() == ProviderException.Kind.MALFORMED) {
                    throw new JudgePayloadException(providerError.getMessage(), providerError);
                }
                throw providerError;
            }
            // Adapter bugs and unclassified runtime errors get the benefit of the doubt.
            throw new ProviderException(ProviderException.Kind.TRANSIENT,
                    "unexpected " + cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }

        return parser.parse(spec.id(), payload);
    }

    private static AttemptOutcome classify(ProviderException e) {
        return e.getKind() == ProviderException.Kind.FATAL
                ? new AttemptOutcome.TerminalFailure(e.getMessage())
                : new AttemptOutcome.RetryableFailure(e.getMessage());
    }

    private void moveTo(JudgeTaskState next) {
        state = next;
        transitions.add(next);
    }

    private void record(AttemptOutcome outcome) {
        String tag;
        if (outcome instanceof AttemptOutcome.Success) {
            tag = "success";
        } else if (outcome instanceof AttemptOutcome.TerminalFailure) {
            tag = "terminal";
        } else {
            tag = "retryable";
        }
        meterRegistry.counter("cvjudge.judge.attempts", "judge", spec.id(), "outcome", tag).increment();
    }
}
