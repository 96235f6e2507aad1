package com.cvjudge.engine.orchestrator;

import com.cvjudge.engine.client.JudgeClient;
import com.cvjudge.engine.client.JudgeClientRegistry;
import com.cvjudge.engine.model.EvaluationRequest;
import com.cvjudge.engine.model.ExcludedJudge;
import com.cvjudge.engine.model.JudgeResult;
import com.cvjudge.engine.model.JudgeSpec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans one evaluation out to every configured judge and collects the results.
 *
 * Each judge runs its own {@link JudgeAttemptLoop} on its own thread; no
 * judge's retries, backoff or failure affect another's schedule. The only
 * synchronisation point is the join at the end of {@link #evaluate}, which
 * waits for every judge (there is no early exit on first success).
 *
 * A fresh thread pool is created per evaluation and shut down before
 * returning, so a timed-out provider call can never outlive the evaluation
 * that issued it.
 */
@Component
public class JudgeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JudgeOrchestrator.class);

    private final JudgeClientRegistry registry;
    private final JudgePayloadParser  parser;
    private final MeterRegistry       meterRegistry;
    private final Sleeper             sleeper;

    @Autowired
    public JudgeOrchestrator(JudgeClientRegistry registry,
                             JudgePayloadParser parser,
                             MeterRegistry meterRegistry) {
        this(registry, parser, meterRegistry, Sleeper.system());
    }

    public JudgeOrchestrator(JudgeClientRegistry registry,
                             JudgePayloadParser parser,
                             MeterRegistry meterRegistry,
                             Sleeper sleeper) {
        this.registry      = registry;
        this.parser        = parser;
        this.meterRegistry = meterRegistry;
        this.sleeper       = sleeper;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /** Evaluate with no overall deadline; each judge is still bounded by its own attempts. */
    public OrchestrationOutcome evaluate(EvaluationRequest request, List<JudgeSpec> judges) {
        return evaluate(request, judges, null);
    }

    /**
     * Run every judge concurrently and wait for all of them.
     *
     * When the deadline passes, or the calling thread is interrupted, judges
     * still running are cancelled and recorded as excluded with reason
     * "cancelled"; results that already arrived are kept.
     *
     * @param deadline overall budget for the whole evaluation, null for none
     * @return the usable results and the exclusions, in configured judge order
     * @throws OrchestrationFailedException if no judge produced a result
     * @throws IllegalArgumentException     if the judge list cannot produce a report
     */
    public OrchestrationOutcome evaluate(EvaluationRequest request,
                                         List<JudgeSpec> judges,
                                         Duration deadline) {
        validate(judges);
        String evaluationId = UUID.randomUUID().toString().substring(0, 8);
        log.info("Evaluation {} dispatched to {} judges: {}", evaluationId, judges.size(),
                judges.stream().map(JudgeSpec::id).toList());

        ExecutorService pool = Executors.newCachedThreadPool(judgeThreads(evaluationId));
        try {
            List<Future<JudgeOutcome>> futures = new ArrayList<>(judges.size());
            for (JudgeSpec spec : judges) {
                futures.add(pool.submit(() -> runJudge(evaluationId, spec, request, pool)));
            }

            awaitAll(evaluationId, futures, deadline);

            List<JudgeResult>   results  = new ArrayList<>();
            List<ExcludedJudge> excluded = new ArrayList<>();
            for (int i = 0; i < judges.size(); i++) {
                JudgeOutcome outcome = collect(judges.get(i), futures.get(i));
                if (outcome.succeeded()) {
                    results.add(outcome.result());
                } else {
                    excluded.add(outcome.exclusion());
                }
            }

            if (results.isEmpty()) {
                log.error("Evaluation {} failed: no judge produced a result ({} excluded)",
                        evaluationId, excluded.size());
                throw new OrchestrationFailedException(excluded);
            }

            log.info("Evaluation {} collected {}/{} judge results", evaluationId,
                    results.size(), judges.size());
            return new OrchestrationOutcome(results, excluded);
        } finally {
            pool.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Fan-out / join
    // ------------------------------------------------------------------

    private JudgeOutcome runJudge(String evaluationId,
                                  JudgeSpec spec,
                                  EvaluationRequest request,
                                  ExecutorService pool) throws InterruptedException {
        MDC.put("evaluationId", evaluationId);
        MDC.put("judgeId",      spec.id());
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "failed";
        try {
            Optional<JudgeClient> client = registry.find(spec.id());
            if (client.isEmpty()) {
                log.error("No client registered for judge '{}'", spec.id());
                return JudgeOutcome.excluded(
                        new ExcludedJudge(spec.id(), "no client registered for judge", 0));
            }

            JudgeOutcome outcome = new JudgeAttemptLoop(spec, client.get(), request, pool,
                    parser, sleeper, meterRegistry).run();
            status = outcome.succeeded() ? "success" : "failed";
            return outcome;
        } catch (InterruptedException e) {
            status = "cancelled";
            log.info("Judge '{}' cancelled", spec.id());
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("cvjudge.judge.duration",
                    "judge", spec.id(), "status", status));
            // Pool threads are reused by later judge calls of the same evaluation.
            MDC.clear();
        }
    }

    /**
     * Block until every judge finished, the deadline passed, or the caller
     * was interrupted. In the last two cases every unfinished judge is cancelled.
     */
    private static void awaitAll(String evaluationId,
                                 List<Future<JudgeOutcome>> futures,
                                 Duration deadline) {
        long deadlineNanos = deadline == null ? 0 : System.nanoTime() + deadline.toNanos();
        for (Future<JudgeOutcome> future : futures) {
            try {
                if (deadline == null) {
                    future.get();
                } else {
                    future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
                }
            } catch (ExecutionException | CancellationException e) {
                // Inspected per judge in collect().
            } catch (TimeoutException e) {
                log.warn("Evaluation {} deadline of {} reached, cancelling unfinished judges",
                        evaluationId, deadline);
                cancelUnfinished(futures);
                return;
            } catch (InterruptedException e) {
                log.warn("Evaluation {} interrupted, cancelling unfinished judges", evaluationId);
                cancelUnfinished(futures);
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static void cancelUnfinished(List<Future<JudgeOutcome>> futures) {
        for (Future<JudgeOutcome> future : futures) {
            if (!future.isDone()) {
                future.cancel(true);
            }
        }
    }

    /** Turn a finished (or cancelled) judge future into an outcome; never throws. */
    private static JudgeOutcome collect(JudgeSpec spec, Future<JudgeOutcome> future) {
        if (future.isCancelled()) {
            return JudgeOutcome.excluded(ExcludedJudge.cancelled(spec.id()));
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                return JudgeOutcome.excluded(ExcludedJudge.cancelled(spec.id()));
            }
            log.error("Judge '{}' crashed: {}", spec.id(), cause.toString(), cause);
            return JudgeOutcome.excluded(new ExcludedJudge(spec.id(),
                    "unexpected error: " + cause.getMessage(), 0));
        } catch (InterruptedException | CancellationException e) {
            return JudgeOutcome.excluded(ExcludedJudge.cancelled(spec.id()));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void validate(List<JudgeSpec> judges) {
        if (judges == null || judges.isEmpty()) {
            throw new IllegalArgumentException("at least one judge must be configured");
        }
        Set<String> ids = new HashSet<>();
        for (JudgeSpec spec : judges) {
            if (!ids.add(spec.id())) {
                throw new IllegalArgumentException("duplicate judge id: " + spec.id());
            }
        }
        if (judges.stream().noneMatch(j -> j.weight() > 0)) {
            throw new IllegalArgumentException("at least one judge must have a positive weight");
        }
    }

    private static ThreadFactory judgeThreads(String evaluationId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "judge-" + evaluationId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
