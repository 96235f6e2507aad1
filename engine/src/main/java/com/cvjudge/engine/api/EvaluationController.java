package com.cvjudge.engine.api;

import com.cvjudge.engine.api.dto.ErrorResponse;
import com.cvjudge.engine.api.dto.EvaluateRequest;
import com.cvjudge.engine.model.ConsensusReport;
import com.cvjudge.engine.orchestrator.OrchestrationFailedException;
import com.cvjudge.engine.service.EvaluationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for ensemble evaluations.
 *
 * POST /evaluations: judge a CV against a job description, synchronously
 *
 * Example:
 *   curl -X POST http://localhost:8080/evaluations \
 *     -H "Content-Type: application/json" \
 *     -d '{"cvText":"...","jdText":"...","guidance":"focus on Kubernetes"}'
 */
@RestController
@RequestMapping("/evaluations")
public class EvaluationController {

    private final EvaluationService evaluationService;

    public EvaluationController(EvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    /**
     * HTTP 200: consensus report (possibly from a subset of judges)
     * HTTP 400: cvText or jdText missing
     * HTTP 503: every judge failed; body lists each judge's reason
     */
    @PostMapping
    public ConsensusReport evaluate(@RequestBody EvaluateRequest req) {
        return evaluationService.evaluate(req.toModel());
    }

    @ExceptionHandler(InvalidEvaluationRequestException.class)
    ResponseEntity<ErrorResponse> badRequest(InvalidEvaluationRequestException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(OrchestrationFailedException.class)
    ResponseEntity<ErrorResponse> allJudgesFailed(OrchestrationFailedException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(e.getMessage(), e.getExcludedJudges()));
    }
}
