package com.cvjudge.engine.api.dto;

import com.cvjudge.engine.model.ExcludedJudge;

import java.util.List;

/**
 * Error body. excludedJudges is only populated when every judge failed,
 * so the caller can see why each one dropped out.
 */
public record ErrorResponse(String error, List<ExcludedJudge> excludedJudges) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, List.of());
    }
}
