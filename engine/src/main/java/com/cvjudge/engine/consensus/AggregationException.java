package com.cvjudge.engine.consensus;

/**
 * The aggregator was handed input it cannot reduce: no results at all, or a
 * result from a judge that has no configuration. Unreachable through the
 * orchestrator, which never returns an empty result set.
 */
public class AggregationException extends RuntimeException {

    public AggregationException(String message) {
        super(message);
    }
}
