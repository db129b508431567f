package com.surveyiq.analytics.stats;

import com.surveyiq.analytics.model.StatsReport;

/** Outcome of one aggregation run, before it is unwrapped at the service boundary. */
interface AggregationResult {

    record Success(StatsReport report) implements AggregationResult {
    }

    record Failure(AggregationError error) implements AggregationResult {
    }

    static AggregationResult success(StatsReport report) {
        return new Success(report);
    }

    static AggregationResult failure(String scope, Exception cause) {
        return new Failure(new AggregationError(scope, cause.getMessage(), cause));
    }
}
