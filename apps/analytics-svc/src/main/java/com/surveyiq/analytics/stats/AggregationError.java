package com.surveyiq.analytics.stats;

/**
 * @param scope   {@code company:<id>} or {@code survey:<id>}
 * @param message cause message, may be {@code null}
 */
record AggregationError(String scope, String message, Throwable cause) {
}
