package com.surveyiq.analytics.stats;

/**
 * Rounding rules shared by all distributions. Each bucket is rounded on its own, so a
 * distribution may sum to slightly more or less than 100.
 */
final class Percentages {

    private Percentages() {
    }

    /** Whole percentage of {@code count} in {@code total}; 0 when {@code total} is 0. */
    static int of(long count, long total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round((double) count / total * 100);
    }

    /** Relative change from {@code previous} to {@code current} in percent; 0 when there is no baseline. */
    static double growth(double current, double previous) {
        if (previous <= 0) {
            return 0d;
        }
        return (current - previous) / previous * 100;
    }

    static double oneDecimal(double value) {
        return Math.round(value * 10) / 10d;
    }
}
