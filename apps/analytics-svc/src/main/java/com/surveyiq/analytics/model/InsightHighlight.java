package com.surveyiq.analytics.model;

import java.util.List;

public record InsightHighlight(
        String title,
        String summary,
        Sentiment sentiment,
        List<String> recommendations
) {
    public enum Sentiment {
        POSITIVE,
        NEUTRAL,
        NEGATIVE
    }
}
