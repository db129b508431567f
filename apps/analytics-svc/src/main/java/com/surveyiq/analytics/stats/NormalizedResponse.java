package com.surveyiq.analytics.stats;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical view of a {@link com.surveyiq.analytics.model.SurveyResponse}. Aggregators only read
 * this shape; absent or malformed source fields show up as empty lists, {@code null} scalars or
 * {@link Optional#empty()}.
 */
public record NormalizedResponse(
        String respondentId,
        boolean completed,
        int satisfactionScore,
        Integer completionTimeSeconds,
        String userAgent,
        Instant createdAt,
        List<Trait> traits,
        Demographics demographics,
        StereotypeSignal genderStereotypes,
        ProductSignal productRecommendations,
        Optional<String> marketSegment
) {

    public int completionTimeOrZero() {
        return completionTimeSeconds == null ? 0 : completionTimeSeconds;
    }

    public record Trait(String name, double score, String category) {
    }

    public record Demographics(
            Double age,
            String gender,
            String location,
            String industry,
            String companySize,
            String department,
            String role,
            String decisionStyle,
            String decisionTimeframe,
            String growthStage,
            String learningPreference,
            List<String> skills,
            List<String> challenges
    ) {
        public static final Demographics EMPTY = new Demographics(
                null, null, null, null, null, null, null, null, null, null, null, List.of(), List.of());
    }

    public record StereotypeItem(String trait, double score, String description) {
    }

    public record StereotypeSignal(
            List<StereotypeItem> maleAssociated,
            List<StereotypeItem> femaleAssociated,
            List<StereotypeItem> neutralAssociated
    ) {
        public static final StereotypeSignal EMPTY = new StereotypeSignal(List.of(), List.of(), List.of());
    }

    public record ProductItem(String name, String category, double confidence, String description, List<String> attributes) {
    }

    public record ProductSignal(Map<String, Double> categories, List<ProductItem> topProducts) {
        public static final ProductSignal EMPTY = new ProductSignal(Map.of(), List.of());
    }
}
