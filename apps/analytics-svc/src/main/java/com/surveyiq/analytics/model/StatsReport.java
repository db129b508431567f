package com.surveyiq.analytics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derived statistics for a company or a single survey. Every field is always populated: missing
 * data is an empty list, a zero or, for {@code genderStereotypes} and
 * {@code productRecommendations}, {@code null}.
 */
public record StatsReport(
        int surveyCount,
        int responseCount,
        int totalResponses,
        int completionRate,
        int averageSatisfactionScore,
        int completedResponses,
        int averageCompletionTime,
        MonthOverMonthGrowth monthOverMonthGrowth,
        List<TraitScore> topTraits,
        Demographics demographics,
        List<MarketSegmentShare> marketSegments,
        GenderStereotypes genderStereotypes,
        ProductRecommendations productRecommendations,
        EngagementMetrics engagementMetrics,
        BusinessContext businessContext
) {

    public static StatsReport empty(int surveyCount) {
        return emptyWithIndustries(surveyCount, List.of());
    }

    public static StatsReport emptyWithIndustries(int surveyCount, List<IndustryShare> industries) {
        return new StatsReport(
                surveyCount,
                0,
                0,
                0,
                0,
                0,
                0,
                new MonthOverMonthGrowth(0, 0, 0),
                List.of(),
                new Demographics(List.of(), List.of(), List.of()),
                List.of(),
                null,
                null,
                EngagementMetrics.empty(),
                BusinessContext.empty().withIndustries(industries)
        );
    }

    public record MonthOverMonthGrowth(double respondents, double completion, double satisfaction) {
    }

    public record TraitScore(String name, long score, String category) {
    }

    public record Demographics(
            List<GenderShare> genderDistribution,
            List<AgeShare> ageDistribution,
            List<LocationShare> locationDistribution
    ) {
    }

    public record GenderShare(String label, int value) {
    }

    public record AgeShare(String range, int percentage) {
    }

    public record LocationShare(String location, int percentage, int count) {
    }

    public record MarketSegmentShare(String segment, int percentage) {
    }

    public record GenderStereotypes(
            List<StereotypeTrait> maleAssociated,
            List<StereotypeTrait> femaleAssociated,
            List<StereotypeTrait> neutralAssociated
    ) {
    }

    public record StereotypeTrait(String trait, double score, String description) {
    }

    public record ProductRecommendations(Map<String, Double> categories, List<Product> topProducts) {
        public ProductRecommendations {
            categories = categories == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
            topProducts = topProducts == null ? List.of() : List.copyOf(topProducts);
        }
    }

    public record Product(String name, String category, double confidence, String description, List<String> attributes) {
        public Product {
            attributes = attributes == null ? null : List.copyOf(attributes);
        }
    }

    public record EngagementMetrics(
            int dailyActiveUsers,
            int monthlyActiveUsers,
            int averageSessionDuration,
            int retentionRate,
            List<Activity> activities,
            List<DeviceShare> deviceUsage,
            List<UsageTimeShare> peakUsageTimes,
            int bounceRate,
            int conversionRate,
            long growthRate
    ) {
        public static EngagementMetrics empty() {
            return new EngagementMetrics(0, 0, 0, 0, List.of(), List.of(), List.of(), 0, 0, 0);
        }
    }

    public record Activity(String name, int count, String trend) {
    }

    public record DeviceShare(String device, int percentage) {
    }

    public record UsageTimeShare(String time, int percentage) {
    }

    public record BusinessContext(
            List<IndustryShare> industries,
            List<CompanySizeShare> companySizes,
            List<DepartmentShare> departments,
            List<RoleShare> roles,
            List<DecisionStyleShare> decisionStyles,
            List<DecisionTimeframeShare> decisionTimeframes,
            List<GrowthStageShare> growthStages,
            List<LearningPreferenceShare> learningPreferences,
            List<SkillShare> skills,
            List<ChallengeShare> challenges
    ) {
        public static BusinessContext empty() {
            return new BusinessContext(
                    List.of(), List.of(), List.of(), List.of(), List.of(),
                    List.of(), List.of(), List.of(), List.of(), List.of());
        }

        public BusinessContext withIndustries(List<IndustryShare> newIndustries) {
            return new BusinessContext(
                    newIndustries,
                    companySizes,
                    departments,
                    roles,
                    decisionStyles,
                    decisionTimeframes,
                    growthStages,
                    learningPreferences,
                    skills,
                    challenges
            );
        }
    }

    public record IndustryShare(String name, int percentage, int count) {
    }

    public record CompanySizeShare(String size, int percentage, int count) {
    }

    public record DepartmentShare(String name, int percentage, int count) {
    }

    public record RoleShare(String name, int percentage, int count) {
    }

    public record DecisionStyleShare(String style, int percentage, int count) {
    }

    public record DecisionTimeframeShare(String timeframe, int percentage, int count) {
    }

    public record GrowthStageShare(String stage, int percentage, int count) {
    }

    public record LearningPreferenceShare(String preference, int percentage, int count) {
    }

    public record SkillShare(String skill, int percentage, int count) {
    }

    public record ChallengeShare(String challenge, int percentage, int count) {
    }
}
