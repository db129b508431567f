package com.surveyiq.analytics.stats;

import com.surveyiq.analytics.model.StatsReport;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class EngagementMetricsCalculator {

    static final Duration DAILY_WINDOW = Duration.ofHours(24);
    static final Duration MONTHLY_WINDOW = Duration.ofDays(30);
    static final int BOUNCE_THRESHOLD_SECONDS = 30;

    static final String SURVEY_COMPLETION = "Survey Completion";
    static final String RESPONSES_STARTED = "Responses Started";
    private static final String TREND_UP = "up";

    enum DeviceClass {
        DESKTOP("Desktop"),
        MOBILE("Mobile"),
        TABLET("Tablet");

        private final String label;

        DeviceClass(String label) {
            this.label = label;
        }

        String label() {
            return label;
        }

        // Mobile markers win over tablet markers: an Android tablet reporting "mobile" is Mobile.
        static DeviceClass of(String userAgent) {
            String ua = userAgent == null ? "" : userAgent.toLowerCase(Locale.ROOT);
            if (ua.contains("mobile") || ua.contains("android") || ua.contains("iphone")) {
                return MOBILE;
            }
            if (ua.contains("tablet") || ua.contains("ipad")) {
                return TABLET;
            }
            return DESKTOP;
        }
    }

    static String timeOfDay(int hour) {
        if (hour >= 6 && hour < 12) {
            return "Morning";
        }
        if (hour >= 12 && hour < 17) {
            return "Afternoon";
        }
        if (hour >= 17 && hour < 21) {
            return "Evening";
        }
        return "Night";
    }

    /**
     * @param averageCompletionTime mean completion time in whole seconds across all responses
     * @param respondentsGrowth     raw month-over-month respondent growth in percent
     */
    public StatsReport.EngagementMetrics calculate(
            List<NormalizedResponse> responses,
            Instant now,
            ZoneId zone,
            int averageCompletionTime,
            double respondentsGrowth
    ) {
        int total = responses.size();
        Instant oneDayAgo = now.minus(DAILY_WINDOW);
        Instant thirtyDaysAgo = now.minus(MONTHLY_WINDOW);

        int daily = 0;
        int recent = 0;
        int bounced = 0;
        int completed = 0;
        // respondentId may be null; a HashSet keeps one null entry, so anonymous rows count once
        Set<String> monthlyRespondents = new HashSet<>();
        Map<DeviceClass, Integer> devices = new LinkedHashMap<>();
        for (DeviceClass deviceClass : DeviceClass.values()) {
            devices.put(deviceClass, 0);
        }
        int[] hourCounts = new int[24];

        for (NormalizedResponse response : responses) {
            Instant created = response.createdAt();
            if (created != null) {
                if (!created.isBefore(oneDayAgo)) {
                    daily++;
                }
                if (!created.isBefore(thirtyDaysAgo)) {
                    recent++;
                    monthlyRespondents.add(response.respondentId());
                }
                hourCounts[created.atZone(zone).getHour()]++;
            }
            if (response.completionTimeOrZero() < BOUNCE_THRESHOLD_SECONDS) {
                bounced++;
            }
            if (response.completed()) {
                completed++;
            }
            devices.merge(DeviceClass.of(response.userAgent()), 1, Integer::sum);
        }

        List<StatsReport.DeviceShare> deviceUsage = devices.entrySet().stream()
                .map(entry -> new StatsReport.DeviceShare(entry.getKey().label(), Percentages.of(entry.getValue(), total)))
                .sorted(Comparator.comparingInt(StatsReport.DeviceShare::percentage).reversed())
                .toList();

        return new StatsReport.EngagementMetrics(
                daily,
                monthlyRespondents.size(),
                averageCompletionTime > 0 ? (int) Math.round(averageCompletionTime / 60d) : 0,
                Percentages.of(recent, total),
                List.of(
                        new StatsReport.Activity(SURVEY_COMPLETION, completed, TREND_UP),
                        new StatsReport.Activity(RESPONSES_STARTED, total, TREND_UP)),
                deviceUsage,
                peakUsageTimes(hourCounts, total),
                Percentages.of(bounced, total),
                Percentages.of(completed, total),
                Math.round(respondentsGrowth)
        );
    }

    // Hours are visited in ascending order, so bucket order before sorting is
    // Night, Morning, Afternoon, Evening for whichever buckets are present.
    private static List<StatsReport.UsageTimeShare> peakUsageTimes(int[] hourCounts, int total) {
        Map<String, Integer> buckets = new LinkedHashMap<>();
        for (int hour = 0; hour < hourCounts.length; hour++) {
            if (hourCounts[hour] > 0) {
                buckets.merge(timeOfDay(hour), hourCounts[hour], Integer::sum);
            }
        }
        return buckets.entrySet().stream()
                .map(entry -> new StatsReport.UsageTimeShare(entry.getKey(), Percentages.of(entry.getValue(), total)))
                .sorted(Comparator.comparingInt(StatsReport.UsageTimeShare::percentage).reversed())
                .toList();
    }
}
