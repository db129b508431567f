package com.surveyiq.analytics.stats;

import static com.surveyiq.analytics.stats.NormalizedResponseBuilder.normalized;
import static com.surveyiq.analytics.support.ResponseFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

import com.surveyiq.analytics.model.StatsReport;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class EngagementMetricsCalculatorTest {

    private static final String IPHONE = "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X)";
    private static final String IPAD = "Mozilla/5.0 (iPad; CPU OS 17_0 like Mac OS X)";
    private static final String ANDROID_TABLET = "Mozilla/5.0 (Linux; Android 14; Android tablet)";

    private final EngagementMetricsCalculator calculator = new EngagementMetricsCalculator();

    @Test
    void classifiesDevicesWithMobileMarkersFirst() {
        assertThat(EngagementMetricsCalculator.DeviceClass.of(IPHONE)).isEqualTo(EngagementMetricsCalculator.DeviceClass.MOBILE);
        assertThat(EngagementMetricsCalculator.DeviceClass.of(IPAD)).isEqualTo(EngagementMetricsCalculator.DeviceClass.TABLET);
        assertThat(EngagementMetricsCalculator.DeviceClass.of(ANDROID_TABLET)).isEqualTo(EngagementMetricsCalculator.DeviceClass.MOBILE);
        assertThat(EngagementMetricsCalculator.DeviceClass.of("")).isEqualTo(EngagementMetricsCalculator.DeviceClass.DESKTOP);
        assertThat(EngagementMetricsCalculator.DeviceClass.of(null)).isEqualTo(EngagementMetricsCalculator.DeviceClass.DESKTOP);
    }

    @Test
    void deviceUsageAlwaysListsEveryClassSortedByShare() {
        StatsReport.EngagementMetrics metrics = calculate(List.of(
                normalized().userAgent(IPHONE).build(),
                normalized().userAgent(ANDROID_TABLET).build(),
                normalized().userAgent(IPAD).build(),
                normalized().userAgent("").build()));

        assertThat(metrics.deviceUsage()).containsExactly(
                new StatsReport.DeviceShare("Mobile", 50),
                new StatsReport.DeviceShare("Desktop", 25),
                new StatsReport.DeviceShare("Tablet", 25));
    }

    @Test
    void zeroShareDevicesKeepDeclarationOrder() {
        StatsReport.EngagementMetrics metrics = calculate(List.of(normalized().build()));

        assertThat(metrics.deviceUsage()).containsExactly(
                new StatsReport.DeviceShare("Desktop", 100),
                new StatsReport.DeviceShare("Mobile", 0),
                new StatsReport.DeviceShare("Tablet", 0));
    }

    @Test
    void timeOfDayBuckets() {
        assertThat(EngagementMetricsCalculator.timeOfDay(5)).isEqualTo("Night");
        assertThat(EngagementMetricsCalculator.timeOfDay(6)).isEqualTo("Morning");
        assertThat(EngagementMetricsCalculator.timeOfDay(12)).isEqualTo("Afternoon");
        assertThat(EngagementMetricsCalculator.timeOfDay(17)).isEqualTo("Evening");
        assertThat(EngagementMetricsCalculator.timeOfDay(21)).isEqualTo("Night");
    }

    @Test
    void peakUsageTimesMergeHoursIntoBuckets() {
        StatsReport.EngagementMetrics metrics = calculate(List.of(
                normalized().createdAt("2024-06-14T08:10:00Z").build(),
                normalized().createdAt("2024-06-14T13:00:00Z").build(),
                normalized().createdAt("2024-06-14T13:45:00Z").build(),
                normalized().createdAt("2024-06-14T22:30:00Z").build()));

        assertThat(metrics.peakUsageTimes()).containsExactly(
                new StatsReport.UsageTimeShare("Afternoon", 50),
                new StatsReport.UsageTimeShare("Morning", 25),
                new StatsReport.UsageTimeShare("Night", 25));
    }

    @Test
    void peakUsageHoursUseTheReportingZone() {
        List<NormalizedResponse> responses = List.of(normalized().createdAt("2024-06-14T23:00:00Z").build());

        StatsReport.EngagementMetrics tokyo = calculator.calculate(responses, NOW, ZoneId.of("Asia/Tokyo"), 0, 0);

        assertThat(tokyo.peakUsageTimes()).containsExactly(new StatsReport.UsageTimeShare("Morning", 100));
    }

    @Test
    void shortOrMissingCompletionTimesCountAsBounces() {
        StatsReport.EngagementMetrics metrics = calculate(List.of(
                normalized().completionTime(15).build(),
                normalized().completionTime(45).build(),
                normalized().completionTime(null).build()));

        assertThat(metrics.bounceRate()).isEqualTo(67);
    }

    @Test
    void activeUsersAndRetentionUseTrailingWindows() {
        StatsReport.EngagementMetrics metrics = calculate(List.of(
                normalized().respondentId("a").createdAt(NOW.minus(Duration.ofHours(1))).build(),
                normalized().respondentId("a").createdAt(NOW.minus(Duration.ofDays(2))).build(),
                normalized().respondentId("b").createdAt(NOW.minus(Duration.ofHours(24))).build(),
                normalized().respondentId(null).createdAt(NOW.minus(Duration.ofDays(5))).build(),
                normalized().respondentId(null).createdAt(NOW.minus(Duration.ofDays(6))).build(),
                normalized().respondentId("c").createdAt(NOW.minus(Duration.ofDays(31))).build(),
                normalized().respondentId("d").build(),
                normalized().respondentId("e").createdAt(NOW.minus(Duration.ofHours(25))).build()));

        assertThat(metrics.dailyActiveUsers()).isEqualTo(2);
        assertThat(metrics.monthlyActiveUsers()).isEqualTo(4);
        assertThat(metrics.retentionRate()).isEqualTo(75);
    }

    @Test
    void activitiesAndConversionReflectCompletion() {
        StatsReport.EngagementMetrics metrics = calculate(List.of(
                normalized().completed(true).build(),
                normalized().completed(false).build(),
                normalized().completed(false).build(),
                normalized().completed(true).build()));

        assertThat(metrics.activities()).containsExactly(
                new StatsReport.Activity(EngagementMetricsCalculator.SURVEY_COMPLETION, 2, "up"),
                new StatsReport.Activity(EngagementMetricsCalculator.RESPONSES_STARTED, 4, "up"));
        assertThat(metrics.conversionRate()).isEqualTo(50);
    }

    @Test
    void sessionDurationIsCompletionTimeInRoundedMinutes() {
        List<NormalizedResponse> responses = List.of(normalized().build());

        assertThat(calculator.calculate(responses, NOW, ZoneOffset.UTC, 150, 0).averageSessionDuration()).isEqualTo(3);
        assertThat(calculator.calculate(responses, NOW, ZoneOffset.UTC, 89, 0).averageSessionDuration()).isEqualTo(1);
        assertThat(calculator.calculate(responses, NOW, ZoneOffset.UTC, 0, 0).averageSessionDuration()).isZero();
    }

    @Test
    void growthRateIsRespondentGrowthRounded() {
        List<NormalizedResponse> responses = List.of(normalized().build());

        assertThat(calculator.calculate(responses, NOW, ZoneOffset.UTC, 0, -66.667).growthRate()).isEqualTo(-67);
        assertThat(calculator.calculate(responses, NOW, ZoneOffset.UTC, 0, 12.4).growthRate()).isEqualTo(12);
    }

    private StatsReport.EngagementMetrics calculate(List<NormalizedResponse> responses) {
        return calculator.calculate(responses, NOW, ZoneOffset.UTC, 0, 0);
    }
}
