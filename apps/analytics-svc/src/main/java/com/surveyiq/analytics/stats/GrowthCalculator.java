package com.surveyiq.analytics.stats;

import com.surveyiq.analytics.model.StatsReport;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Month-over-month deltas between the trailing calendar month and the one before it. Window
 * boundaries are midnight in the reporting zone, counted back by calendar month; a day that does
 * not exist in the target month rolls over into the following month (March 31 minus one month is
 * March 2 in a leap year).
 */
@Component
public class GrowthCalculator {

    /**
     * @param monthOverMonth the three deltas, each rounded to one decimal
     * @param respondentsRaw the unrounded respondent delta, reused for the engagement growth rate
     */
    public record Growth(StatsReport.MonthOverMonthGrowth monthOverMonth, double respondentsRaw) {
    }

    public Growth calculate(List<NormalizedResponse> responses, Instant now, ZoneId zone) {
        LocalDate today = now.atZone(zone).toLocalDate();
        Instant oneMonthAgo = monthsBefore(today, 1).atStartOfDay(zone).toInstant();
        Instant twoMonthsAgo = monthsBefore(today, 2).atStartOfDay(zone).toInstant();

        List<NormalizedResponse> thisWindow = within(responses, created -> !created.isBefore(oneMonthAgo));
        List<NormalizedResponse> lastWindow = within(responses,
                created -> !created.isBefore(twoMonthsAgo) && created.isBefore(oneMonthAgo));

        double respondents = Percentages.growth(thisWindow.size(), lastWindow.size());
        double completion = Percentages.growth(completedCount(thisWindow), completedCount(lastWindow));
        double satisfaction = Percentages.growth(meanSatisfaction(thisWindow), meanSatisfaction(lastWindow));

        return new Growth(
                new StatsReport.MonthOverMonthGrowth(
                        Percentages.oneDecimal(respondents),
                        Percentages.oneDecimal(completion),
                        Percentages.oneDecimal(satisfaction)),
                respondents);
    }

    static LocalDate monthsBefore(LocalDate day, int months) {
        return day.withDayOfMonth(1).minusMonths(months).plusDays(day.getDayOfMonth() - 1L);
    }

    private static List<NormalizedResponse> within(List<NormalizedResponse> responses, Predicate<Instant> window) {
        return responses.stream()
                .filter(response -> response.createdAt() != null && window.test(response.createdAt()))
                .toList();
    }

    private static long completedCount(List<NormalizedResponse> responses) {
        return responses.stream().filter(NormalizedResponse::completed).count();
    }

    private static double meanSatisfaction(List<NormalizedResponse> responses) {
        if (responses.isEmpty()) {
            return 0d;
        }
        return responses.stream().mapToInt(NormalizedResponse::satisfactionScore).average().orElse(0d);
    }
}
