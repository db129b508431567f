package com.surveyiq.analytics.stats;

import com.surveyiq.analytics.config.SurveyIqProperties;
import com.surveyiq.analytics.model.StatsReport;
import com.surveyiq.analytics.model.Survey;
import com.surveyiq.analytics.model.SurveyResponse;
import com.surveyiq.analytics.repository.SurveyRepository;
import com.surveyiq.analytics.repository.SurveyResponseRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds {@link StatsReport}s for a company or a single survey. Never throws: an empty row set
 * and any failure while fetching or aggregating both yield the zero-value report.
 */
@Service
public class StatsService {

    private static final Logger log = LoggerFactory.getLogger(StatsService.class);

    private final SurveyResponseRepository responseRepository;
    private final SurveyRepository surveyRepository;
    private final ResponseNormalizer normalizer;
    private final TraitAggregator traitAggregator;
    private final DemographicAggregator demographicAggregator;
    private final BusinessSignalAggregator businessSignalAggregator;
    private final EngagementMetricsCalculator engagementMetricsCalculator;
    private final GrowthCalculator growthCalculator;
    private final BusinessContextAggregator businessContextAggregator;
    private final Clock clock;
    private final ZoneId zone;

    public StatsService(
            SurveyResponseRepository responseRepository,
            SurveyRepository surveyRepository,
            ResponseNormalizer normalizer,
            TraitAggregator traitAggregator,
            DemographicAggregator demographicAggregator,
            BusinessSignalAggregator businessSignalAggregator,
            EngagementMetricsCalculator engagementMetricsCalculator,
            GrowthCalculator growthCalculator,
            BusinessContextAggregator businessContextAggregator,
            Clock clock,
            SurveyIqProperties properties
    ) {
        this.responseRepository = responseRepository;
        this.surveyRepository = surveyRepository;
        this.normalizer = normalizer;
        this.traitAggregator = traitAggregator;
        this.demographicAggregator = demographicAggregator;
        this.businessSignalAggregator = businessSignalAggregator;
        this.engagementMetricsCalculator = engagementMetricsCalculator;
        this.growthCalculator = growthCalculator;
        this.businessContextAggregator = businessContextAggregator;
        this.clock = clock;
        this.zone = properties.stats().zoneId();
    }

    public StatsReport computeCompanyStats(long companyId) {
        return unwrap(aggregateCompany(companyId), StatsReport.empty(0));
    }

    public StatsReport computeSurveyStats(long surveyId) {
        return unwrap(aggregateSurvey(surveyId), StatsReport.empty(1));
    }

    private AggregationResult aggregateCompany(long companyId) {
        String scope = "company:" + companyId;
        try {
            Instant now = clock.instant();
            List<Survey> surveys = surveyRepository.findByCompanyId(companyId);
            List<SurveyResponse> rows = responseRepository.findByCompanyId(companyId);
            log.debug("Computing stats for {}: {} surveys, {} responses", scope, surveys.size(), rows.size());
            if (rows.isEmpty()) {
                return AggregationResult.success(StatsReport.empty(surveys.size()));
            }
            List<NormalizedResponse> responses = normalizer.normalizeAll(rows);
            return AggregationResult.success(
                    compose(responses, surveys.size(), now, businessContextAggregator.forCompany(responses, surveys)));
        } catch (RuntimeException ex) {
            return AggregationResult.failure(scope, ex);
        }
    }

    private AggregationResult aggregateSurvey(long surveyId) {
        String scope = "survey:" + surveyId;
        try {
            Instant now = clock.instant();
            Optional<Survey> survey = surveyRepository.findById(surveyId);
            List<SurveyResponse> rows = responseRepository.findBySurveyId(surveyId);
            log.debug("Computing stats for {}: {} responses", scope, rows.size());
            if (rows.isEmpty()) {
                return AggregationResult.success(
                        StatsReport.emptyWithIndustries(1, businessContextAggregator.surveyIndustry(survey.orElse(null))));
            }
            List<NormalizedResponse> responses = normalizer.normalizeAll(rows);
            return AggregationResult.success(
                    compose(responses, 1, now, businessContextAggregator.forSurvey(responses, survey.orElse(null))));
        } catch (RuntimeException ex) {
            return AggregationResult.failure(scope, ex);
        }
    }

    private StatsReport compose(
            List<NormalizedResponse> responses,
            int surveyCount,
            Instant now,
            StatsReport.BusinessContext businessContext
    ) {
        int total = responses.size();
        int completed = (int) responses.stream().filter(NormalizedResponse::completed).count();
        double satisfactionSum = responses.stream().mapToInt(NormalizedResponse::satisfactionScore).sum();
        long completionTimeSum = responses.stream().mapToLong(NormalizedResponse::completionTimeOrZero).sum();
        int averageCompletionTime = (int) Math.round((double) completionTimeSum / total);

        GrowthCalculator.Growth growth = growthCalculator.calculate(responses, now, zone);

        return new StatsReport(
                surveyCount,
                total,
                total,
                Percentages.of(completed, total),
                (int) Math.round(satisfactionSum / total),
                completed,
                averageCompletionTime,
                growth.monthOverMonth(),
                traitAggregator.topTraits(responses),
                demographicAggregator.aggregate(responses),
                businessSignalAggregator.marketSegments(responses),
                businessSignalAggregator.genderStereotypes(responses),
                businessSignalAggregator.productRecommendations(responses),
                engagementMetricsCalculator.calculate(responses, now, zone, averageCompletionTime, growth.respondentsRaw()),
                businessContext
        );
    }

    private StatsReport unwrap(AggregationResult result, StatsReport fallback) {
        if (result instanceof AggregationResult.Success success) {
            return success.report();
        }
        AggregationError error = ((AggregationResult.Failure) result).error();
        log.error("Stats aggregation failed for {}, returning empty report: {}", error.scope(), error.message(), error.cause());
        return fallback;
    }
}
