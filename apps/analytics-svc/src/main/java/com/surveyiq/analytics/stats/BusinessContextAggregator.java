package com.surveyiq.analytics.stats;

import com.surveyiq.analytics.model.StatsReport;
import com.surveyiq.analytics.model.Survey;
import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Ranked breakdowns of the organisational attributes respondents report about themselves.
 * Percentages use the response count as denominator, except company-scope industries taken from
 * survey records, which use the survey count.
 */
@Component
public class BusinessContextAggregator {

    static final int TOP_SKILLS = 10;
    static final int TOP_CHALLENGES = 10;

    /**
     * Industries come from the respondents when any of them reported one, otherwise from the
     * company's surveys.
     */
    public StatsReport.BusinessContext forCompany(List<NormalizedResponse> responses, List<Survey> surveys) {
        FrequencyTable responseIndustries = tally(responses, NormalizedResponse.Demographics::industry);
        List<StatsReport.IndustryShare> industries = responseIndustries.isEmpty()
                ? surveyIndustries(surveys)
                : toIndustries(responseIndustries.ranked(responses.size()));
        return aggregate(responses, industries);
    }

    /** The survey's own industry is reported at 100%, regardless of what respondents said. */
    public StatsReport.BusinessContext forSurvey(List<NormalizedResponse> responses, Survey survey) {
        return aggregate(responses, surveyIndustry(survey));
    }

    public List<StatsReport.IndustryShare> surveyIndustries(List<Survey> surveys) {
        FrequencyTable industries = new FrequencyTable();
        surveys.stream().filter(Survey::hasIndustry).map(Survey::industry).forEach(industries::add);
        return toIndustries(industries.ranked(surveys.size()));
    }

    public List<StatsReport.IndustryShare> surveyIndustry(Survey survey) {
        if (survey == null || !survey.hasIndustry()) {
            return List.of();
        }
        return List.of(new StatsReport.IndustryShare(survey.industry(), 100, 1));
    }

    private StatsReport.BusinessContext aggregate(List<NormalizedResponse> responses, List<StatsReport.IndustryShare> industries) {
        int total = responses.size();
        return new StatsReport.BusinessContext(
                industries,
                tally(responses, NormalizedResponse.Demographics::companySize).ranked(total).stream()
                        .map(t -> new StatsReport.CompanySizeShare(t.key(), t.percentage(), t.count())).toList(),
                tally(responses, NormalizedResponse.Demographics::department).ranked(total).stream()
                        .map(t -> new StatsReport.DepartmentShare(t.key(), t.percentage(), t.count())).toList(),
                tally(responses, NormalizedResponse.Demographics::role).ranked(total).stream()
                        .map(t -> new StatsReport.RoleShare(t.key(), t.percentage(), t.count())).toList(),
                tally(responses, NormalizedResponse.Demographics::decisionStyle).ranked(total).stream()
                        .map(t -> new StatsReport.DecisionStyleShare(t.key(), t.percentage(), t.count())).toList(),
                tally(responses, NormalizedResponse.Demographics::decisionTimeframe).ranked(total).stream()
                        .map(t -> new StatsReport.DecisionTimeframeShare(t.key(), t.percentage(), t.count())).toList(),
                tally(responses, NormalizedResponse.Demographics::growthStage).ranked(total).stream()
                        .map(t -> new StatsReport.GrowthStageShare(t.key(), t.percentage(), t.count())).toList(),
                tally(responses, NormalizedResponse.Demographics::learningPreference).ranked(total).stream()
                        .map(t -> new StatsReport.LearningPreferenceShare(t.key(), t.percentage(), t.count())).toList(),
                tallyAll(responses, NormalizedResponse.Demographics::skills).ranked(total, TOP_SKILLS).stream()
                        .map(t -> new StatsReport.SkillShare(t.key(), t.percentage(), t.count())).toList(),
                tallyAll(responses, NormalizedResponse.Demographics::challenges).ranked(total, TOP_CHALLENGES).stream()
                        .map(t -> new StatsReport.ChallengeShare(t.key(), t.percentage(), t.count())).toList()
        );
    }

    private static FrequencyTable tally(List<NormalizedResponse> responses, Function<NormalizedResponse.Demographics, String> field) {
        FrequencyTable table = new FrequencyTable();
        responses.forEach(response -> table.add(field.apply(response.demographics())));
        return table;
    }

    private static FrequencyTable tallyAll(List<NormalizedResponse> responses, Function<NormalizedResponse.Demographics, List<String>> field) {
        FrequencyTable table = new FrequencyTable();
        responses.forEach(response -> table.addAll(field.apply(response.demographics())));
        return table;
    }

    private static List<StatsReport.IndustryShare> toIndustries(List<FrequencyTable.Tally> tallies) {
        return tallies.stream()
                .map(t -> new StatsReport.IndustryShare(t.key(), t.percentage(), t.count()))
                .toList();
    }
}
