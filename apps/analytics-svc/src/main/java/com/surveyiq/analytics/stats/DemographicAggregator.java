package com.surveyiq.analytics.stats;

import com.surveyiq.analytics.model.StatsReport;
import java.util.Arrays;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class DemographicAggregator {

    /** Age brackets in reporting order; lower bound inclusive, upper bound exclusive. */
    public enum AgeBracket {
        UNDER_18("Under 18", Double.NEGATIVE_INFINITY, 18),
        FROM_18_TO_24("18-24", 18, 25),
        FROM_25_TO_34("25-34", 25, 35),
        FROM_35_TO_44("35-44", 35, 45),
        FROM_45_TO_54("45-54", 45, 55),
        FROM_55_TO_64("55-64", 55, 65),
        SENIOR("65+", 65, Double.POSITIVE_INFINITY);

        private final String label;
        private final double lowerInclusive;
        private final double upperExclusive;

        AgeBracket(String label, double lowerInclusive, double upperExclusive) {
            this.label = label;
            this.lowerInclusive = lowerInclusive;
            this.upperExclusive = upperExclusive;
        }

        public String label() {
            return label;
        }

        public static AgeBracket of(double age) {
            for (AgeBracket bracket : values()) {
                if (age >= bracket.lowerInclusive && age < bracket.upperExclusive) {
                    return bracket;
                }
            }
            return SENIOR;
        }
    }

    public StatsReport.Demographics aggregate(List<NormalizedResponse> responses) {
        int total = responses.size();
        FrequencyTable genders = new FrequencyTable();
        FrequencyTable ages = new FrequencyTable();
        FrequencyTable locations = new FrequencyTable();
        for (NormalizedResponse response : responses) {
            NormalizedResponse.Demographics demo = response.demographics();
            genders.add(demo.gender());
            locations.add(demo.location());
            if (demo.age() != null && !demo.age().isNaN() && demo.age() != 0d) {
                ages.add(AgeBracket.of(demo.age()).label());
            }
        }

        List<StatsReport.GenderShare> genderDistribution = genders.ranked(total).stream()
                .map(tally -> new StatsReport.GenderShare(tally.key(), tally.percentage()))
                .toList();
        List<StatsReport.AgeShare> ageDistribution = Arrays.stream(AgeBracket.values())
                .filter(bracket -> ages.count(bracket.label()) > 0)
                .map(bracket -> new StatsReport.AgeShare(bracket.label(), Percentages.of(ages.count(bracket.label()), total)))
                .toList();
        List<StatsReport.LocationShare> locationDistribution = locations.ranked(total).stream()
                .map(tally -> new StatsReport.LocationShare(tally.key(), tally.percentage(), tally.count()))
                .toList();
        return new StatsReport.Demographics(genderDistribution, ageDistribution, locationDistribution);
    }
}
