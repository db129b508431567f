package com.surveyiq.analytics.stats;

import com.surveyiq.analytics.model.StatsReport;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class TraitAggregator {

    static final int TOP_TRAITS = 10;

    public List<StatsReport.TraitScore> topTraits(List<NormalizedResponse> responses) {
        Map<String, RunningScore> byName = new LinkedHashMap<>();
        for (NormalizedResponse response : responses) {
            for (NormalizedResponse.Trait trait : response.traits()) {
                byName.computeIfAbsent(trait.name(), name -> new RunningScore(trait.category()))
                        .add(trait.score());
            }
        }
        // stable sort: equal scores stay in first-encounter order
        return byName.entrySet().stream()
                .map(entry -> new StatsReport.TraitScore(entry.getKey(), entry.getValue().average(), entry.getValue().category))
                .sorted(Comparator.comparingLong(StatsReport.TraitScore::score).reversed())
                .limit(TOP_TRAITS)
                .toList();
    }

    private static final class RunningScore {
        private final String category;
        private double total;
        private int count;

        private RunningScore(String category) {
            this.category = category;
        }

        private void add(double score) {
            total += score;
            count++;
        }

        private long average() {
            return Math.round(total / count);
        }
    }
}
