package com.surveyiq.analytics.stats;

import static org.assertj.core.api.Assertions.assertThat;

import com.surveyiq.analytics.model.StatsReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TraitAggregatorTest {

    private final TraitAggregator aggregator = new TraitAggregator();

    @Test
    void averagesScoresPerTraitAndKeepsFirstCategory() {
        List<StatsReport.TraitScore> traits = aggregator.topTraits(List.of(
                withTraits(new NormalizedResponse.Trait("Optimism", 80, "dispositional")),
                withTraits(new NormalizedResponse.Trait("Optimism", 71, "personality"),
                        new NormalizedResponse.Trait("Focus", 60, "cognitive"))));

        assertThat(traits).containsExactly(
                new StatsReport.TraitScore("Optimism", 76, "dispositional"),
                new StatsReport.TraitScore("Focus", 60, "cognitive"));
    }

    @Test
    void equalScoresKeepFirstEncounterOrder() {
        List<StatsReport.TraitScore> traits = aggregator.topTraits(List.of(
                withTraits(new NormalizedResponse.Trait("Zeal", 50, "personality"),
                        new NormalizedResponse.Trait("Agility", 50, "personality"),
                        new NormalizedResponse.Trait("Calm", 90, "personality"))));

        assertThat(traits).extracting(StatsReport.TraitScore::name).containsExactly("Calm", "Zeal", "Agility");
    }

    @Test
    void truncatesToTopTen() {
        List<NormalizedResponse.Trait> many = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            many.add(new NormalizedResponse.Trait("Trait" + i, i, "personality"));
        }

        List<StatsReport.TraitScore> traits = aggregator.topTraits(List.of(withTraits(many.toArray(new NormalizedResponse.Trait[0]))));

        assertThat(traits).hasSize(TraitAggregator.TOP_TRAITS);
        assertThat(traits.get(0).name()).isEqualTo("Trait24");
        assertThat(traits.get(9).name()).isEqualTo("Trait15");
    }

    @Test
    void noTraitsYieldsEmptyList() {
        assertThat(aggregator.topTraits(List.of(withTraits()))).isEmpty();
        assertThat(aggregator.topTraits(List.of())).isEmpty();
    }

    static NormalizedResponse withTraits(NormalizedResponse.Trait... traits) {
        return new NormalizedResponse(
                "r", true, 0, 60, "", null,
                List.of(traits),
                NormalizedResponse.Demographics.EMPTY,
                NormalizedResponse.StereotypeSignal.EMPTY,
                NormalizedResponse.ProductSignal.EMPTY,
                Optional.empty());
    }
}
