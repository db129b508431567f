package com.surveyiq.analytics.stats;

import static com.surveyiq.analytics.stats.NormalizedResponseBuilder.normalized;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.surveyiq.analytics.model.StatsReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BusinessSignalAggregatorTest {

    private final BusinessSignalAggregator aggregator = new BusinessSignalAggregator();

    @Test
    void repeatedStereotypeKeysDecayTowardsLatestScore() {
        StatsReport.GenderStereotypes result = aggregator.genderStereotypes(List.of(
                withMale(new NormalizedResponse.StereotypeItem("assertive", 80, "first")),
                withMale(new NormalizedResponse.StereotypeItem("assertive", 40, "second")),
                withMale(new NormalizedResponse.StereotypeItem("assertive", 20, "third"))));

        assertThat(result.maleAssociated()).containsExactly(new StatsReport.StereotypeTrait("assertive", 40, "first"));
        assertThat(result.femaleAssociated()).isEmpty();
        assertThat(result.neutralAssociated()).isEmpty();
    }

    @Test
    void categoriesAreMergedIndependently() {
        NormalizedResponse response = normalized()
                .stereotypes(new NormalizedResponse.StereotypeSignal(
                        List.of(new NormalizedResponse.StereotypeItem("competitive", 70, "m")),
                        List.of(new NormalizedResponse.StereotypeItem("competitive", 30, "f")),
                        List.of(new NormalizedResponse.StereotypeItem("curious", 50, "n"))))
                .build();

        StatsReport.GenderStereotypes result = aggregator.genderStereotypes(List.of(response));

        assertThat(result.maleAssociated()).containsExactly(new StatsReport.StereotypeTrait("competitive", 70, "m"));
        assertThat(result.femaleAssociated()).containsExactly(new StatsReport.StereotypeTrait("competitive", 30, "f"));
        assertThat(result.neutralAssociated()).containsExactly(new StatsReport.StereotypeTrait("curious", 50, "n"));
    }

    @Test
    void stereotypesAreNullWhenNoResponseCarriesAny() {
        assertThat(aggregator.genderStereotypes(List.of(normalized().build(), normalized().build()))).isNull();
        assertThat(aggregator.genderStereotypes(List.of())).isNull();
    }

    @Test
    void productCategoriesAreSummedAcrossResponses() {
        StatsReport.ProductRecommendations result = aggregator.productRecommendations(List.of(
                withProducts(Map.of("outdoor", 2d, "books", 1d)),
                withProducts(Map.of("outdoor", 3d))));

        assertThat(result.categories()).containsOnly(Map.entry("outdoor", 5d), Map.entry("books", 1d));
        assertThat(result.topProducts()).isEmpty();
    }

    @Test
    void fractionalCategoryCountsAreKept() {
        StatsReport.ProductRecommendations result = aggregator.productRecommendations(List.of(
                withProducts(Map.of("outdoor", 0.5)),
                withProducts(Map.of("outdoor", 0.25))));

        assertThat(result.categories()).containsOnly(Map.entry("outdoor", 0.75));
    }

    @Test
    void productRecommendationsCannotBeModified() {
        List<NormalizedResponse.ProductItem> items = new ArrayList<>();
        items.add(new NormalizedResponse.ProductItem("Tent", "outdoor", 0.9, null, new ArrayList<>(List.of("light"))));
        NormalizedResponse response = normalized()
                .products(new NormalizedResponse.ProductSignal(Map.of("outdoor", 1d, "books", 2d), items))
                .build();

        StatsReport.ProductRecommendations result = aggregator.productRecommendations(List.of(response));

        assertThat(result.categories()).containsOnlyKeys("outdoor", "books");
        assertThatThrownBy(() -> result.categories().put("garden", 1d))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.topProducts().get(0).attributes().add("heavy"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void topProductsAreSortedByConfidenceAndCapped() {
        List<NormalizedResponse.ProductItem> items = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            items.add(product("P" + i, i / 12d));
        }
        NormalizedResponse response = normalized()
                .products(new NormalizedResponse.ProductSignal(Map.of(), items))
                .build();

        StatsReport.ProductRecommendations result = aggregator.productRecommendations(List.of(response));

        assertThat(result.topProducts()).hasSize(BusinessSignalAggregator.TOP_PRODUCTS);
        assertThat(result.topProducts().get(0).name()).isEqualTo("P11");
        assertThat(result.topProducts().get(9).name()).isEqualTo("P2");
        assertThat(result.categories()).isEmpty();
    }

    @Test
    void productRecommendationsAreNullWithoutSignals() {
        assertThat(aggregator.productRecommendations(List.of(normalized().build()))).isNull();
    }

    @Test
    void marketSegmentsUseResponseCountAsDenominator() {
        List<StatsReport.MarketSegmentShare> segments = aggregator.marketSegments(List.of(
                normalized().marketSegment("Early adopters").build(),
                normalized().marketSegment("Early adopters").build(),
                normalized().marketSegment("Pragmatists").build(),
                normalized().build()));

        assertThat(segments).containsExactly(
                new StatsReport.MarketSegmentShare("Early adopters", 50),
                new StatsReport.MarketSegmentShare("Pragmatists", 25));
    }

    private static NormalizedResponse withMale(NormalizedResponse.StereotypeItem item) {
        return normalized()
                .stereotypes(new NormalizedResponse.StereotypeSignal(List.of(item), List.of(), List.of()))
                .build();
    }

    private static NormalizedResponse withProducts(Map<String, Double> categories) {
        return normalized().products(new NormalizedResponse.ProductSignal(categories, List.of())).build();
    }

    private static NormalizedResponse.ProductItem product(String name, double confidence) {
        return new NormalizedResponse.ProductItem(name, "general", confidence, "", List.of());
    }
}
