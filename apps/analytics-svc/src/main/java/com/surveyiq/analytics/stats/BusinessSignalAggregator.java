package com.surveyiq.analytics.stats;

import com.surveyiq.analytics.model.StatsReport;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Reducers for the optional business signals attached to a response: gender stereotype
 * associations, product recommendations and market segment labels.
 */
@Component
public class BusinessSignalAggregator {

    static final int TOP_PRODUCTS = 10;

    /**
     * Merges stereotype associations by trait key within each category. A repeated key replaces
     * the stored score with the mean of the stored and incoming values, so older contributions
     * decay with every merge.
     *
     * @return {@code null} when no response carried any association
     */
    public StatsReport.GenderStereotypes genderStereotypes(List<NormalizedResponse> responses) {
        List<StatsReport.StereotypeTrait> male = mergeStereotypes(responses, NormalizedResponse.StereotypeSignal::maleAssociated);
        List<StatsReport.StereotypeTrait> female = mergeStereotypes(responses, NormalizedResponse.StereotypeSignal::femaleAssociated);
        List<StatsReport.StereotypeTrait> neutral = mergeStereotypes(responses, NormalizedResponse.StereotypeSignal::neutralAssociated);
        if (male.isEmpty() && female.isEmpty() && neutral.isEmpty()) {
            return null;
        }
        return new StatsReport.GenderStereotypes(male, female, neutral);
    }

    private List<StatsReport.StereotypeTrait> mergeStereotypes(
            List<NormalizedResponse> responses,
            Function<NormalizedResponse.StereotypeSignal, List<NormalizedResponse.StereotypeItem>> category
    ) {
        Map<String, StatsReport.StereotypeTrait> merged = new LinkedHashMap<>();
        for (NormalizedResponse response : responses) {
            for (NormalizedResponse.StereotypeItem item : category.apply(response.genderStereotypes())) {
                merged.merge(
                        item.trait(),
                        new StatsReport.StereotypeTrait(item.trait(), item.score(), item.description()),
                        (existing, incoming) -> new StatsReport.StereotypeTrait(
                                existing.trait(),
                                (existing.score() + incoming.score()) / 2,
                                existing.description()));
            }
        }
        return List.copyOf(merged.values());
    }

    /** @return {@code null} when no response carried categories or products */
    public StatsReport.ProductRecommendations productRecommendations(List<NormalizedResponse> responses) {
        Map<String, Double> categories = new LinkedHashMap<>();
        List<NormalizedResponse.ProductItem> products = new ArrayList<>();
        for (NormalizedResponse response : responses) {
            NormalizedResponse.ProductSignal signal = response.productRecommendations();
            signal.categories().forEach((name, count) -> categories.merge(name, count, Double::sum));
            products.addAll(signal.topProducts());
        }
        if (categories.isEmpty() && products.isEmpty()) {
            return null;
        }
        List<StatsReport.Product> topProducts = products.stream()
                .sorted(Comparator.comparingDouble(NormalizedResponse.ProductItem::confidence).reversed())
                .limit(TOP_PRODUCTS)
                .map(item -> new StatsReport.Product(item.name(), item.category(), item.confidence(), item.description(), item.attributes()))
                .toList();
        return new StatsReport.ProductRecommendations(categories, topProducts);
    }

    public List<StatsReport.MarketSegmentShare> marketSegments(List<NormalizedResponse> responses) {
        FrequencyTable segments = new FrequencyTable();
        responses.forEach(response -> response.marketSegment().ifPresent(segments::add));
        return segments.ranked(responses.size()).stream()
                .map(tally -> new StatsReport.MarketSegmentShare(tally.key(), tally.percentage()))
                .toList();
    }
}
