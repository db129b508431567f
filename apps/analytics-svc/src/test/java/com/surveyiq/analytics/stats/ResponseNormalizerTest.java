package com.surveyiq.analytics.stats;

import static com.surveyiq.analytics.support.ResponseFixtures.MAPPER;
import static com.surveyiq.analytics.support.ResponseFixtures.encoded;
import static com.surveyiq.analytics.support.ResponseFixtures.json;
import static com.surveyiq.analytics.support.ResponseFixtures.response;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.IntNode;
import com.surveyiq.analytics.model.SurveyResponse;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResponseNormalizerTest {

    private final ResponseNormalizer normalizer = new ResponseNormalizer(MAPPER);

    @Test
    void keepsWellFormedArrayTraitsAndDefaultsCategory() {
        List<NormalizedResponse.Trait> traits = normalizer.normalizeTraits(json("""
                [
                  {"name": "Optimism", "score": 80, "category": "dispositional"},
                  {"name": "Curiosity", "score": 65},
                  {"name": "Grit", "score": "high"},
                  {"score": 40},
                  "Openness"
                ]
                """));

        assertThat(traits).containsExactly(
                new NormalizedResponse.Trait("Optimism", 80, "dispositional"),
                new NormalizedResponse.Trait("Curiosity", 65, "personality"));
    }

    @Test
    void legacyPersonalityTextBecomesSyntheticTraits() {
        List<NormalizedResponse.Trait> traits = normalizer.normalizeTraits(
                json("{\"personality\": \"Practical, detail-oriented thinker\"}"));

        assertThat(traits).extracting(NormalizedResponse.Trait::name)
                .containsExactly("Practical", "Detail-oriented", "Thinker");
        assertThat(traits).allSatisfy(trait -> {
            assertThat(trait.score()).isEqualTo(50d);
            assertThat(trait.category()).isEqualTo("personality");
        });
    }

    @Test
    void legacyTokensOfThreeCharactersOrLessAreDropped() {
        List<NormalizedResponse.Trait> traits = normalizer.normalizeTraits(
                json("{\"personality\": \"shy but calm and kind\"}"));

        assertThat(traits).extracting(NormalizedResponse.Trait::name).containsExactly("Calm", "Kind");
    }

    @Test
    void parsesJsonEncodedStrings() {
        List<NormalizedResponse.Trait> traits = normalizer.normalizeTraits(
                encoded("[{\"name\": \"Empathy\", \"score\": 70}]"));

        assertThat(traits).containsExactly(new NormalizedResponse.Trait("Empathy", 70, "personality"));
    }

    @Test
    void plainTextAndWrongTypesYieldNoSignal() {
        assertThat(normalizer.normalizeTraits(encoded("not json at all"))).isEmpty();
        assertThat(normalizer.normalizeTraits(IntNode.valueOf(7))).isEmpty();
        assertThat(normalizer.normalizeTraits(null)).isEmpty();
        assertThat(normalizer.normalizeDemographics(json("[1, 2, 3]"))).isEqualTo(NormalizedResponse.Demographics.EMPTY);
        assertThat(normalizer.normalizeStereotypes(encoded("oops"))).isEqualTo(NormalizedResponse.StereotypeSignal.EMPTY);
        assertThat(normalizer.normalizeProducts(json("\"just text\""))).isEqualTo(NormalizedResponse.ProductSignal.EMPTY);
    }

    @Test
    void readsDemographicFieldsNullSafely() {
        NormalizedResponse.Demographics demo = normalizer.normalizeDemographics(json("""
                {
                  "age": "29 years",
                  "gender": " Female ",
                  "location": "Berlin",
                  "company_size": "51-200",
                  "role": "",
                  "skills": ["SQL", " ", "Python"],
                  "challenges": "Hiring"
                }
                """));

        assertThat(demo.age()).isEqualTo(29d);
        assertThat(demo.gender()).isEqualTo("Female");
        assertThat(demo.location()).isEqualTo("Berlin");
        assertThat(demo.companySize()).isEqualTo("51-200");
        assertThat(demo.role()).isNull();
        assertThat(demo.department()).isNull();
        assertThat(demo.skills()).containsExactly("SQL", "Python");
        assertThat(demo.challenges()).containsExactly("Hiring");
    }

    @Test
    void unparseableAgeIsDiscarded() {
        assertThat(normalizer.normalizeDemographics(json("{\"age\": \"unknown\"}")).age()).isNull();
        assertThat(normalizer.normalizeDemographics(json("{\"age\": 41.5}")).age()).isEqualTo(41.5);
    }

    @Test
    void companySizePrefersCamelCaseKey() {
        NormalizedResponse.Demographics demo = normalizer.normalizeDemographics(
                json("{\"companySize\": \"1-10\", \"company_size\": \"500+\"}"));

        assertThat(demo.companySize()).isEqualTo("1-10");
    }

    @Test
    void stereotypeItemsFallBackToNameAndSkipKeylessEntries() {
        NormalizedResponse.StereotypeSignal signal = normalizer.normalizeStereotypes(json("""
                {
                  "maleAssociated": [{"trait": "Assertive", "score": 70, "description": "Direct"}],
                  "femaleAssociated": [{"name": "Nurturing"}, {"score": 10}],
                  "neutralAssociated": "not a list"
                }
                """));

        assertThat(signal.maleAssociated()).containsExactly(new NormalizedResponse.StereotypeItem("Assertive", 70, "Direct"));
        assertThat(signal.femaleAssociated()).containsExactly(new NormalizedResponse.StereotypeItem("Nurturing", 0, null));
        assertThat(signal.neutralAssociated()).isEmpty();
    }

    @Test
    void productsGetDefaultNameAndCategory() {
        NormalizedResponse.ProductSignal signal = normalizer.normalizeProducts(json("""
                {
                  "categories": {"Books": 2, "Software": 1.5},
                  "topProducts": [{"confidence": 0.4, "attributes": ["cheap"]}, 5]
                }
                """));

        assertThat(signal.categories()).containsEntry("Books", 2d).containsEntry("Software", 1.5);
        assertThat(signal.topProducts()).containsExactly(
                new NormalizedResponse.ProductItem("Unknown Product", "General", 0.4, null, List.of("cheap")));
    }

    @Test
    void marketSegmentMustTrimToNonEmpty() {
        SurveyResponse blank = response().marketSegment("   ").build();
        SurveyResponse padded = response().marketSegment("  Enterprise ").build();

        assertThat(normalizer.normalize(blank).marketSegment()).isEmpty();
        assertThat(normalizer.normalize(padded).marketSegment()).contains("Enterprise");
    }

    @Test
    void normalizeNeverThrowsOnMalformedRow() {
        SurveyResponse row = response()
                .traits(encoded("{broken"))
                .demographics(IntNode.valueOf(3))
                .genderStereotypes(json("[]"))
                .productRecommendations(json("{\"categories\": \"nope\", \"topProducts\": {}}"))
                .satisfactionScore(null)
                .userAgent(null)
                .build();

        NormalizedResponse normalized = normalizer.normalize(row);

        assertThat(normalized.traits()).isEmpty();
        assertThat(normalized.demographics()).isEqualTo(NormalizedResponse.Demographics.EMPTY);
        assertThat(normalized.genderStereotypes()).isEqualTo(NormalizedResponse.StereotypeSignal.EMPTY);
        assertThat(normalized.productRecommendations().categories()).isEmpty();
        assertThat(normalized.productRecommendations().topProducts()).isEmpty();
        assertThat(normalized.satisfactionScore()).isZero();
        assertThat(normalized.userAgent()).isEmpty();
    }
}
