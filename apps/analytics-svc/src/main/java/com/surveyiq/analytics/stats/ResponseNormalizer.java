package com.surveyiq.analytics.stats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.surveyiq.analytics.model.SurveyResponse;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Coerces the loosely-typed JSON columns of a response into {@link NormalizedResponse}.
 * Never throws: a field that cannot be read is dropped and the rest of the row is kept.
 */
@Component
public class ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    static final String DEFAULT_TRAIT_CATEGORY = "personality";
    static final double LEGACY_TRAIT_SCORE = 50d;
    private static final int LEGACY_TOKEN_MIN_LENGTH = 4;
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[,\\s]+");
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final String UNKNOWN_PRODUCT = "Unknown Product";
    private static final String GENERAL_CATEGORY = "General";

    private final ObjectMapper objectMapper;

    public ResponseNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<NormalizedResponse> normalizeAll(List<SurveyResponse> responses) {
        return responses.stream().map(this::normalize).toList();
    }

    public NormalizedResponse normalize(SurveyResponse response) {
        Long id = response.id();
        return new NormalizedResponse(
                response.respondentId(),
                response.completed(),
                response.satisfactionScore() == null ? 0 : response.satisfactionScore(),
                response.completionTimeSeconds(),
                response.userAgent() == null ? "" : response.userAgent(),
                response.createdAt(),
                readField(id, "traits", () -> normalizeTraits(response.traits()), List.of()),
                readField(id, "demographics", () -> normalizeDemographics(response.demographics()), NormalizedResponse.Demographics.EMPTY),
                readField(id, "genderStereotypes", () -> normalizeStereotypes(response.genderStereotypes()), NormalizedResponse.StereotypeSignal.EMPTY),
                readField(id, "productRecommendations", () -> normalizeProducts(response.productRecommendations()), NormalizedResponse.ProductSignal.EMPTY),
                trimmed(response.marketSegment())
        );
    }

    private <T> T readField(Long responseId, String field, Supplier<T> reader, T fallback) {
        try {
            T value = reader.get();
            return value != null ? value : fallback;
        } catch (RuntimeException ex) {
            log.debug("Skipping malformed {} on response {}: {}", field, responseId, ex.getMessage());
            return fallback;
        }
    }

    List<NormalizedResponse.Trait> normalizeTraits(JsonNode raw) {
        JsonNode traits = unwrap(raw);
        if (traits == null) {
            return List.of();
        }
        if (traits.isArray()) {
            List<NormalizedResponse.Trait> result = new ArrayList<>();
            for (JsonNode item : traits) {
                if (!item.isObject()) {
                    continue;
                }
                String name = text(item, "name");
                JsonNode score = item.get("score");
                if (name == null || score == null || !score.isNumber()) {
                    continue;
                }
                String category = text(item, "category");
                result.add(new NormalizedResponse.Trait(name, score.asDouble(), category != null ? category : DEFAULT_TRAIT_CATEGORY));
            }
            return result;
        }
        if (traits.isObject()) {
            String personality = text(traits, "personality");
            if (personality != null) {
                return legacyTraits(personality);
            }
        }
        return List.of();
    }

    // Free-text personality descriptions become coarse synthetic traits at a fixed score.
    private List<NormalizedResponse.Trait> legacyTraits(String description) {
        return Arrays.stream(TOKEN_SEPARATOR.split(description.toLowerCase(Locale.ROOT)))
                .filter(word -> word.length() >= LEGACY_TOKEN_MIN_LENGTH)
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .map(name -> new NormalizedResponse.Trait(name, LEGACY_TRAIT_SCORE, DEFAULT_TRAIT_CATEGORY))
                .toList();
    }

    NormalizedResponse.Demographics normalizeDemographics(JsonNode raw) {
        JsonNode demo = unwrap(raw);
        if (demo == null || !demo.isObject()) {
            return NormalizedResponse.Demographics.EMPTY;
        }
        String companySize = text(demo, "companySize");
        if (companySize == null) {
            companySize = text(demo, "company_size");
        }
        return new NormalizedResponse.Demographics(
                age(demo.get("age")),
                text(demo, "gender"),
                text(demo, "location"),
                text(demo, "industry"),
                companySize,
                text(demo, "department"),
                text(demo, "role"),
                text(demo, "decisionStyle"),
                text(demo, "decisionTimeframe"),
                text(demo, "growthStage"),
                text(demo, "learningPreference"),
                textList(demo.get("skills")),
                textList(demo.get("challenges"))
        );
    }

    NormalizedResponse.StereotypeSignal normalizeStereotypes(JsonNode raw) {
        JsonNode stereotypes = unwrap(raw);
        if (stereotypes == null || !stereotypes.isObject()) {
            return NormalizedResponse.StereotypeSignal.EMPTY;
        }
        return new NormalizedResponse.StereotypeSignal(
                stereotypeItems(stereotypes.get("maleAssociated")),
                stereotypeItems(stereotypes.get("femaleAssociated")),
                stereotypeItems(stereotypes.get("neutralAssociated"))
        );
    }

    private List<NormalizedResponse.StereotypeItem> stereotypeItems(JsonNode items) {
        if (items == null || !items.isArray()) {
            return List.of();
        }
        List<NormalizedResponse.StereotypeItem> result = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.isObject()) {
                continue;
            }
            String key = text(item, "trait");
            if (key == null) {
                key = text(item, "name");
            }
            if (key == null) {
                continue;
            }
            JsonNode description = item.get("description");
            result.add(new NormalizedResponse.StereotypeItem(
                    key,
                    number(item.get("score")),
                    description != null && description.isTextual() ? description.asText() : null));
        }
        return result;
    }

    NormalizedResponse.ProductSignal normalizeProducts(JsonNode raw) {
        JsonNode recommendations = unwrap(raw);
        if (recommendations == null || !recommendations.isObject()) {
            return NormalizedResponse.ProductSignal.EMPTY;
        }
        Map<String, Double> categories = new LinkedHashMap<>();
        JsonNode categoryNode = recommendations.get("categories");
        if (categoryNode != null && categoryNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = categoryNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                categories.merge(entry.getKey(), number(entry.getValue()), Double::sum);
            }
        }
        List<NormalizedResponse.ProductItem> products = new ArrayList<>();
        JsonNode productNode = recommendations.get("topProducts");
        if (productNode != null && productNode.isArray()) {
            for (JsonNode product : productNode) {
                if (!product.isObject()) {
                    continue;
                }
                String name = text(product, "name");
                String category = text(product, "category");
                JsonNode description = product.get("description");
                products.add(new NormalizedResponse.ProductItem(
                        name != null ? name : UNKNOWN_PRODUCT,
                        category != null ? category : GENERAL_CATEGORY,
                        number(product.get("confidence")),
                        description != null && description.isTextual() ? description.asText() : null,
                        attributes(product.get("attributes"))));
            }
        }
        return new NormalizedResponse.ProductSignal(categories, products);
    }

    private List<String> attributes(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        node.forEach(value -> {
            if (value.isValueNode() && !value.isNull()) {
                values.add(value.asText());
            }
        });
        return values;
    }

    /**
     * Resolves a raw column value to a JSON tree. JSON-encoded strings are parsed; strings that
     * are not JSON and explicit nulls resolve to {@code null}.
     */
    JsonNode unwrap(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return null;
        }
        if (!raw.isTextual()) {
            return raw;
        }
        String text = raw.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            JsonNode parsed = objectMapper.readTree(text);
            return parsed == null || parsed.isMissingNode() ? null : parsed;
        } catch (JsonProcessingException ex) {
            log.debug("Field is a plain string, not JSON: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private static Double age(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            Matcher matcher = LEADING_INTEGER.matcher(node.asText());
            if (matcher.find()) {
                return Double.valueOf(matcher.group(1));
            }
        }
        return null;
    }

    private static double number(JsonNode node) {
        return node != null && node.isNumber() ? node.asDouble() : 0d;
    }

    static String text(JsonNode parent, String field) {
        return scalarText(parent.get(field));
    }

    private static String scalarText(JsonNode node) {
        if (node == null || !(node.isTextual() || node.isNumber())) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(element -> {
                String value = scalarText(element);
                if (value != null) {
                    values.add(value);
                }
            });
            return values;
        }
        String single = scalarText(node);
        return single != null ? List.of(single) : List.of();
    }

    private static Optional<String> trimmed(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }
}
