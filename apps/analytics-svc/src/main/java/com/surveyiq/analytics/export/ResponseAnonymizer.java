package com.surveyiq.analytics.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.surveyiq.analytics.config.SurveyIqProperties;
import com.surveyiq.analytics.model.SurveyResponse;
import com.surveyiq.analytics.stats.DemographicAggregator.AgeBracket;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Strips or generalises personal data before responses leave the service. The same email always
 * maps to the same pseudonymous address, so exports stay joinable per respondent.
 */
@Component
public class ResponseAnonymizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseAnonymizer.class);

    private static final Pattern DECIMAL_AGE = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    static final String REDACTION_SUFFIX = "... [redacted for privacy]";
    private static final List<String> SENSITIVE_DEMOGRAPHICS = List.of(
            "phoneNumber", "phone", "ssn", "socialSecurityNumber",
            "dob", "dateOfBirth", "birthDate", "fullName"
    );

    private final ObjectMapper objectMapper;
    private final int redactionThreshold;

    public ResponseAnonymizer(ObjectMapper objectMapper, SurveyIqProperties properties) {
        this.objectMapper = objectMapper;
        this.redactionThreshold = properties.export().redactionThreshold();
    }

    public List<SurveyResponse> anonymizeAll(List<SurveyResponse> responses) {
        if (responses == null) {
            return List.of();
        }
        return responses.stream().map(this::anonymize).toList();
    }

    public SurveyResponse anonymize(SurveyResponse response) {
        return response.toBuilder()
                .respondentEmail(pseudonymousEmail(response.respondentEmail()))
                .ipAddress(null)
                .demographics(anonymizeDemographics(response.demographics()))
                .responses(redactAnswers(response.responses()))
                .anonymized(true)
                .build();
    }

    static String pseudonymousEmail(String email) {
        if (email == null || email.isEmpty()) {
            return email;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String hash = HexFormat.of().formatHex(digest.digest(email.getBytes(StandardCharsets.UTF_8)));
            return "anon-" + hash.substring(0, 8) + "@example.com";
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private JsonNode anonymizeDemographics(JsonNode demographics) {
        if (demographics == null || !demographics.isObject()) {
            return demographics;
        }
        ObjectNode copy = ((ObjectNode) demographics).deepCopy();
        JsonNode age = copy.get("age");
        Double parsedAge = numericAge(age);
        if (parsedAge != null && parsedAge != 0d) {
            copy.put("age", AgeBracket.of(parsedAge).label());
        }
        if (isTruthy(copy.get("city")) || isTruthy(copy.get("postalCode"))) {
            copy.putNull("city");
            copy.putNull("postalCode");
            if (isTruthy(copy.get("address"))) {
                copy.putNull("address");
            }
        }
        for (String field : SENSITIVE_DEMOGRAPHICS) {
            if (copy.has(field)) {
                copy.putNull(field);
            }
        }
        return copy;
    }

    private static Double numericAge(JsonNode age) {
        if (age == null) {
            return null;
        }
        double value;
        if (age.isNumber()) {
            value = age.asDouble();
        } else if (age.isTextual() && DECIMAL_AGE.matcher(age.asText().trim()).matches()) {
            value = Double.parseDouble(age.asText().trim());
        } else {
            return null;
        }
        // Overflowing exponents parse to infinity.
        return Double.isFinite(value) ? value : null;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        if (node.isNumber()) {
            return node.asDouble() != 0d;
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        return true;
    }

    /**
     * Truncates long free-text answers. A payload stored as a JSON string is parsed, redacted and
     * written back as a string; a string that is not JSON is left untouched.
     */
    private JsonNode redactAnswers(JsonNode responses) {
        if (responses == null || responses.isNull()) {
            return responses;
        }
        boolean encoded = responses.isTextual();
        JsonNode payload = responses;
        if (encoded) {
            try {
                payload = objectMapper.readTree(responses.asText());
            } catch (JsonProcessingException ex) {
                log.warn("Could not parse response payload during anonymization: {}", ex.getOriginalMessage());
                return responses;
            }
        } else {
            payload = responses.deepCopy();
        }
        if (payload == null) {
            return responses;
        }

        if (payload.isArray()) {
            for (JsonNode item : (ArrayNode) payload) {
                if (item.isObject() && item.get("answer") != null && item.get("answer").isTextual()) {
                    ((ObjectNode) item).put("answer", truncate(item.get("answer").asText()));
                }
            }
        } else if (payload.isObject()) {
            ObjectNode answers = (ObjectNode) payload;
            List<String> names = new ArrayList<>();
            answers.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode value = answers.get(name);
                if (value.isTextual()) {
                    answers.put(name, truncate(value.asText()));
                }
            }
        }

        if (!encoded) {
            return payload;
        }
        try {
            return TextNode.valueOf(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to re-encode anonymized responses", ex);
        }
    }

    String truncate(String answer) {
        if (answer.length() <= redactionThreshold) {
            return answer;
        }
        return answer.substring(0, redactionThreshold) + REDACTION_SUFFIX;
    }
}
