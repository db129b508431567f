package com.surveyiq.analytics.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.surveyiq.analytics.model.Survey;
import com.surveyiq.analytics.model.SurveyResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Renders responses as CSV. Columns are discovered per export: the fixed record fields plus one
 * column per key found in any row's {@code responses}, {@code traits} or {@code demographics}
 * object, all sorted by name.
 */
@Component
public class ResponseCsvExporter {

    static final String NO_DATA = "No data";
    static final String RESPONSE_PREFIX = "response_";
    static final String TRAIT_PREFIX = "trait_";
    static final String DEMOGRAPHIC_PREFIX = "demographic_";

    private static final Map<String, Function<SurveyResponse, Object>> STANDARD_COLUMNS = Map.of(
            "id", SurveyResponse::id,
            "surveyId", SurveyResponse::surveyId,
            "companyId", SurveyResponse::companyId,
            "respondentId", SurveyResponse::respondentId,
            "respondentEmail", SurveyResponse::respondentEmail,
            "ipAddress", SurveyResponse::ipAddress,
            "source", SurveyResponse::source,
            "startTime", SurveyResponse::startTime,
            "completeTime", SurveyResponse::completeTime,
            "createdAt", SurveyResponse::createdAt
    );

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ResponseCsvExporter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param survey optional metadata; when present a {@code #}-prefixed header block is written
     *               before the column row
     */
    public String toCsv(List<SurveyResponse> responses, Survey survey) {
        if (responses == null || responses.isEmpty()) {
            return NO_DATA;
        }
        StringBuilder sb = new StringBuilder();
        if (survey != null) {
            sb.append("# Survey: ").append(blankToDefault(survey.title(), "Untitled")).append('\n');
            if (survey.description() != null && !survey.description().isEmpty()) {
                sb.append("# Description: ").append(survey.description()).append('\n');
            }
            sb.append("# Export Date: ").append(clock.instant()).append('\n');
            sb.append("# Total Responses: ").append(responses.size()).append('\n');
            sb.append("#\n");
        }

        SortedSet<String> columns = new TreeSet<>(STANDARD_COLUMNS.keySet());
        for (SurveyResponse response : responses) {
            addKeys(columns, RESPONSE_PREFIX, response.responses());
            addKeys(columns, TRAIT_PREFIX, response.traits());
            addKeys(columns, DEMOGRAPHIC_PREFIX, response.demographics());
        }
        sb.append(String.join(",", columns)).append('\n');

        for (SurveyResponse response : responses) {
            List<String> cells = new ArrayList<>(columns.size());
            for (String column : columns) {
                cells.add(formatCell(valueOf(response, column)));
            }
            sb.append(String.join(",", cells)).append('\n');
        }
        return sb.toString();
    }

    private static void addKeys(SortedSet<String> columns, String prefix, JsonNode node) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                columns.add(prefix + names.next());
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                columns.add(prefix + i);
            }
        }
    }

    private static Object valueOf(SurveyResponse response, String column) {
        if (column.startsWith(RESPONSE_PREFIX)) {
            return child(response.responses(), column.substring(RESPONSE_PREFIX.length()));
        }
        if (column.startsWith(TRAIT_PREFIX)) {
            return child(response.traits(), column.substring(TRAIT_PREFIX.length()));
        }
        if (column.startsWith(DEMOGRAPHIC_PREFIX)) {
            return child(response.demographics(), column.substring(DEMOGRAPHIC_PREFIX.length()));
        }
        Function<SurveyResponse, Object> accessor = STANDARD_COLUMNS.get(column);
        return accessor != null ? accessor.apply(response) : null;
    }

    private static JsonNode child(JsonNode parent, String key) {
        if (parent == null) {
            return null;
        }
        if (parent.isObject()) {
            return parent.get(key);
        }
        if (parent.isArray()) {
            try {
                return parent.get(Integer.parseInt(key));
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    String formatCell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof JsonNode node) {
            return formatNode(node);
        }
        if (value instanceof Number number && number.longValue() == 0L) {
            return "";
        }
        return escape(value.toString());
    }

    // Empty strings, zero, false and null all render as an empty cell.
    private String formatNode(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isTextual()) {
            return escape(node.asText());
        }
        if (node.isBoolean()) {
            return node.asBoolean() ? "true" : "";
        }
        if (node.isNumber()) {
            double number = node.asDouble();
            if (number == 0d || Double.isNaN(number)) {
                return "";
            }
            if (node.isIntegralNumber()) {
                return node.asText();
            }
            return number == Math.rint(number) && !Double.isInfinite(number)
                    ? String.valueOf((long) number)
                    : String.valueOf(number);
        }
        try {
            return "\"" + objectMapper.writeValueAsString(node).replace("\"", "\"\"") + "\"";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize CSV cell", ex);
        }
    }

    static String escape(String value) {
        if (value.isEmpty()) {
            return "";
        }
        String escaped = value.replace("\"", "\"\"");
        if (escaped.contains(",") || escaped.contains("\n") || escaped.contains("\r") || escaped.contains("\"")) {
            return "\"" + escaped + "\"";
        }
        return escaped;
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
