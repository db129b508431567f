package com.surveyiq.analytics.ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.surveyiq.analytics.model.InsightHighlight;
import com.surveyiq.analytics.model.StatsReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class InsightHighlightService {

    private static final Logger log = LoggerFactory.getLogger(InsightHighlightService.class);

    static final String DEFAULT_TITLE = "Survey engagement overview";
    static final int MAX_OUTPUT_TOKENS = 600;
    private static final int PROMPT_TRAITS = 5;

    private final AiTextClient aiClient;
    private final ObjectMapper objectMapper;

    public InsightHighlightService(AiTextClient aiClient, ObjectMapper objectMapper) {
        this.aiClient = aiClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Summarises a stats report. Falls back to a rule-based highlight when AI generation is not
     * requested, not configured, or fails.
     */
    public InsightHighlight generate(StatsReport report, boolean generateAi) {
        if (report.responseCount() == 0) {
            return new InsightHighlight(
                    "No responses yet",
                    "No survey responses have been recorded yet.",
                    InsightHighlight.Sentiment.NEUTRAL,
                    List.of("Share your survey link to start collecting responses."));
        }

        InsightHighlight.Sentiment sentiment = sentimentOf(report);
        if (!generateAi || !aiClient.hasCredentials()) {
            return fallbackHighlight(report, sentiment);
        }

        try {
            Optional<String> aiResponse = aiClient.generateText(
                    List.of(new AiTextClient.Message("user", buildPrompt(report))),
                    MAX_OUTPUT_TOKENS);
            if (aiResponse.isPresent()) {
                return buildHighlightFromResponse(aiResponse.get(), report, sentiment);
            }
            log.warn("Insight highlight: AI response missing, using fallback");
        } catch (RuntimeException ex) {
            log.warn("Insight highlight: failed to generate highlight, using fallback", ex);
        }
        return fallbackHighlight(report, sentiment);
    }

    private InsightHighlight buildHighlightFromResponse(String rawResponse, StatsReport report, InsightHighlight.Sentiment sentiment) {
        String normalized = stripCodeFence(rawResponse == null ? "" : rawResponse.trim());
        if (normalized.isEmpty()) {
            return fallbackHighlight(report, sentiment);
        }
        if (!normalized.startsWith("{")) {
            return new InsightHighlight(DEFAULT_TITLE, normalized, sentiment, List.of());
        }
        try {
            Map<String, Object> ai = objectMapper.readValue(normalized, new TypeReference<Map<String, Object>>() {});
            String title = ai.get("title") != null ? ai.get("title").toString() : DEFAULT_TITLE;
            String summary = ai.get("summary") != null ? ai.get("summary").toString() : "";
            String sentimentStr = ai.get("sentiment") != null ? ai.get("sentiment").toString() : sentiment.name();
            InsightHighlight.Sentiment aiSentiment = switch (sentimentStr.toUpperCase(Locale.ROOT)) {
                case "POSITIVE" -> InsightHighlight.Sentiment.POSITIVE;
                case "NEGATIVE" -> InsightHighlight.Sentiment.NEGATIVE;
                case "NEUTRAL" -> InsightHighlight.Sentiment.NEUTRAL;
                default -> sentiment;
            };
            return new InsightHighlight(title, summary, aiSentiment, extractRecommendations(ai.get("recommendations")));
        } catch (Exception ex) {
            log.warn("Insight highlight: failed to parse response '{}', falling back", normalized);
            return fallbackHighlight(report, sentiment);
        }
    }

    private static String stripCodeFence(String text) {
        String s = text;
        if (s.startsWith("```")) {
            int firstNl = s.indexOf('\n');
            s = firstNl > 0 ? s.substring(firstNl + 1) : "";
            int fence = s.lastIndexOf("```");
            if (fence >= 0) {
                s = s.substring(0, fence);
            }
        }
        return s.trim();
    }

    private static List<String> extractRecommendations(Object recObj) {
        if (recObj instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    static InsightHighlight.Sentiment sentimentOf(StatsReport report) {
        double growth = report.monthOverMonthGrowth().respondents();
        if (growth > 0 && report.completionRate() >= 50) {
            return InsightHighlight.Sentiment.POSITIVE;
        }
        if (growth < 0 && report.completionRate() < 50) {
            return InsightHighlight.Sentiment.NEGATIVE;
        }
        return InsightHighlight.Sentiment.NEUTRAL;
    }

    private InsightHighlight fallbackHighlight(StatsReport report, InsightHighlight.Sentiment sentiment) {
        StringBuilder summary = new StringBuilder();
        summary.append(report.responseCount())
                .append(" responses with a ")
                .append(report.completionRate())
                .append("% completion rate. ");
        if (!report.topTraits().isEmpty()) {
            StatsReport.TraitScore top = report.topTraits().get(0);
            summary.append("Strongest trait: ")
                    .append(top.name())
                    .append(" (")
                    .append(top.score())
                    .append("). ");
        }
        summary.append("Respondents month over month: ")
                .append(report.monthOverMonthGrowth().respondents())
                .append("%.");

        List<String> recs = new ArrayList<>();
        if (report.completionRate() < 50) {
            recs.add("Less than half of respondents finish. Shorten the survey or move key questions earlier.");
        } else {
            recs.add("Completion is healthy. Consider adding follow-up questions for richer profiles.");
        }
        if (report.monthOverMonthGrowth().respondents() < 0) {
            recs.add("Response volume is falling. Re-share the survey with your audience.");
        }
        if (report.engagementMetrics().bounceRate() > 50) {
            recs.add("Most sessions end within 30 seconds. Review the first screen of the survey.");
        }

        return new InsightHighlight(DEFAULT_TITLE, summary.toString(), sentiment, List.copyOf(recs));
    }

    private String buildPrompt(StatsReport report) {
        String traits = report.topTraits().stream()
                .limit(PROMPT_TRAITS)
                .map(trait -> trait.name() + "=" + trait.score())
                .collect(Collectors.joining(", "));
        String devices = report.engagementMetrics().deviceUsage().stream()
                .map(device -> device.device() + "=" + device.percentage() + "%")
                .collect(Collectors.joining(", "));
        return String.format(Locale.ROOT, """
                You are an analyst summarising personality survey results for a business dashboard.
                Respond with a JSON object: {"title": string, "summary": string, "sentiment": "POSITIVE"|"NEUTRAL"|"NEGATIVE", "recommendations": [string]}.
                Keep the summary under 80 words and give at most 3 recommendations.

                Surveys: %d
                Responses: %d (completed %d, completion rate %d%%)
                Average satisfaction: %d
                Average completion time: %ds, bounce rate %d%%
                Month-over-month: respondents %.1f%%, completion %.1f%%, satisfaction %.1f%%
                Top traits: %s
                Devices: %s
                """,
                report.surveyCount(),
                report.responseCount(),
                report.completedResponses(),
                report.completionRate(),
                report.averageSatisfactionScore(),
                report.averageCompletionTime(),
                report.engagementMetrics().bounceRate(),
                report.monthOverMonthGrowth().respondents(),
                report.monthOverMonthGrowth().completion(),
                report.monthOverMonthGrowth().satisfaction(),
                traits.isEmpty() ? "none" : traits,
                devices.isEmpty() ? "none" : devices);
    }
}
