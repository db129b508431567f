package com.surveyiq.analytics.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "surveyiq")
public record SurveyIqProperties(
        Stats stats,
        Ai ai,
        Export export
) {

    @ConstructorBinding
    public SurveyIqProperties {
        if (ai == null) {
            throw new IllegalArgumentException("ai configuration must be provided");
        }
        // stats and export fall back to defaults via their accessors
    }

    public Stats stats() {
        return stats != null ? stats : new Stats(null);
    }

    public Export export() {
        return export != null ? export : new Export(null);
    }

    public record Stats(String timezone) {
        public Stats {
            if (timezone == null || timezone.isBlank()) {
                timezone = "UTC";
            }
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException ex) {
                throw new IllegalArgumentException("timezone must be a valid zone id: " + timezone, ex);
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(timezone);
        }
    }

    public record Ai(String model, String endpoint, String apiKey) {
        public Ai {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("model must be provided");
            }
            if (endpoint == null || endpoint.isBlank()) {
                throw new IllegalArgumentException("endpoint must be provided");
            }
            // apiKey may be null/blank; insights then use the deterministic fallback
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public record Export(Integer redactionThreshold) {
        public static final int DEFAULT_REDACTION_THRESHOLD = 100;

        public Export {
            if (redactionThreshold == null) {
                redactionThreshold = DEFAULT_REDACTION_THRESHOLD;
            }
            if (redactionThreshold <= 0) {
                throw new IllegalArgumentException("redactionThreshold must be positive");
            }
        }
    }
}
