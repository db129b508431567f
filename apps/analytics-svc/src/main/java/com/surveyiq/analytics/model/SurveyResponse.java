package com.surveyiq.analytics.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * One respondent's submission as read from storage. The JSON-shaped columns are kept as raw
 * {@link JsonNode}s: they may hold objects, arrays, JSON-encoded strings or junk, and are only
 * interpreted by {@code ResponseNormalizer}.
 */
public record SurveyResponse(
        Long id,
        Long surveyId,
        Long companyId,
        String respondentId,
        String respondentEmail,
        String ipAddress,
        String userAgent,
        String source,
        JsonNode responses,
        JsonNode traits,
        JsonNode demographics,
        JsonNode genderStereotypes,
        JsonNode productRecommendations,
        String marketSegment,
        boolean completed,
        Integer satisfactionScore,
        Integer completionTimeSeconds,
        Instant startTime,
        Instant completeTime,
        Instant createdAt,
        boolean anonymized
) {

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .surveyId(surveyId)
                .companyId(companyId)
                .respondentId(respondentId)
                .respondentEmail(respondentEmail)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .source(source)
                .responses(responses)
                .traits(traits)
                .demographics(demographics)
                .genderStereotypes(genderStereotypes)
                .productRecommendations(productRecommendations)
                .marketSegment(marketSegment)
                .completed(completed)
                .satisfactionScore(satisfactionScore)
                .completionTimeSeconds(completionTimeSeconds)
                .startTime(startTime)
                .completeTime(completeTime)
                .createdAt(createdAt)
                .anonymized(anonymized);
    }

    public static final class Builder {
        private Long id;
        private Long surveyId;
        private Long companyId;
        private String respondentId;
        private String respondentEmail;
        private String ipAddress;
        private String userAgent;
        private String source;
        private JsonNode responses;
        private JsonNode traits;
        private JsonNode demographics;
        private JsonNode genderStereotypes;
        private JsonNode productRecommendations;
        private String marketSegment;
        private boolean completed;
        private Integer satisfactionScore;
        private Integer completionTimeSeconds;
        private Instant startTime;
        private Instant completeTime;
        private Instant createdAt;
        private boolean anonymized;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder surveyId(Long surveyId) {
            this.surveyId = surveyId;
            return this;
        }

        public Builder companyId(Long companyId) {
            this.companyId = companyId;
            return this;
        }

        public Builder respondentId(String respondentId) {
            this.respondentId = respondentId;
            return this;
        }

        public Builder respondentEmail(String respondentEmail) {
            this.respondentEmail = respondentEmail;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder responses(JsonNode responses) {
            this.responses = responses;
            return this;
        }

        public Builder traits(JsonNode traits) {
            this.traits = traits;
            return this;
        }

        public Builder demographics(JsonNode demographics) {
            this.demographics = demographics;
            return this;
        }

        public Builder genderStereotypes(JsonNode genderStereotypes) {
            this.genderStereotypes = genderStereotypes;
            return this;
        }

        public Builder productRecommendations(JsonNode productRecommendations) {
            this.productRecommendations = productRecommendations;
            return this;
        }

        public Builder marketSegment(String marketSegment) {
            this.marketSegment = marketSegment;
            return this;
        }

        public Builder completed(boolean completed) {
            this.completed = completed;
            return this;
        }

        public Builder satisfactionScore(Integer satisfactionScore) {
            this.satisfactionScore = satisfactionScore;
            return this;
        }

        public Builder completionTimeSeconds(Integer completionTimeSeconds) {
            this.completionTimeSeconds = completionTimeSeconds;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder completeTime(Instant completeTime) {
            this.completeTime = completeTime;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder anonymized(boolean anonymized) {
            this.anonymized = anonymized;
            return this;
        }

        public SurveyResponse build() {
            return new SurveyResponse(
                    id,
                    surveyId,
                    companyId,
                    respondentId,
                    respondentEmail,
                    ipAddress,
                    userAgent,
                    source,
                    responses,
                    traits,
                    demographics,
                    genderStereotypes,
                    productRecommendations,
                    marketSegment,
                    completed,
                    satisfactionScore,
                    completionTimeSeconds,
                    startTime,
                    completeTime,
                    createdAt,
                    anonymized
            );
        }
    }
}
