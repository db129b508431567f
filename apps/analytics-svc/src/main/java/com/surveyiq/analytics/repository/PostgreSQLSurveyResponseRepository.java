package com.surveyiq.analytics.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.surveyiq.analytics.entity.SurveyResponseEntity;
import com.surveyiq.analytics.model.SurveyResponse;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLSurveyResponseRepository implements SurveyResponseRepository {

    private static final Logger log = LoggerFactory.getLogger(PostgreSQLSurveyResponseRepository.class);

    private final JpaSurveyResponseRepository jpaSurveyResponseRepository;
    private final ObjectMapper objectMapper;

    public PostgreSQLSurveyResponseRepository(JpaSurveyResponseRepository jpaSurveyResponseRepository, ObjectMapper objectMapper) {
        this.jpaSurveyResponseRepository = jpaSurveyResponseRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public SurveyResponse save(SurveyResponse response) {
        SurveyResponseEntity saved = jpaSurveyResponseRepository.save(toEntity(response));
        return toModel(saved);
    }

    @Override
    public List<SurveyResponse> findByCompanyId(long companyId) {
        return jpaSurveyResponseRepository.findByCompanyId(companyId).stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    public List<SurveyResponse> findBySurveyId(long surveyId) {
        return jpaSurveyResponseRepository.findBySurveyId(surveyId).stream()
                .map(this::toModel)
                .toList();
    }

    private SurveyResponse toModel(SurveyResponseEntity entity) {
        return SurveyResponse.builder()
                .id(entity.getId())
                .surveyId(entity.getSurveyId())
                .companyId(entity.getCompanyId())
                .respondentId(entity.getRespondentId())
                .respondentEmail(entity.getRespondentEmail())
                .ipAddress(entity.getIpAddress())
                .userAgent(entity.getUserAgent())
                .source(entity.getSource())
                .responses(readJson(entity.getId(), entity.getResponses()))
                .traits(readJson(entity.getId(), entity.getTraits()))
                .demographics(readJson(entity.getId(), entity.getDemographics()))
                .genderStereotypes(readJson(entity.getId(), entity.getGenderStereotypes()))
                .productRecommendations(readJson(entity.getId(), entity.getProductRecommendations()))
                .marketSegment(entity.getMarketSegment())
                .completed(entity.isCompleted())
                .satisfactionScore(entity.getSatisfactionScore())
                .completionTimeSeconds(entity.getCompletionTimeSeconds())
                .startTime(entity.getStartTime())
                .completeTime(entity.getCompleteTime())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    // Unparseable column content is kept as a text node; the normalizer decides what to do with it.
    private JsonNode readJson(Long id, String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            log.debug("Response {} holds non-JSON column content: {}", id, ex.getOriginalMessage());
            return TextNode.valueOf(raw);
        }
    }

    private String writeJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize response column", ex);
        }
    }

    private SurveyResponseEntity toEntity(SurveyResponse response) {
        SurveyResponseEntity entity = new SurveyResponseEntity();
        entity.setId(response.id());
        entity.setSurveyId(response.surveyId());
        entity.setCompanyId(response.companyId());
        entity.setRespondentId(response.respondentId());
        entity.setRespondentEmail(response.respondentEmail());
        entity.setIpAddress(response.ipAddress());
        entity.setUserAgent(response.userAgent());
        entity.setSource(response.source());
        entity.setResponses(writeJson(response.responses()));
        entity.setTraits(writeJson(response.traits()));
        entity.setDemographics(writeJson(response.demographics()));
        entity.setGenderStereotypes(writeJson(response.genderStereotypes()));
        entity.setProductRecommendations(writeJson(response.productRecommendations()));
        entity.setMarketSegment(response.marketSegment());
        entity.setCompleted(response.completed());
        entity.setSatisfactionScore(response.satisfactionScore());
        entity.setCompletionTimeSeconds(response.completionTimeSeconds());
        entity.setStartTime(response.startTime());
        entity.setCompleteTime(response.completeTime());
        entity.setCreatedAt(response.createdAt());
        return entity;
    }
}
