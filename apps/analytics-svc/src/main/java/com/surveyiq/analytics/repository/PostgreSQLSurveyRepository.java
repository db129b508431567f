package com.surveyiq.analytics.repository;

import com.surveyiq.analytics.entity.SurveyEntity;
import com.surveyiq.analytics.model.Survey;
import java.util.List;
import java.util.Optional;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLSurveyRepository implements SurveyRepository {

    private final JpaSurveyRepository jpaSurveyRepository;

    public PostgreSQLSurveyRepository(JpaSurveyRepository jpaSurveyRepository) {
        this.jpaSurveyRepository = jpaSurveyRepository;
    }

    @Override
    public Survey save(Survey survey) {
        SurveyEntity saved = jpaSurveyRepository.save(new SurveyEntity(
                survey.id(), survey.companyId(), survey.title(), survey.description(), survey.industry()));
        return toModel(saved);
    }

    @Override
    public Optional<Survey> findById(long surveyId) {
        return jpaSurveyRepository.findById(surveyId).map(this::toModel);
    }

    @Override
    public List<Survey> findByCompanyId(long companyId) {
        return jpaSurveyRepository.findByCompanyIdOrderById(companyId).stream()
                .map(this::toModel)
                .toList();
    }

    private Survey toModel(SurveyEntity entity) {
        return new Survey(
                entity.getId(),
                entity.getCompanyId(),
                entity.getTitle(),
                entity.getDescription(),
                entity.getIndustry()
        );
    }
}
