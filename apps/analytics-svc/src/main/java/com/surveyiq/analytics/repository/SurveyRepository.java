package com.surveyiq.analytics.repository;

import com.surveyiq.analytics.model.Survey;
import java.util.List;
import java.util.Optional;

public interface SurveyRepository {

    Survey save(Survey survey);

    Optional<Survey> findById(long surveyId);

    List<Survey> findByCompanyId(long companyId);
}
