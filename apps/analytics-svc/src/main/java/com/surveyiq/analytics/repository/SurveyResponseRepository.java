package com.surveyiq.analytics.repository;

import com.surveyiq.analytics.model.SurveyResponse;
import java.util.List;

public interface SurveyResponseRepository {

    SurveyResponse save(SurveyResponse response);

    List<SurveyResponse> findByCompanyId(long companyId);

    List<SurveyResponse> findBySurveyId(long surveyId);
}
