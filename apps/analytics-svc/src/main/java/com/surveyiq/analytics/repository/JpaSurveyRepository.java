package com.surveyiq.analytics.repository;

import com.surveyiq.analytics.entity.SurveyEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaSurveyRepository extends JpaRepository<SurveyEntity, Long> {

    List<SurveyEntity> findByCompanyIdOrderById(Long companyId);
}
