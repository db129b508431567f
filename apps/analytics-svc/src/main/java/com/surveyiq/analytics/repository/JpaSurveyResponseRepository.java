package com.surveyiq.analytics.repository;

import com.surveyiq.analytics.entity.SurveyResponseEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaSurveyResponseRepository extends JpaRepository<SurveyResponseEntity, Long> {

    @Query("SELECT r FROM SurveyResponseEntity r WHERE r.companyId = :companyId ORDER BY r.id")
    List<SurveyResponseEntity> findByCompanyId(@Param("companyId") Long companyId);

    @Query("SELECT r FROM SurveyResponseEntity r WHERE r.surveyId = :surveyId ORDER BY r.id")
    List<SurveyResponseEntity> findBySurveyId(@Param("surveyId") Long surveyId);
}
