package com.surveyiq.analytics.controller;

import com.surveyiq.analytics.model.StatsReport;
import com.surveyiq.analytics.stats.StatsService;
import com.surveyiq.analytics.web.RequestContextHolder;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
public class StatsController {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping("/companies/{companyId}/stats")
    public ResponseEntity<StatsReport> getCompanyStats(@PathVariable("companyId") @Positive long companyId) {
        RequestContextHolder.setCompanyId(companyId);
        return ResponseEntity.ok(statsService.computeCompanyStats(companyId));
    }

    @GetMapping("/surveys/{surveyId}/analytics")
    public ResponseEntity<StatsReport> getSurveyAnalytics(@PathVariable("surveyId") @Positive long surveyId) {
        return ResponseEntity.ok(statsService.computeSurveyStats(surveyId));
    }
}
