package com.surveyiq.analytics.controller;

import com.surveyiq.analytics.ai.InsightHighlightService;
import com.surveyiq.analytics.model.InsightHighlight;
import com.surveyiq.analytics.model.StatsReport;
import com.surveyiq.analytics.stats.StatsService;
import com.surveyiq.analytics.web.RequestContextHolder;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
public class InsightsController {

    private final StatsService statsService;
    private final InsightHighlightService highlightService;

    public InsightsController(StatsService statsService, InsightHighlightService highlightService) {
        this.statsService = statsService;
        this.highlightService = highlightService;
    }

    @GetMapping("/companies/{companyId}/insights")
    public ResponseEntity<InsightHighlight> getCompanyInsights(
            @PathVariable("companyId") @Positive long companyId,
            @RequestParam(value = "generateAi", required = false, defaultValue = "false") boolean generateAi
    ) {
        RequestContextHolder.setCompanyId(companyId);
        StatsReport report = statsService.computeCompanyStats(companyId);
        return ResponseEntity.ok(highlightService.generate(report, generateAi));
    }
}
