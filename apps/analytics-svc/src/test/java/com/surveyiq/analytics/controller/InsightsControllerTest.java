package com.surveyiq.analytics.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.surveyiq.analytics.ai.InsightHighlightService;
import com.surveyiq.analytics.model.InsightHighlight;
import com.surveyiq.analytics.model.StatsReport;
import com.surveyiq.analytics.stats.StatsService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = InsightsController.class)
class InsightsControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    StatsService statsService;

    @MockBean
    InsightHighlightService highlightService;

    @Test
    void summarisesCompanyStats() throws Exception {
        StatsReport report = StatsReport.empty(2);
        when(statsService.computeCompanyStats(5L)).thenReturn(report);
        when(highlightService.generate(report, true)).thenReturn(new InsightHighlight(
                "Strong month", "Volume is up.", InsightHighlight.Sentiment.POSITIVE, List.of("Keep going")));

        mockMvc.perform(get("/companies/5/insights").param("generateAi", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Strong month"))
                .andExpect(jsonPath("$.sentiment").value("POSITIVE"))
                .andExpect(jsonPath("$.recommendations[0]").value("Keep going"));
    }

    @Test
    void aiGenerationIsOffByDefault() throws Exception {
        StatsReport report = StatsReport.empty(0);
        when(statsService.computeCompanyStats(5L)).thenReturn(report);
        when(highlightService.generate(report, false)).thenReturn(new InsightHighlight(
                "No responses yet", "Nothing yet.", InsightHighlight.Sentiment.NEUTRAL, List.of()));

        mockMvc.perform(get("/companies/5/insights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("No responses yet"));

        verify(highlightService).generate(report, false);
    }
}
