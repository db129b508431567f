package com.surveyiq.analytics.controller;

import com.surveyiq.analytics.export.ResponseExportService;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
public class ExportController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv;charset=UTF-8");

    private final ResponseExportService exportService;

    public ExportController(ResponseExportService exportService) {
        this.exportService = exportService;
    }

    @GetMapping("/surveys/{surveyId}/responses/export")
    public ResponseEntity<String> exportResponses(
            @PathVariable("surveyId") @Positive long surveyId,
            @RequestParam(value = "anonymize", required = false, defaultValue = "false") boolean anonymize
    ) {
        String csv = exportService.exportSurvey(surveyId, anonymize);
        String filename = "survey-" + surveyId + (anonymize ? "-anonymized" : "") + "-responses.csv";
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
                .body(csv);
    }
}
