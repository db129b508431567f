package com.surveyiq.analytics.export;

import com.surveyiq.analytics.model.Survey;
import com.surveyiq.analytics.model.SurveyResponse;
import com.surveyiq.analytics.repository.SurveyRepository;
import com.surveyiq.analytics.repository.SurveyResponseRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ResponseExportService {

    private static final Logger log = LoggerFactory.getLogger(ResponseExportService.class);

    private final SurveyRepository surveyRepository;
    private final SurveyResponseRepository responseRepository;
    private final ResponseAnonymizer anonymizer;
    private final ResponseCsvExporter csvExporter;

    public ResponseExportService(
            SurveyRepository surveyRepository,
            SurveyResponseRepository responseRepository,
            ResponseAnonymizer anonymizer,
            ResponseCsvExporter csvExporter
    ) {
        this.surveyRepository = surveyRepository;
        this.responseRepository = responseRepository;
        this.anonymizer = anonymizer;
        this.csvExporter = csvExporter;
    }

    /**
     * @throws SurveyNotFoundException when the survey does not exist
     */
    public String exportSurvey(long surveyId, boolean anonymize) {
        Survey survey = surveyRepository.findById(surveyId)
                .orElseThrow(() -> new SurveyNotFoundException(surveyId));
        List<SurveyResponse> responses = responseRepository.findBySurveyId(surveyId);
        if (anonymize) {
            responses = anonymizer.anonymizeAll(responses);
        }
        log.info("Exporting {} responses for survey {} (anonymized={})", responses.size(), surveyId, anonymize);
        return csvExporter.toCsv(responses, survey);
    }
}
