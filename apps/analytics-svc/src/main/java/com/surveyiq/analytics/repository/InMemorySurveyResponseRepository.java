package com.surveyiq.analytics.repository;

import com.surveyiq.analytics.model.SurveyResponse;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemorySurveyResponseRepository implements SurveyResponseRepository {

    private final Map<Long, SurveyResponse> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public SurveyResponse save(SurveyResponse response) {
        SurveyResponse stored = response.id() != null
                ? response
                : response.toBuilder().id(sequence.incrementAndGet()).build();
        storage.put(stored.id(), stored);
        return stored;
    }

    @Override
    public List<SurveyResponse> findByCompanyId(long companyId) {
        return find(response -> Objects.equals(response.companyId(), companyId));
    }

    @Override
    public List<SurveyResponse> findBySurveyId(long surveyId) {
        return find(response -> Objects.equals(response.surveyId(), surveyId));
    }

    private List<SurveyResponse> find(Predicate<SurveyResponse> filter) {
        return storage.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(SurveyResponse::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
