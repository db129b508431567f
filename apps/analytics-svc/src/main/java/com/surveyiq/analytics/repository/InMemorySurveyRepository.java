package com.surveyiq.analytics.repository;

import com.surveyiq.analytics.model.Survey;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemorySurveyRepository implements SurveyRepository {

    private final Map<Long, Survey> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Survey save(Survey survey) {
        Survey stored = survey.id() != null
                ? survey
                : new Survey(sequence.incrementAndGet(), survey.companyId(), survey.title(), survey.description(), survey.industry());
        storage.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<Survey> findById(long surveyId) {
        return Optional.ofNullable(storage.get(surveyId));
    }

    @Override
    public List<Survey> findByCompanyId(long companyId) {
        return storage.values().stream()
                .filter(survey -> Objects.equals(survey.companyId(), companyId))
                .sorted(Comparator.comparing(Survey::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
