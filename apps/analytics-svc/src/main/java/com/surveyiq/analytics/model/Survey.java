package com.surveyiq.analytics.model;

public record Survey(
        Long id,
        Long companyId,
        String title,
        String description,
        String industry
) {
    public boolean hasIndustry() {
        return industry != null && !industry.isBlank();
    }
}
