package com.surveyiq.analytics.entity;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "survey_responses")
public class SurveyResponseEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "survey_id", nullable = false)
    private Long surveyId;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "respondent_id")
    private String respondentId;

    @Column(name = "respondent_email")
    private String respondentEmail;

    @Column(name = "ip_address")
    private String ipAddress;

    @Column(name = "user_agent")
    private String userAgent;

    @Column(name = "source")
    private String source;

    // jsonb columns; content is not guaranteed to match any shape
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "responses")
    private String responses;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "traits")
    private String traits;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "demographics")
    private String demographics;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "gender_stereotypes")
    private String genderStereotypes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "product_recommendations")
    private String productRecommendations;

    @Column(name = "market_segment")
    private String marketSegment;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    @Column(name = "satisfaction_score")
    private Integer satisfactionScore;

    @Column(name = "completion_time_seconds")
    private Integer completionTimeSeconds;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "complete_time")
    private Instant completeTime;

    @Column(name = "created_at")
    private Instant createdAt;

    // Default constructor for JPA
    public SurveyResponseEntity() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getSurveyId() { return surveyId; }
    public void setSurveyId(Long surveyId) { this.surveyId = surveyId; }

    public Long getCompanyId() { return companyId; }
    public void setCompanyId(Long companyId) { this.companyId = companyId; }

    public String getRespondentId() { return respondentId; }
    public void setRespondentId(String respondentId) { this.respondentId = respondentId; }

    public String getRespondentEmail() { return respondentEmail; }
    public void setRespondentEmail(String respondentEmail) { this.respondentEmail = respondentEmail; }

    public String getIpAddress() { return ipAddress; }
    public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getResponses() { return responses; }
    public void setResponses(String responses) { this.responses = responses; }

    public String getTraits() { return traits; }
    public void setTraits(String traits) { this.traits = traits; }

    public String getDemographics() { return demographics; }
    public void setDemographics(String demographics) { this.demographics = demographics; }

    public String getGenderStereotypes() { return genderStereotypes; }
    public void setGenderStereotypes(String genderStereotypes) { this.genderStereotypes = genderStereotypes; }

    public String getProductRecommendations() { return productRecommendations; }
    public void setProductRecommendations(String productRecommendations) { this.productRecommendations = productRecommendations; }

    public String getMarketSegment() { return marketSegment; }
    public void setMarketSegment(String marketSegment) { this.marketSegment = marketSegment; }

    public boolean isCompleted() { return completed; }
    public void setCompleted(boolean completed) { this.completed = completed; }

    public Integer getSatisfactionScore() { return satisfactionScore; }
    public void setSatisfactionScore(Integer satisfactionScore) { this.satisfactionScore = satisfactionScore; }

    public Integer getCompletionTimeSeconds() { return completionTimeSeconds; }
    public void setCompletionTimeSeconds(Integer completionTimeSeconds) { this.completionTimeSeconds = completionTimeSeconds; }

    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }

    public Instant getCompleteTime() { return completeTime; }
    public void setCompleteTime(Instant completeTime) { this.completeTime = completeTime; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
