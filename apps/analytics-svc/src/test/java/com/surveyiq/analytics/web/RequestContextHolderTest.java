package com.surveyiq.analytics.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RequestContextHolderTest {

    @AfterEach
    void tearDown() {
        RequestContextHolder.clear();
    }

    @Test
    void companyScopeKeepsExistingTraceId() {
        RequestContextHolder.set(RequestContextHolder.RequestContext.builder().traceId("t-1").build());

        RequestContextHolder.setCompanyId(9L);

        assertThat(RequestContextHolder.get()).contains(new RequestContextHolder.RequestContext(9L, "t-1"));
    }

    @Test
    void companyScopeWithoutFilterHasNoTraceId() {
        RequestContextHolder.setCompanyId(9L);

        assertThat(RequestContextHolder.get()).contains(new RequestContextHolder.RequestContext(9L, null));
    }
}
