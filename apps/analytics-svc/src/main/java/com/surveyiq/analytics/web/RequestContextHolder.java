package com.surveyiq.analytics.web;

import java.util.Optional;

public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static void setCompanyId(Long companyId) {
        RequestContext current = CONTEXT.get();
        CONTEXT.set(RequestContext.builder()
                .traceId(current != null ? current.traceId() : null)
                .companyId(companyId)
                .build());
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /** @param companyId tenant the request is scoped to, {@code null} for survey-scoped requests */
    public record RequestContext(Long companyId, String traceId) {

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Long companyId;
            private String traceId;

            public Builder companyId(Long companyId) {
                this.companyId = companyId;
                return this;
            }

            public Builder traceId(String traceId) {
                this.traceId = traceId;
                return this;
            }

            public RequestContext build() {
                return new RequestContext(companyId, traceId);
            }
        }
    }
}
