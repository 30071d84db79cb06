package com.linkdeck.observability;

/**
 * Immutable correlation context that flows with one inbound request.
 * <p>
 * The session middleware fills in {@code userId} once the caller is verified and the
 * org-permission middleware fills in {@code orgId} once the organization is resolved, so
 * every log line written after those points carries both.
 *
 * @param correlationId unique ID for the request chain (propagated via {@code X-Correlation-ID})
 * @param orgId         organization the request acts within (nullable until resolved)
 * @param userId        verified caller (nullable until the session is validated)
 * @param requestId     unique ID for this specific request
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String orgId,
        String userId,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for organization ID. */
    public static final String MDC_ORG_ID = "orgId";

    /** MDC key for user ID (always written truncated). */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for span ID. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context that only carries a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null, null);
    }

    /** Returns a copy bound to the given user. */
    public CorrelationContext withUser(String userId) {
        return new CorrelationContext(correlationId, orgId, userId, requestId, spanId, traceId);
    }

    /** Returns a copy bound to the given organization. */
    public CorrelationContext withOrg(String orgId) {
        return new CorrelationContext(correlationId, orgId, userId, requestId, spanId, traceId);
    }
}
