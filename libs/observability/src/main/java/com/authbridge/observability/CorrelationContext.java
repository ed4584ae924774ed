package com.authbridge.observability;

/**
 * Immutable correlation context that flows through a single bridge request.
 * <p>
 * Every incoming HTTP request establishes a {@code CorrelationContext}. The values are
 * echoed back to the caller and injected into SLF4J MDC so that every log line written
 * while the request is being served carries them.
 *
 * @param correlationId unique ID for the request chain (propagated from the proxy when present)
 * @param userId        username asserted by the upstream proxy (nullable until the identity is known)
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String requestId
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for user ID.
     */
    public static final String MDC_USER_ID = "userId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to the given user.
     */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId, requestId);
    }
}
