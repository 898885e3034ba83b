package com.warden.observability;

/**
 * Immutable correlation context that flows with a single HTTP request.
 * <p>
 * A context is established as soon as a request enters the service and is enriched once
 * the caller's identity has been resolved. The values are injected into SLF4J MDC so every
 * log line written while handling the request carries them.
 *
 * @param correlationId unique ID for the business flow, propagated via {@code X-Correlation-ID}
 * @param requestId     unique ID for this specific request
 * @param userId        resolved user id (nullable until identity resolution ran, or for anonymous callers)
 * @param authMethod    mechanism that produced the identity (nullable until identity resolution ran)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String userId,
        String authMethod
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * MDC key for user ID.
     */
    public static final String MDC_USER_ID = "userId";

    /**
     * MDC key for the authentication method.
     */
    public static final String MDC_AUTH_METHOD = "authMethod";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context for a request whose caller has not been identified yet.
     */
    public static CorrelationContext of(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, requestId, null, null);
    }

    /**
     * Returns a copy of this context carrying the resolved identity.
     *
     * @param userId     resolved user id, or null for anonymous callers
     * @param authMethod name of the mechanism that resolved the identity
     */
    public CorrelationContext withIdentity(String userId, String authMethod) {
        return new CorrelationContext(correlationId, requestId, userId, authMethod);
    }
}
