package com.sponsorsync.observability;

/**
 * Immutable correlation data for one request.
 * <p>
 * The web edge establishes a {@code CorrelationContext} for every incoming request. Its values are
 * injected into SLF4J MDC so that every log line written while serving the request carries them.
 * It is a logging aid only: authorization never reads the principal from here.
 *
 * @param correlationId unique ID for the business flow, propagated from or returned to the client
 * @param principalId   authenticated principal performing the action (nullable for anonymous calls)
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String principalId,
        String requestId
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for principal ID.
     */
    public static final String MDC_PRINCIPAL_ID = "principalId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Rejects a null or blank correlationId.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
