/**
 * Request correlation for Warden services.
 *
 * <p>{@link com.warden.observability.CorrelationContext} carries the correlation ID, request ID
 * and, once resolved, the caller's user ID and authentication method. {@link
 * com.warden.observability.CorrelationContextHolder} keeps it per thread and mirrors it into the
 * SLF4J MDC so log lines carry it without explicit parameters.
 */
package com.warden.observability;
