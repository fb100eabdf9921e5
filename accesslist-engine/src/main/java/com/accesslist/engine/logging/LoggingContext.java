package com.accesslist.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs emitted during an access list operation carry the list's coordinates.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forAccessList("skd", "banks", "delete")) {
 *     log.info("Deleting access list"); // Automatically includes resourceOwner, identifier, operation
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [http-nio-8080-exec-1] INFO  c.a.e.c.AccessListCoordinator - Deleting access list
 *   resourceOwner=skd identifier=banks operation=delete traceId=5f2c9a1e
 */
public final class LoggingContext implements AutoCloseable {

    public static final String ACCESS_LIST_ID = "accessListId";
    public static final String RESOURCE_OWNER = "resourceOwner";
    public static final String IDENTIFIER = "identifier";
    public static final String OPERATION = "operation";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for an operation on a list addressed by owner and identifier.
     */
    public static LoggingContext forAccessList(String resourceOwner, String identifier, String operation) {
        LoggingContext ctx = new LoggingContext();
        if (resourceOwner != null) {
            MDC.put(RESOURCE_OWNER, resourceOwner);
        }
        if (identifier != null) {
            MDC.put(IDENTIFIER, identifier);
        }
        if (operation != null) {
            MDC.put(OPERATION, operation);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for an operation that is not about a single list.
     */
    public static LoggingContext forOperation(String operation) {
        return forAccessList(null, null, operation);
    }

    /**
     * Add the aggregate id once it is known.
     */
    public static void setAccessListId(UUID accessListId) {
        if (accessListId != null) {
            MDC.put(ACCESS_LIST_ID, accessListId.toString());
        }
    }

    /**
     * Record the current attempt of a retried operation.
     */
    public static void setAttempt(int attempt) {
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(ACCESS_LIST_ID);
        MDC.remove(RESOURCE_OWNER);
        MDC.remove(IDENTIFIER);
        MDC.remove(OPERATION);
        MDC.remove(ATTEMPT);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
