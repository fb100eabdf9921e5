package com.accesslist.core.exception;

/**
 * Thrown when an operation kept losing optimistic concurrency races until the retry budget ran out.
 * Callers should treat it as transient.
 */
public class RetriesExhaustedException extends RegistryException {

    public static final String ERROR_CODE = "CONCURRENCY_RETRIES_EXHAUSTED";

    public RetriesExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(ERROR_CODE, String.format(
            "Operation %s gave up after %d attempts due to concurrent modifications",
            operation, attempts
        ), lastFailure);
    }
}
