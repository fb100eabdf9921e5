package com.accesslist.core.exception;

import java.util.UUID;

/**
 * Thrown when persisting an aggregate loses the race against a concurrent writer.
 * The whole load-validate-mutate-save cycle has to be restarted.
 */
public class OptimisticConcurrencyException extends RegistryException {

    public static final String ERROR_CODE = "OPTIMISTIC_CONCURRENCY_CONFLICT";

    private final UUID aggregateId;
    private final long expectedVersion;

    public OptimisticConcurrencyException(UUID aggregateId, long expectedVersion) {
        super(ERROR_CODE, String.format(
            "Concurrent modification of aggregate %s: expected committed version %d",
            aggregateId, expectedVersion
        ));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
    }

    public OptimisticConcurrencyException(UUID aggregateId, long expectedVersion, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Concurrent modification of aggregate %s: expected committed version %d",
            aggregateId, expectedVersion
        ), cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
    }

    private OptimisticConcurrencyException(String message) {
        super(ERROR_CODE, message);
        this.aggregateId = null;
        this.expectedVersion = 0;
    }

    /**
     * A create lost against a concurrent creator whose list was gone again by the time it was loaded.
     */
    public static OptimisticConcurrencyException listVanished(String resourceOwner, String identifier) {
        return new OptimisticConcurrencyException(String.format(
            "Access list %s/%s was deleted while being created", resourceOwner, identifier));
    }

    /**
     * @return the aggregate id, or null if the conflict happened before the aggregate was known
     */
    public UUID getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
