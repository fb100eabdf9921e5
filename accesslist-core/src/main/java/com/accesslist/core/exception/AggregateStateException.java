package com.accesslist.core.exception;

import java.util.UUID;

/**
 * Thrown when a mutation is attempted on an aggregate in the wrong lifecycle state
 * (uninitialized, already initialized or deleted).
 */
public class AggregateStateException extends RegistryException {

    public static final String ERROR_CODE = "AGGREGATE_STATE_VIOLATION";

    public AggregateStateException(UUID aggregateId, String reason) {
        super(ERROR_CODE, String.format("%s: %s", reason, aggregateId));
    }

    public static AggregateStateException notInitialized(UUID aggregateId) {
        return new AggregateStateException(aggregateId, "Aggregate not initialized");
    }

    public static AggregateStateException deleted(UUID aggregateId) {
        return new AggregateStateException(aggregateId, "Aggregate deleted");
    }

    public static AggregateStateException alreadyInitialized(UUID aggregateId) {
        return new AggregateStateException(aggregateId, "Aggregate already initialized");
    }
}
