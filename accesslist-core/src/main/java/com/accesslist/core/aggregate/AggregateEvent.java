package com.accesslist.core.aggregate;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable fact about a change to one aggregate.
 */
public interface AggregateEvent {

    /**
     * Sequence id, {@link EventId#UNSET} until persisted.
     */
    EventId eventId();

    UUID aggregateId();

    Instant eventTime();
}
