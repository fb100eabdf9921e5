package com.accesslist.core.aggregate;

import java.time.Instant;
import java.util.UUID;

/**
 * An entity whose state is derived by folding its ordered event history.
 */
public interface Aggregate {

    UUID id();

    /**
     * Id of the last committed event, or {@link EventId#UNSET} if nothing is committed.
     * Used as the optimistic concurrency token.
     */
    EventId committedVersion();

    Instant createdAt();

    Instant updatedAt();

    boolean hasUncommittedEvents();

    /**
     * Marks every event in the log as committed.
     *
     * @throws IllegalStateException if an event being committed has no persisted id
     */
    void commit();
}
