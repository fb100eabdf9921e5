package com.accesslist.core.aggregate;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Flat, sparse representation of an access list event, one column per field.
 * Fields a kind does not use are null. For resource connection events
 * {@code identifier} holds the resource identifier.
 */
public record EventValues(
    EventId eventId,
    AccessListEventKind kind,
    Instant eventTime,
    UUID aggregateId,
    String identifier,
    String name,
    String description,
    String resourceOwner,
    Set<String> actions,
    Set<UUID> partyIds
) {
}
