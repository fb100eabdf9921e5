package com.accesslist.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A party that is a member of an access list, and since when.
 */
public record AccessListMembership(UUID partyId, Instant since) {
}
