package com.accesslist.core.repository;

import com.accesslist.core.aggregate.AccessListAggregate;
import com.accesslist.core.model.AccessListData;
import com.accesslist.core.model.AccessListIdentifier;
import com.accesslist.core.model.AccessListIncludes;
import com.accesslist.core.model.AccessListInfo;
import com.accesslist.core.model.AccessListMembership;
import com.accesslist.core.model.AccessListResourceConnection;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Repository for access list aggregates and their read models.
 *
 * <p>Aggregates are loaded by replaying their committed events. {@link #applyChanges} persists
 * the uncommitted events of an aggregate, numbering them {@code committedVersion + 1, + 2, ...},
 * and fails with an {@link com.accesslist.core.exception.OptimisticConcurrencyException} when
 * another writer got there first. Deleted lists are invisible to every lookup.</p>
 */
public interface AccessListRepository {

    /**
     * Lists owned by {@code resourceOwner}, ordered by identifier, starting at
     * {@code continueFrom} (inclusive) when given.
     */
    List<AccessListInfo> getAccessListsByOwner(
        String resourceOwner, String continueFrom, int count, Set<AccessListIncludes> includes);

    /**
     * Lists that have {@code partyId} as a member, ordered by owner and identifier.
     */
    List<AccessListInfo> getAccessListsByMember(UUID partyId);

    Optional<AccessListInfo> lookupInfo(AccessListIdentifier identifier, Set<AccessListIncludes> includes);

    /**
     * Resource connections ordered by resource identifier, starting at {@code continueFrom} (inclusive).
     */
    Optional<AccessListData<List<AccessListResourceConnection>>> getResourceConnections(
        AccessListIdentifier identifier, String continueFrom, int count, boolean includeActions);

    /**
     * Memberships ordered by party id, starting at {@code continueFrom} (inclusive).
     */
    Optional<AccessListData<List<AccessListMembership>>> getMemberships(
        AccessListIdentifier identifier, UUID continueFrom, int count);

    /**
     * Creates and persists a new list.
     *
     * @throws com.accesslist.core.exception.DuplicateAccessListException if owner and identifier are taken
     */
    AccessListAggregate createAccessList(String resourceOwner, String identifier, String name, String description);

    /**
     * Atomically creates the list, or loads it if owner and identifier are already taken.
     *
     * @return empty if the existing list vanished between the failed create and the load;
     *         the caller should retry in a new transaction
     */
    Optional<AccessListLoadOrCreateResult> loadOrCreate(
        String resourceOwner, String identifier, String name, String description);

    Optional<AccessListAggregate> load(UUID id);

    Optional<AccessListAggregate> load(String resourceOwner, String identifier);

    default Optional<AccessListAggregate> load(AccessListIdentifier identifier) {
        return identifier.isById()
            ? load(identifier.id())
            : load(identifier.resourceOwner(), identifier.identifier());
    }

    /**
     * Persists and commits the uncommitted events of {@code aggregate}.
     *
     * @return the number of events persisted
     */
    int applyChanges(AccessListAggregate aggregate);
}
