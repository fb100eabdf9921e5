package com.accesslist.engine.service;

import com.accesslist.core.condition.VersionCondition;
import com.accesslist.core.model.AccessListData;
import com.accesslist.core.model.AccessListIncludes;
import com.accesslist.core.model.AccessListInfo;
import com.accesslist.core.model.AccessListMembership;
import com.accesslist.core.model.AccessListResourceConnection;
import com.accesslist.core.model.Conditional;
import com.accesslist.core.model.Page;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Service for managing access lists.
 *
 * Every single-list operation takes a version condition and answers with a {@link Conditional}:
 * not found, condition failed and unmodified are ordinary results, never exceptions. Version
 * tags are the list's committed version. Write operations retry the whole unit of work when
 * they lose an optimistic concurrency race.
 */
public interface AccessListService {

    /**
     * Get one page of the lists owned by a resource owner, ordered by identifier.
     *
     * @param resourceOwner     The resource owner
     * @param continuationToken Token from the previous page, or null for the first page
     * @param includes          Optional parts to include
     * @return The page
     */
    Page<AccessListInfo> getAccessListsByOwner(String resourceOwner, String continuationToken, Set<AccessListIncludes> includes);

    /**
     * Get all lists a party is a member of.
     *
     * @param partyId The party
     * @return Matching lists, ordered by owner and identifier
     */
    List<AccessListInfo> getAccessListsByMember(UUID partyId);

    /**
     * Get a single list.
     */
    Conditional<AccessListInfo, Long> getAccessList(
        String resourceOwner, String identifier, Set<AccessListIncludes> includes, VersionCondition<Long> condition);

    /**
     * Delete a list.
     *
     * @return The list as of its deletion
     */
    Conditional<AccessListInfo, Long> deleteAccessList(
        String resourceOwner, String identifier, VersionCondition<Long> condition);

    /**
     * Create a list, or update the name and description of an existing one.
     * An update that changes nothing records no event.
     *
     * @param request   The desired list metadata
     * @param condition Preconditions; a "must not exist" precondition gives create-only semantics
     */
    Conditional<AccessListInfo, Long> createOrUpdateAccessList(
        UpsertAccessListRequest request, VersionCondition<Long> condition);

    /**
     * Get one page of a list's resource connections, ordered by resource identifier.
     */
    Conditional<AccessListData<Page<AccessListResourceConnection>>, Long> getResourceConnections(
        String resourceOwner, String identifier, String continuationToken, VersionCondition<Long> condition);

    /**
     * Create a resource connection, or add the missing actions to an existing one.
     */
    Conditional<AccessListData<AccessListResourceConnection>, Long> upsertResourceConnection(
        String resourceOwner, String identifier, String resourceIdentifier, Set<String> actions,
        VersionCondition<Long> condition);

    /**
     * Delete a resource connection. Not found if the list has no connection to the resource.
     *
     * @return The connection as it was before deletion
     */
    Conditional<AccessListData<AccessListResourceConnection>, Long> deleteResourceConnection(
        String resourceOwner, String identifier, String resourceIdentifier, VersionCondition<Long> condition);

    /**
     * Get one page of a list's members, ordered by party id.
     */
    Conditional<AccessListData<Page<AccessListMembership>>, Long> getMembers(
        String resourceOwner, String identifier, String continuationToken, VersionCondition<Long> condition);

    /**
     * Add members. Parties that already are members are left alone.
     *
     * @return All members after the change
     */
    Conditional<AccessListData<List<AccessListMembership>>, Long> addMembers(
        String resourceOwner, String identifier, Set<UUID> partyIds, VersionCondition<Long> condition);

    /**
     * Remove members. Parties that are not members are ignored.
     *
     * @return All members after the change
     */
    Conditional<AccessListData<List<AccessListMembership>>, Long> removeMembers(
        String resourceOwner, String identifier, Set<UUID> partyIds, VersionCondition<Long> condition);

    /**
     * Make the member set exactly {@code partyIds}.
     *
     * @return All members after the change
     */
    Conditional<AccessListData<List<AccessListMembership>>, Long> replaceMembers(
        String resourceOwner, String identifier, Set<UUID> partyIds, VersionCondition<Long> condition);

    /**
     * Desired metadata of a list.
     */
    record UpsertAccessListRequest(
        String resourceOwner,
        String identifier,
        String name,
        String description
    ) {}
}
