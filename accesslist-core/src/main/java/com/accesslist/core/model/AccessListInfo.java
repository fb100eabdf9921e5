package com.accesslist.core.model;

import com.accesslist.core.condition.VersionedEntity;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Committed snapshot of an access list's metadata.
 * {@code resourceConnections} is null unless it was requested through {@link AccessListIncludes}.
 * The version tag is the id of the last committed event.
 */
public record AccessListInfo(
    UUID id,
    String resourceOwner,
    String identifier,
    String name,
    String description,
    Instant createdAt,
    Instant updatedAt,
    List<AccessListResourceConnection> resourceConnections,
    long version
) implements VersionedEntity<Long> {

    public AccessListInfo {
        if (resourceConnections != null) {
            resourceConnections = List.copyOf(resourceConnections);
        }
    }

    public AccessListInfo withResourceConnections(List<AccessListResourceConnection> connections) {
        return new AccessListInfo(id, resourceOwner, identifier, name, description,
            createdAt, updatedAt, connections, version);
    }

    @Override
    public boolean exists() {
        return true;
    }

    @Override
    public boolean versionEquals(Long tag) {
        return tag != null && tag == version;
    }

    @Override
    public boolean modifiedSince(Instant since) {
        return VersionedEntity.isModifiedSince(updatedAt, since);
    }
}
