package com.accesslist.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Addresses an access list either by its id or by owner and identifier.
 */
public record AccessListIdentifier(UUID id, String resourceOwner, String identifier) {

    public static AccessListIdentifier byId(UUID id) {
        return new AccessListIdentifier(Objects.requireNonNull(id, "id"), null, null);
    }

    public static AccessListIdentifier byName(String resourceOwner, String identifier) {
        return new AccessListIdentifier(null,
            Objects.requireNonNull(resourceOwner, "resourceOwner"),
            Objects.requireNonNull(identifier, "identifier"));
    }

    public boolean isById() {
        return id != null;
    }

    @Override
    public String toString() {
        return isById() ? id.toString() : resourceOwner + "/" + identifier;
    }
}
