package com.accesslist.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A resource an access list is connected to, with the actions allowed on it.
 * {@code actions} is null when the caller did not ask for them.
 */
public record AccessListResourceConnection(
    String resourceIdentifier,
    Set<String> actions,
    Instant createdAt,
    Instant modifiedAt
) {
    public AccessListResourceConnection {
        if (actions != null) {
            actions = Collections.unmodifiableSortedSet(new TreeSet<>(actions));
        }
    }

    public AccessListResourceConnection withoutActions() {
        return new AccessListResourceConnection(resourceIdentifier, null, createdAt, modifiedAt);
    }
}
