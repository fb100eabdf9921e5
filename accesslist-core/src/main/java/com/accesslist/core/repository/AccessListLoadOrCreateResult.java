package com.accesslist.core.repository;

import com.accesslist.core.aggregate.AccessListAggregate;

/**
 * Outcome of {@link AccessListRepository#loadOrCreate}: the aggregate and whether this call created it.
 */
public record AccessListLoadOrCreateResult(Mode mode, AccessListAggregate aggregate) {

    public enum Mode {
        CREATED,
        LOADED
    }

    public static AccessListLoadOrCreateResult created(AccessListAggregate aggregate) {
        return new AccessListLoadOrCreateResult(Mode.CREATED, aggregate);
    }

    public static AccessListLoadOrCreateResult loaded(AccessListAggregate aggregate) {
        return new AccessListLoadOrCreateResult(Mode.LOADED, aggregate);
    }

    public boolean isCreated() {
        return mode == Mode.CREATED;
    }
}
