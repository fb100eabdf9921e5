package com.accesslist.core.model;

import com.accesslist.core.condition.VersionedEntity;

import java.time.Instant;
import java.util.UUID;
import java.util.function.Function;

/**
 * A piece of access list data together with the version of the list it was read from.
 */
public record AccessListData<T>(UUID id, Instant updatedAt, long version, T value)
    implements VersionedEntity<Long> {

    public static <T> AccessListData<T> of(AccessListInfo info, T value) {
        return new AccessListData<>(info.id(), info.updatedAt(), info.version(), value);
    }

    public <U> AccessListData<U> map(Function<? super T, ? extends U> mapper) {
        return new AccessListData<>(id, updatedAt, version, mapper.apply(value));
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
