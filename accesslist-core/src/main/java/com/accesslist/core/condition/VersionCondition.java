package com.accesslist.core.condition;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * A precondition evaluated against a {@link VersionedEntity}.
 *
 * @param <T> the version tag type the condition carries
 */
@FunctionalInterface
public interface VersionCondition<T> {

    ConditionResult validate(VersionedEntity<T> entity);

    /**
     * Adapts this condition to entities tagged with another type. Each tag held by this
     * condition is converted with {@code converter} before it is compared.
     */
    default <U> VersionCondition<U> map(Function<? super T, ? extends U> converter) {
        Objects.requireNonNull(converter, "converter");
        return entity -> validate(new VersionedEntity<T>() {
            @Override
            public boolean exists() {
                return entity.exists();
            }

            @Override
            public boolean versionEquals(T tag) {
                return entity.versionEquals(converter.apply(tag));
            }

            @Override
            public boolean modifiedSince(Instant since) {
                return entity.modifiedSince(since);
            }
        });
    }
}
