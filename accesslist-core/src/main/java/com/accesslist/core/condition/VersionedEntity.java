package com.accesslist.core.condition;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Anything that exposes a version tag and a last-modified instant, and can therefore be the
 * subject of a {@link VersionCondition}.
 *
 * @param <T> the version tag type
 */
public interface VersionedEntity<T> {

    boolean exists();

    /**
     * Only true if the entity {@link #exists()}.
     */
    boolean versionEquals(T tag);

    /**
     * Whether the entity changed after {@code since}, comparing at whole-second resolution.
     * Only true if the entity {@link #exists()}.
     */
    boolean modifiedSince(Instant since);

    /**
     * An entity that does not exist. Used to decide whether a conditional write may create one.
     */
    static <T> VersionedEntity<T> absent() {
        return new VersionedEntity<>() {
            @Override
            public boolean exists() {
                return false;
            }

            @Override
            public boolean versionEquals(T tag) {
                return false;
            }

            @Override
            public boolean modifiedSince(Instant since) {
                return false;
            }
        };
    }

    /**
     * Second-precision "modified after" comparison shared by implementations.
     */
    static boolean isModifiedSince(Instant modifiedAt, Instant since) {
        return modifiedAt.truncatedTo(ChronoUnit.SECONDS)
            .isAfter(since.truncatedTo(ChronoUnit.SECONDS));
    }
}
