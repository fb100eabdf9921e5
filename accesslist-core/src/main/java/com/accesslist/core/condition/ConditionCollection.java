package com.accesslist.core.condition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Zero or more conditions evaluated together. The most severe individual result wins,
 * and an empty collection always succeeds.
 *
 * @param <T> the version tag type
 */
public final class ConditionCollection<T> implements VersionCondition<T> {

    private final List<VersionCondition<T>> conditions;

    private ConditionCollection(List<VersionCondition<T>> conditions) {
        this.conditions = conditions;
    }

    public static <T> ConditionCollection<T> empty() {
        return new ConditionCollection<>(List.of());
    }

    public static <T> ConditionCollection<T> of(List<? extends VersionCondition<T>> conditions) {
        Objects.requireNonNull(conditions, "conditions");
        List<VersionCondition<T>> copy = List.copyOf(conditions);
        return new ConditionCollection<>(copy);
    }

    @SafeVarargs
    public static <T> ConditionCollection<T> of(VersionCondition<T>... conditions) {
        return of(List.of(conditions));
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    @Override
    public ConditionResult validate(VersionedEntity<T> entity) {
        ConditionResult result = ConditionResult.SUCCEEDED;
        for (VersionCondition<T> condition : conditions) {
            result = result.max(condition.validate(entity));
            if (result == ConditionResult.FAILED) {
                // nothing is more severe
                return result;
            }
        }
        return result;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public int size() {
        return conditions.size();
    }

    public List<VersionCondition<T>> conditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return "ConditionCollection" + conditions;
    }

    /**
     * Assembles a collection from the four conditional request inputs.
     *
     * <p>{@code If-Unmodified-Since} is only used when no {@code If-Match} was given, and
     * {@code If-Modified-Since} only when no {@code If-None-Match} was given.</p>
     */
    public static final class Builder<T> {
        private boolean ifMatchAny;
        private List<T> ifMatch = List.of();
        private boolean ifNoneMatchAny;
        private List<T> ifNoneMatch = List.of();
        private Instant ifModifiedSince;
        private Instant ifUnmodifiedSince;

        private Builder() {
        }

        public Builder<T> ifMatchAny() {
            this.ifMatchAny = true;
            return this;
        }

        public Builder<T> ifMatch(List<T> tags) {
            this.ifMatch = tags != null ? List.copyOf(tags) : List.of();
            return this;
        }

        public Builder<T> ifNoneMatchAny() {
            this.ifNoneMatchAny = true;
            return this;
        }

        public Builder<T> ifNoneMatch(List<T> tags) {
            this.ifNoneMatch = tags != null ? List.copyOf(tags) : List.of();
            return this;
        }

        public Builder<T> ifModifiedSince(Instant date) {
            this.ifModifiedSince = date;
            return this;
        }

        public Builder<T> ifUnmodifiedSince(Instant date) {
            this.ifUnmodifiedSince = date;
            return this;
        }

        /**
         * @param isRead whether the conditions guard a read, which may answer "not modified"
         */
        public ConditionCollection<T> build(boolean isRead) {
            List<VersionCondition<T>> conditions = new ArrayList<>(2);

            if (ifMatchAny) {
                conditions.add(RequestCondition.exists());
            } else if (!ifMatch.isEmpty()) {
                conditions.add(RequestCondition.isMatch(ifMatch));
            } else if (ifUnmodifiedSince != null) {
                conditions.add(RequestCondition.isUnmodifiedSince(ifUnmodifiedSince));
            }

            if (ifNoneMatchAny) {
                conditions.add(RequestCondition.notExists(isRead));
            } else if (!ifNoneMatch.isEmpty()) {
                conditions.add(RequestCondition.isDifferent(ifNoneMatch, isRead));
            } else if (ifModifiedSince != null) {
                conditions.add(RequestCondition.isModifiedSince(ifModifiedSince, isRead));
            }

            return of(conditions);
        }
    }
}
