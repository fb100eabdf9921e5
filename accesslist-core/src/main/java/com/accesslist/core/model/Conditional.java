package com.accesslist.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a conditional operation: the entity was found, was not found, was not modified
 * relative to the caller's version, or a precondition failed.
 *
 * <p>These are ordinary outcomes, returned rather than thrown.</p>
 *
 * @param <T> the value type
 * @param <Tag> the version tag type
 */
public final class Conditional<T, Tag> {

    public enum Kind {
        FOUND,
        NOT_FOUND,
        UNMODIFIED,
        CONDITION_FAILED
    }

    private static final Conditional<?, ?> NOT_FOUND = new Conditional<>(Kind.NOT_FOUND, null, null, null);
    private static final Conditional<?, ?> CONDITION_FAILED = new Conditional<>(Kind.CONDITION_FAILED, null, null, null);

    private final Kind kind;
    private final T value;
    private final Tag versionTag;
    private final Instant versionModifiedAt;

    private Conditional(Kind kind, T value, Tag versionTag, Instant versionModifiedAt) {
        this.kind = kind;
        this.value = value;
        this.versionTag = versionTag;
        this.versionModifiedAt = versionModifiedAt;
    }

    public static <T, Tag> Conditional<T, Tag> found(T value) {
        return new Conditional<>(Kind.FOUND, Objects.requireNonNull(value, "value"), null, null);
    }

    @SuppressWarnings("unchecked")
    public static <T, Tag> Conditional<T, Tag> notFound() {
        return (Conditional<T, Tag>) NOT_FOUND;
    }

    public static <T, Tag> Conditional<T, Tag> unmodified(Tag versionTag, Instant modifiedAt) {
        return new Conditional<>(Kind.UNMODIFIED, null,
            Objects.requireNonNull(versionTag, "versionTag"),
            Objects.requireNonNull(modifiedAt, "modifiedAt"));
    }

    @SuppressWarnings("unchecked")
    public static <T, Tag> Conditional<T, Tag> conditionFailed() {
        return (Conditional<T, Tag>) CONDITION_FAILED;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFound() {
        return kind == Kind.FOUND;
    }

    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }

    public boolean isUnmodified() {
        return kind == Kind.UNMODIFIED;
    }

    public boolean isConditionFailed() {
        return kind == Kind.CONDITION_FAILED;
    }

    /**
     * @throws IllegalStateException unless {@link #isFound()}
     */
    public T value() {
        require(Kind.FOUND);
        return value;
    }

    /**
     * @throws IllegalStateException unless {@link #isUnmodified()}
     */
    public Tag versionTag() {
        require(Kind.UNMODIFIED);
        return versionTag;
    }

    /**
     * @throws IllegalStateException unless {@link #isUnmodified()}
     */
    public Instant versionModifiedAt() {
        require(Kind.UNMODIFIED);
        return versionModifiedAt;
    }

    public <U> Conditional<U, Tag> map(Function<? super T, ? extends U> mapper) {
        return map(mapper, Function.identity());
    }

    public <U, UTag> Conditional<U, UTag> map(
            Function<? super T, ? extends U> valueMapper,
            Function<? super Tag, ? extends UTag> tagMapper) {
        return switch (kind) {
            case FOUND -> found(valueMapper.apply(value));
            case UNMODIFIED -> unmodified(tagMapper.apply(versionTag), versionModifiedAt);
            case NOT_FOUND -> notFound();
            case CONDITION_FAILED -> conditionFailed();
        };
    }

    private void require(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException(String.format(
                "Conditional is %s, not %s", kind, expected));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Conditional<?, ?> other = (Conditional<?, ?>) o;
        return kind == other.kind
            && Objects.equals(value, other.value)
            && Objects.equals(versionTag, other.versionTag)
            && Objects.equals(versionModifiedAt, other.versionModifiedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, versionTag, versionModifiedAt);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case FOUND -> "Found[" + value + "]";
            case UNMODIFIED -> "Unmodified[" + versionTag + ", " + versionModifiedAt + "]";
            case NOT_FOUND -> "NotFound";
            case CONDITION_FAILED -> "ConditionFailed";
        };
    }
}
