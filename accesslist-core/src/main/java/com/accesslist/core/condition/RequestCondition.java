package com.accesslist.core.condition;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single precondition in the shape of the conditional request headers.
 *
 * <ul>
 *   <li>{@code If-Match: *} is {@link #exists()}, {@code If-Match: tags} is {@link #isMatch(List)}</li>
 *   <li>{@code If-None-Match: *} is {@link #notExists(boolean)},
 *       {@code If-None-Match: tags} is {@link #isDifferent(List, boolean)}</li>
 *   <li>{@code If-Modified-Since} is {@link #isModifiedSince(Instant, boolean)}</li>
 *   <li>{@code If-Unmodified-Since} is {@link #isUnmodifiedSince(Instant)}</li>
 * </ul>
 *
 * <p>The {@code isRead} variants report {@link ConditionResult#UNMODIFIED} instead of
 * {@link ConditionResult#FAILED} when they do not hold, so a read can answer "not modified".</p>
 *
 * @param <T> the version tag type
 */
public final class RequestCondition<T> implements VersionCondition<T> {

    private final Mode mode;
    private final List<T> tags;
    private final Instant date;

    private RequestCondition(Mode mode, List<T> tags, Instant date) {
        this.mode = mode;
        this.tags = tags;
        this.date = date;
    }

    public static <T> RequestCondition<T> exists() {
        return new RequestCondition<>(Mode.EXISTS, List.of(), null);
    }

    public static <T> RequestCondition<T> notExists(boolean isRead) {
        return new RequestCondition<>(isRead ? Mode.NOT_EXISTS_READ : Mode.NOT_EXISTS, List.of(), null);
    }

    public static <T> RequestCondition<T> isMatch(T tag) {
        return isMatch(List.of(tag));
    }

    public static <T> RequestCondition<T> isMatch(List<T> tags) {
        return new RequestCondition<>(Mode.IS_MATCH, requireTags(tags), null);
    }

    public static <T> RequestCondition<T> isDifferent(T tag, boolean isRead) {
        return isDifferent(List.of(tag), isRead);
    }

    public static <T> RequestCondition<T> isDifferent(List<T> tags, boolean isRead) {
        return new RequestCondition<>(isRead ? Mode.IS_DIFFERENT_READ : Mode.IS_DIFFERENT, requireTags(tags), null);
    }

    public static <T> RequestCondition<T> isModifiedSince(Instant date, boolean isRead) {
        Objects.requireNonNull(date, "date");
        return new RequestCondition<>(isRead ? Mode.IS_MODIFIED_SINCE_READ : Mode.IS_MODIFIED_SINCE, List.of(), date);
    }

    public static <T> RequestCondition<T> isUnmodifiedSince(Instant date) {
        Objects.requireNonNull(date, "date");
        return new RequestCondition<>(Mode.IS_UNMODIFIED_SINCE, List.of(), date);
    }

    @Override
    public ConditionResult validate(VersionedEntity<T> entity) {
        return switch (mode) {
            case EXISTS -> check(entity.exists(), ConditionResult.FAILED);
            case NOT_EXISTS -> check(!entity.exists(), ConditionResult.FAILED);
            case NOT_EXISTS_READ -> check(!entity.exists(), ConditionResult.UNMODIFIED);
            case IS_MATCH -> check(anyVersionEquals(entity), ConditionResult.FAILED);
            case IS_DIFFERENT -> check(!anyVersionEquals(entity), ConditionResult.FAILED);
            case IS_DIFFERENT_READ -> check(!anyVersionEquals(entity), ConditionResult.UNMODIFIED);
            case IS_MODIFIED_SINCE -> check(entity.modifiedSince(date), ConditionResult.FAILED);
            case IS_MODIFIED_SINCE_READ -> check(entity.modifiedSince(date), ConditionResult.UNMODIFIED);
            case IS_UNMODIFIED_SINCE -> check(!entity.modifiedSince(date), ConditionResult.FAILED);
        };
    }

    private boolean anyVersionEquals(VersionedEntity<T> entity) {
        for (T tag : tags) {
            if (entity.versionEquals(tag)) {
                return true;
            }
        }
        return false;
    }

    private static ConditionResult check(boolean holds, ConditionResult otherwise) {
        return holds ? ConditionResult.SUCCEEDED : otherwise;
    }

    private static <T> List<T> requireTags(List<T> tags) {
        Objects.requireNonNull(tags, "tags");
        if (tags.isEmpty()) {
            throw new IllegalArgumentException("At least one version tag is required");
        }
        return List.copyOf(tags);
    }

    @Override
    public String toString() {
        return switch (mode) {
            case EXISTS -> "If-Match: *";
            case NOT_EXISTS, NOT_EXISTS_READ -> "If-None-Match: *";
            case IS_MATCH -> "If-Match: " + formatTags();
            case IS_DIFFERENT, IS_DIFFERENT_READ -> "If-None-Match: " + formatTags();
            case IS_MODIFIED_SINCE, IS_MODIFIED_SINCE_READ -> "If-Modified-Since: " + date;
            case IS_UNMODIFIED_SINCE -> "If-Unmodified-Since: " + date;
        };
    }

    private String formatTags() {
        return tags.stream()
            .map(tag -> "\"" + tag + "\"")
            .collect(Collectors.joining(", "));
    }

    private enum Mode {
        EXISTS,
        NOT_EXISTS,
        NOT_EXISTS_READ,
        IS_MATCH,
        IS_DIFFERENT,
        IS_DIFFERENT_READ,
        IS_MODIFIED_SINCE,
        IS_MODIFIED_SINCE_READ,
        IS_UNMODIFIED_SINCE
    }
}
