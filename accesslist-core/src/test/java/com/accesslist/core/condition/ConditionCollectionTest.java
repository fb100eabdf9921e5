package com.accesslist.core.condition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Condition collections")
class ConditionCollectionTest {

    private static final Instant MODIFIED = Instant.parse("2024-01-15T10:00:00Z");
    private static final TestEntity V1 = TestEntity.existing("v1", MODIFIED);

    @Test
    @DisplayName("No conditions always succeed")
    void empty() {
        ConditionCollection<String> conditions = ConditionCollection.empty();

        assertThat(conditions.isEmpty()).isTrue();
        assertThat(conditions.validate(V1)).isEqualTo(ConditionResult.SUCCEEDED);
        assertThat(conditions.validate(TestEntity.missing())).isEqualTo(ConditionResult.SUCCEEDED);
    }

    @Test
    @DisplayName("The most severe result wins")
    void severity() {
        VersionCondition<String> succeeded = entity -> ConditionResult.SUCCEEDED;
        VersionCondition<String> unmodified = entity -> ConditionResult.UNMODIFIED;
        VersionCondition<String> failed = entity -> ConditionResult.FAILED;

        assertThat(ConditionCollection.of(succeeded, unmodified).validate(V1)).isEqualTo(ConditionResult.UNMODIFIED);
        assertThat(ConditionCollection.of(unmodified, succeeded).validate(V1)).isEqualTo(ConditionResult.UNMODIFIED);
        assertThat(ConditionCollection.of(unmodified, failed).validate(V1)).isEqualTo(ConditionResult.FAILED);
        assertThat(ConditionCollection.of(failed, unmodified).validate(V1)).isEqualTo(ConditionResult.FAILED);
        assertThat(ConditionCollection.of(succeeded, succeeded).validate(V1)).isEqualTo(ConditionResult.SUCCEEDED);
    }

    @Test
    @DisplayName("Evaluation stops at the first failure")
    void stopsAtFailure() {
        VersionCondition<String> failed = entity -> ConditionResult.FAILED;
        VersionCondition<String> unreachable = entity -> {
            throw new AssertionError("evaluated after a failure");
        };

        assertThat(ConditionCollection.of(failed, unreachable).validate(V1)).isEqualTo(ConditionResult.FAILED);
    }

    @Test
    @DisplayName("Result ordering is Succeeded < Unmodified < Failed")
    void resultMax() {
        assertThat(ConditionResult.SUCCEEDED.max(ConditionResult.UNMODIFIED)).isEqualTo(ConditionResult.UNMODIFIED);
        assertThat(ConditionResult.FAILED.max(ConditionResult.UNMODIFIED)).isEqualTo(ConditionResult.FAILED);
        assertThat(ConditionResult.UNMODIFIED.max(ConditionResult.SUCCEEDED)).isEqualTo(ConditionResult.UNMODIFIED);
    }

    @Test
    @DisplayName("If-Match takes precedence over If-Unmodified-Since")
    void ifMatchBeatsUnmodifiedSince() {
        ConditionCollection<String> conditions = ConditionCollection.<String>builder()
            .ifMatch(List.of("v1"))
            .ifUnmodifiedSince(MODIFIED.minusSeconds(60))
            .build(false);

        assertThat(conditions.size()).isEqualTo(1);
        assertThat(conditions.validate(V1)).isEqualTo(ConditionResult.SUCCEEDED);
    }

    @Test
    @DisplayName("If-None-Match takes precedence over If-Modified-Since")
    void ifNoneMatchBeatsModifiedSince() {
        ConditionCollection<String> conditions = ConditionCollection.<String>builder()
            .ifNoneMatch(List.of("v0"))
            .ifModifiedSince(MODIFIED.plusSeconds(60))
            .build(true);

        assertThat(conditions.size()).isEqualTo(1);
        assertThat(conditions.validate(V1)).isEqualTo(ConditionResult.SUCCEEDED);
    }

    @Test
    @DisplayName("Dates are used when no tags are given")
    void datesWithoutTags() {
        ConditionCollection<String> conditions = ConditionCollection.<String>builder()
            .ifMatch(List.of())
            .ifUnmodifiedSince(MODIFIED.minusSeconds(60))
            .build(false);

        assertThat(conditions.size()).isEqualTo(1);
        assertThat(conditions.validate(V1)).isEqualTo(ConditionResult.FAILED);
    }

    @Test
    @DisplayName("A read with a matching If-None-Match is not modified")
    void readNotModified() {
        ConditionCollection<String> conditions = ConditionCollection.<String>builder()
            .ifMatchAny()
            .ifNoneMatch(List.of("v1"))
            .build(true);

        assertThat(conditions.size()).isEqualTo(2);
        assertThat(conditions.validate(V1)).isEqualTo(ConditionResult.UNMODIFIED);
    }

    @Test
    @DisplayName("Create-only writes fail on an existing entity")
    void createOnly() {
        ConditionCollection<String> conditions = ConditionCollection.<String>builder()
            .ifNoneMatchAny()
            .build(false);

        assertThat(conditions.validate(V1)).isEqualTo(ConditionResult.FAILED);
        assertThat(conditions.validate(TestEntity.missing())).isEqualTo(ConditionResult.SUCCEEDED);
        assertThat(conditions.validate(VersionedEntity.absent())).isEqualTo(ConditionResult.SUCCEEDED);
    }
}
