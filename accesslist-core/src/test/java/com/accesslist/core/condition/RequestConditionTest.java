package com.accesslist.core.condition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Request conditions")
class RequestConditionTest {

    private static final Instant MODIFIED = Instant.parse("2024-01-15T10:00:30.700Z");
    private static final TestEntity V1 = TestEntity.existing("v1", MODIFIED);
    private static final TestEntity MISSING = TestEntity.missing();

    @Nested
    @DisplayName("If-Match")
    class IfMatch {

        @Test
        @DisplayName("Any tag matches iff the entity exists")
        void exists() {
            assertThat(RequestCondition.<String>exists().validate(V1)).isEqualTo(ConditionResult.SUCCEEDED);
            assertThat(RequestCondition.<String>exists().validate(MISSING)).isEqualTo(ConditionResult.FAILED);
        }

        @Test
        @DisplayName("Succeeds when one of the tags is the current version")
        void isMatch() {
            assertThat(RequestCondition.isMatch("v1").validate(V1)).isEqualTo(ConditionResult.SUCCEEDED);
            assertThat(RequestCondition.isMatch(List.of("v0", "v1")).validate(V1)).isEqualTo(ConditionResult.SUCCEEDED);
            assertThat(RequestCondition.isMatch(List.of("v0", "v2")).validate(V1)).isEqualTo(ConditionResult.FAILED);
        }

        @Test
        @DisplayName("Never matches a missing entity")
        void isMatchMissing() {
            assertThat(RequestCondition.isMatch("v1").validate(MISSING)).isEqualTo(ConditionResult.FAILED);
        }

        @Test
        @DisplayName("An empty tag list is rejected")
        void emptyTags() {
            assertThatThrownBy(() -> RequestCondition.isMatch(List.<String>of()))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RequestCondition.isDifferent(List.<String>of(), true))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("If-None-Match")
    class IfNoneMatch {

        @Test
        @DisplayName("Any tag: a write fails and a read is unmodified when the entity exists")
        void notExists() {
            assertThat(RequestCondition.<String>notExists(false).validate(V1)).isEqualTo(ConditionResult.FAILED);
            assertThat(RequestCondition.<String>notExists(true).validate(V1)).isEqualTo(ConditionResult.UNMODIFIED);
            assertThat(RequestCondition.<String>notExists(false).validate(MISSING)).isEqualTo(ConditionResult.SUCCEEDED);
            assertThat(RequestCondition.<String>notExists(true).validate(MISSING)).isEqualTo(ConditionResult.SUCCEEDED);
        }

        @Test
        @DisplayName("Matching tag: a read is unmodified, a write fails")
        void isDifferentMatching() {
            assertThat(RequestCondition.isDifferent("v1", true).validate(V1)).isEqualTo(ConditionResult.UNMODIFIED);
            assertThat(RequestCondition.isDifferent("v1", false).validate(V1)).isEqualTo(ConditionResult.FAILED);
        }

        @Test
        @DisplayName("Other tags succeed")
        void isDifferentOther() {
            assertThat(RequestCondition.isDifferent(List.of("v0", "v2"), true).validate(V1))
                .isEqualTo(ConditionResult.SUCCEEDED);
            assertThat(RequestCondition.isDifferent("v1", false).validate(MISSING))
                .isEqualTo(ConditionResult.SUCCEEDED);
        }
    }

    @Nested
    @DisplayName("Dates")
    class Dates {

        @Test
        @DisplayName("If-Modified-Since compares at second resolution")
        void modifiedSince() {
            Instant sameSecond = Instant.parse("2024-01-15T10:00:30Z");
            Instant earlier = Instant.parse("2024-01-15T10:00:29Z");

            assertThat(RequestCondition.<String>isModifiedSince(earlier, true).validate(V1))
                .isEqualTo(ConditionResult.SUCCEEDED);
            assertThat(RequestCondition.<String>isModifiedSince(sameSecond, true).validate(V1))
                .isEqualTo(ConditionResult.UNMODIFIED);
            assertThat(RequestCondition.<String>isModifiedSince(sameSecond, false).validate(V1))
                .isEqualTo(ConditionResult.FAILED);
        }

        @Test
        @DisplayName("If-Unmodified-Since fails once the entity changed later")
        void unmodifiedSince() {
            Instant earlier = Instant.parse("2024-01-15T10:00:00Z");
            Instant later = Instant.parse("2024-01-15T10:01:00Z");

            assertThat(RequestCondition.<String>isUnmodifiedSince(later).validate(V1))
                .isEqualTo(ConditionResult.SUCCEEDED);
            assertThat(RequestCondition.<String>isUnmodifiedSince(earlier).validate(V1))
                .isEqualTo(ConditionResult.FAILED);
        }
    }

    @Test
    @DisplayName("Mapped conditions compare converted tags")
    void mapTags() {
        VersionCondition<Long> condition = RequestCondition.isMatch("7").map(Long::parseLong);
        VersionedEntity<Long> entity = new VersionedEntity<>() {
            @Override
            public boolean exists() {
                return true;
            }

            @Override
            public boolean versionEquals(Long tag) {
                return tag == 7L;
            }

            @Override
            public boolean modifiedSince(Instant since) {
                return false;
            }
        };

        assertThat(condition.validate(entity)).isEqualTo(ConditionResult.SUCCEEDED);
    }

    @Test
    @DisplayName("Conditions render as their header")
    void headerRendering() {
        assertThat(RequestCondition.isMatch(List.of("1", "2"))).hasToString("If-Match: \"1\", \"2\"");
        assertThat(RequestCondition.notExists(true)).hasToString("If-None-Match: *");
    }
}
