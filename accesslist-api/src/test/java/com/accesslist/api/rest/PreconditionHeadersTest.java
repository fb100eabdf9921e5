package com.accesslist.api.rest;

import com.accesslist.core.condition.ConditionCollection;
import com.accesslist.core.condition.ConditionResult;
import com.accesslist.core.model.AccessListData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Precondition headers")
class PreconditionHeadersTest {

    private static final Instant MODIFIED = Instant.parse("2024-01-15T10:00:00Z");
    private static final AccessListData<String> V3 = new AccessListData<>(UUID.randomUUID(), MODIFIED, 3L, "banks");

    @Test
    @DisplayName("Entity tags are quoted versions")
    void etag() {
        assertThat(PreconditionHeaders.etag(42)).isEqualTo("\"42\"");
    }

    @Test
    @DisplayName("Strong, weak and bare tags parse to the version")
    void parseTag() {
        assertThat(PreconditionHeaders.parseTag("\"3\"")).isEqualTo(3L);
        assertThat(PreconditionHeaders.parseTag("W/\"3\"")).isEqualTo(3L);
        assertThat(PreconditionHeaders.parseTag(" 3 ")).isEqualTo(3L);
    }

    @Test
    @DisplayName("Tags that are not versions never match")
    void unknownTag() {
        assertThat(PreconditionHeaders.parseTag("\"abc\"")).isEqualTo(PreconditionHeaders.UNKNOWN_VERSION);
        assertThat(PreconditionHeaders.parseTag("\"-4\"")).isEqualTo(PreconditionHeaders.UNKNOWN_VERSION);

        HttpHeaders headers = new HttpHeaders();
        headers.setIfMatch("\"abc\"");
        assertThat(PreconditionHeaders.parse(headers, false).validate(V3)).isEqualTo(ConditionResult.FAILED);
    }

    @Test
    @DisplayName("No headers, no conditions")
    void noHeaders() {
        ConditionCollection<Long> conditions = PreconditionHeaders.parse(new HttpHeaders(), true);

        assertThat(conditions.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("If-Match accepts any of several tags")
    void ifMatchList() {
        HttpHeaders headers = new HttpHeaders();
        headers.setIfMatch("\"1\", \"3\"");

        assertThat(PreconditionHeaders.parse(headers, false).validate(V3)).isEqualTo(ConditionResult.SUCCEEDED);
    }

    @Test
    @DisplayName("If-None-Match: * is create-only for writes")
    void ifNoneMatchAny() {
        HttpHeaders headers = new HttpHeaders();
        headers.setIfNoneMatch("*");

        assertThat(PreconditionHeaders.parse(headers, false).validate(V3)).isEqualTo(ConditionResult.FAILED);
        assertThat(PreconditionHeaders.parse(headers, true).validate(V3)).isEqualTo(ConditionResult.UNMODIFIED);
    }

    @Test
    @DisplayName("If-Modified-Since is ignored when If-None-Match is present")
    void modifiedSinceIgnored() {
        HttpHeaders headers = new HttpHeaders();
        headers.setIfNoneMatch("\"2\"");
        headers.setIfModifiedSince(MODIFIED.plusSeconds(3600));

        ConditionCollection<Long> conditions = PreconditionHeaders.parse(headers, true);

        assertThat(conditions.size()).isEqualTo(1);
        assertThat(conditions.validate(V3)).isEqualTo(ConditionResult.SUCCEEDED);
    }

    @Test
    @DisplayName("If-Modified-Since on an unchanged list is not modified")
    void modifiedSince() {
        HttpHeaders headers = new HttpHeaders();
        headers.setIfModifiedSince(MODIFIED);

        assertThat(PreconditionHeaders.parse(headers, true).validate(V3)).isEqualTo(ConditionResult.UNMODIFIED);
    }

    @Test
    @DisplayName("If-Unmodified-Since fails for a later change")
    void unmodifiedSince() {
        HttpHeaders headers = new HttpHeaders();
        headers.setIfUnmodifiedSince(MODIFIED.minusSeconds(60).toEpochMilli());

        assertThat(PreconditionHeaders.parse(headers, false).validate(V3)).isEqualTo(ConditionResult.FAILED);
    }
}
