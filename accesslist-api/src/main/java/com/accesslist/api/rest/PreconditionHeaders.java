package com.accesslist.api.rest;

import com.accesslist.core.condition.ConditionCollection;
import org.springframework.http.HttpHeaders;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates HTTP precondition headers into a {@link ConditionCollection} over list versions.
 *
 * Entity tags are the committed version in quotes, e.g. {@code "42"}. Weak tags compare like
 * strong ones. A tag that is not a version can never match.
 */
public final class PreconditionHeaders {

    static final String ANY = "*";
    static final long UNKNOWN_VERSION = -1L;

    private PreconditionHeaders() {
    }

    public static ConditionCollection<Long> parse(HttpHeaders headers, boolean isRead) {
        ConditionCollection.Builder<Long> builder = ConditionCollection.builder();

        List<String> ifMatch = headers.getIfMatch();
        if (ifMatch.contains(ANY)) {
            builder.ifMatchAny();
        } else {
            builder.ifMatch(parseTags(ifMatch));
        }

        List<String> ifNoneMatch = headers.getIfNoneMatch();
        if (ifNoneMatch.contains(ANY)) {
            builder.ifNoneMatchAny();
        } else {
            builder.ifNoneMatch(parseTags(ifNoneMatch));
        }

        long ifModifiedSince = headers.getIfModifiedSince();
        if (ifModifiedSince >= 0) {
            builder.ifModifiedSince(Instant.ofEpochMilli(ifModifiedSince));
        }

        long ifUnmodifiedSince = headers.getIfUnmodifiedSince();
        if (ifUnmodifiedSince >= 0) {
            builder.ifUnmodifiedSince(Instant.ofEpochMilli(ifUnmodifiedSince));
        }

        return builder.build(isRead);
    }

    /**
     * The entity tag of a list version.
     */
    public static String etag(long version) {
        return "\"" + version + "\"";
    }

    static long parseTag(String tag) {
        String value = tag.trim();
        if (value.startsWith("W/")) {
            value = value.substring(2);
        }
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        try {
            long version = Long.parseLong(value);
            return version >= 0 ? version : UNKNOWN_VERSION;
        } catch (NumberFormatException e) {
            return UNKNOWN_VERSION;
        }
    }

    private static List<Long> parseTags(List<String> tags) {
        List<Long> versions = new ArrayList<>(tags.size());
        for (String tag : tags) {
            versions.add(parseTag(tag));
        }
        return versions;
    }
}
