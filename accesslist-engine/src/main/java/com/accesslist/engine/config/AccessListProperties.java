package com.accesslist.engine.config;

import com.accesslist.core.model.ConflictRetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings under {@code accesslist.*}.
 *
 * @param persistence {@code jdbc} or {@code memory}
 * @param pageSize    page size for paged listings
 * @param retry       bounded retry on concurrency conflicts
 */
@ConfigurationProperties(prefix = "accesslist")
public record AccessListProperties(
    @DefaultValue("jdbc") String persistence,
    @DefaultValue("20") int pageSize,
    @DefaultValue Retry retry
) {

    public static final String MEMORY = "memory";

    public record Retry(
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("10ms") Duration initialBackoff,
        @DefaultValue("200ms") Duration maxBackoff,
        @DefaultValue("2.0") double backoffMultiplier,
        @DefaultValue("0.2") double jitterFactor
    ) {
        public ConflictRetryPolicy toPolicy() {
            return new ConflictRetryPolicy(maxAttempts, initialBackoff, maxBackoff, backoffMultiplier, jitterFactor);
        }
    }
}
