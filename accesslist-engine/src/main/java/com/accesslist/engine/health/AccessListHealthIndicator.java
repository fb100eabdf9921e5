package com.accesslist.engine.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Custom health indicator for the access list registry.
 * Reports health status based on:
 * - Database connectivity
 * - Number of live access lists and stored events
 */
@Component
@ConditionalOnProperty(name = "accesslist.persistence", havingValue = "jdbc", matchIfMissing = true)
public class AccessListHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;

    public AccessListHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            boolean dbHealthy = checkDatabase(details);
            if (!dbHealthy) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            checkRegistry(details);

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkDatabase(Map<String, Object> details) {
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            details.put("database", "connected");
            return result != null && result == 1;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private void checkRegistry(Map<String, Object> details) {
        try {
            Long lists = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM access_list_state", Long.class);
            details.put("accessLists", lists != null ? lists : 0L);

            Long events = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM access_list_events", Long.class);
            details.put("events", events != null ? events : 0L);
        } catch (Exception e) {
            details.put("registryError", e.getMessage());
        }
    }
}
