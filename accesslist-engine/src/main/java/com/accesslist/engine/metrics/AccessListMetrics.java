package com.accesslist.engine.metrics;

import com.accesslist.core.aggregate.AccessListEvent;
import com.accesslist.core.model.Conditional;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Micrometer metrics for the access list registry.
 *
 * Metrics exposed:
 * - Operation outcomes (found, not found, unmodified, condition failed)
 * - Optimistic concurrency conflicts and exhausted retries
 * - Appended events by kind
 * - Persistence latency
 */
public class AccessListMetrics implements MeterBinder {

    // Metric names
    public static final String OPERATIONS = "accesslist.operations";
    public static final String CONCURRENCY_CONFLICTS = "accesslist.concurrency.conflicts";
    public static final String RETRIES_EXHAUSTED = "accesslist.concurrency.retries_exhausted";
    public static final String EVENTS_APPENDED = "accesslist.events.appended";
    public static final String PERSIST_DURATION = "accesslist.persist.duration";
    public static final String IN_FLIGHT_WRITES = "accesslist.writes.in_flight";

    private MeterRegistry registry;

    private final AtomicInteger inFlightWrites = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(IN_FLIGHT_WRITES, inFlightWrites, AtomicInteger::get)
            .description("Number of write operations currently running")
            .register(registry);
    }

    public void operationCompleted(String operation, Conditional.Kind outcome) {
        Counter.builder(OPERATIONS)
            .tag("operation", operation)
            .tag("outcome", outcome.name().toLowerCase())
            .description("Access list operations by outcome")
            .register(registry)
            .increment();
    }

    public void concurrencyConflict(String operation) {
        Counter.builder(CONCURRENCY_CONFLICTS)
            .tag("operation", operation)
            .description("Writes that lost an optimistic concurrency race")
            .register(registry)
            .increment();
    }

    public void retriesExhausted(String operation) {
        Counter.builder(RETRIES_EXHAUSTED)
            .tag("operation", operation)
            .description("Writes that gave up after repeated concurrency conflicts")
            .register(registry)
            .increment();
    }

    public void eventsAppended(List<AccessListEvent> events) {
        for (AccessListEvent event : events) {
            Counter.builder(EVENTS_APPENDED)
                .tag("kind", event.kind().dbName())
                .description("Events appended to access lists")
                .register(registry)
                .increment();
        }
    }

    /**
     * Time a persistence call.
     */
    public <T> T recordPersist(Supplier<T> persist) {
        Timer timer = Timer.builder(PERSIST_DURATION)
            .description("Time to persist an aggregate's pending events")
            .register(registry);
        return timer.record(persist);
    }

    public void writeStarted() {
        inFlightWrites.incrementAndGet();
    }

    public void writeFinished() {
        inFlightWrites.decrementAndGet();
    }
}
