package com.accesslist.core.aggregate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Ordered event history of one aggregate with a committed / uncommitted boundary.
 *
 * <p>Events before the boundary are durable and carry persisted ids. Events after it were
 * appended in the current session and are visible only to this instance until a repository
 * persists them, assigns their ids and commits. Concrete aggregates embed one log and feed
 * every event through their projection before appending it.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class EventLog<E extends AggregateEvent> {

    private final List<E> events = new ArrayList<>();
    private int committed;

    /**
     * Appends a new, uncommitted event. The caller must already have applied it.
     */
    public void append(E event) {
        events.add(event);
    }

    /**
     * Applies each stored event in order and commits them all.
     * Events must carry persisted ids in strictly ascending order.
     */
    public void replay(Iterable<? extends E> stored, Consumer<? super E> apply) {
        if (!events.isEmpty()) {
            throw new IllegalStateException("Cannot replay into a non-empty event log");
        }

        EventId previous = EventId.UNSET;
        for (E event : stored) {
            EventId id = event.eventId();
            if (!id.isSet() || id.value() <= previous.value()) {
                throw new IllegalArgumentException(String.format(
                    "Stored events must have ascending persisted ids: %s after %s", id, previous));
            }
            apply.accept(event);
            events.add(event);
            previous = id;
        }

        commit();
    }

    /**
     * Moves the committed boundary to the end of the log.
     *
     * @throws IllegalStateException if an uncommitted event has no persisted id
     */
    public void commit() {
        for (int i = committed; i < events.size(); i++) {
            if (!events.get(i).eventId().isSet()) {
                throw new IllegalStateException("Cannot commit aggregate events with unset event ids");
            }
        }
        committed = events.size();
    }

    /**
     * Replaces the uncommitted events with copies carrying the given persisted ids, in order.
     */
    public void assignEventIds(List<EventId> ids, BiFunction<? super E, EventId, ? extends E> withId) {
        int pending = events.size() - committed;
        if (ids.size() != pending) {
            throw new IllegalArgumentException(String.format(
                "Expected %d event ids, got %d", pending, ids.size()));
        }

        for (int i = 0; i < pending; i++) {
            int index = committed + i;
            events.set(index, withId.apply(events.get(index), ids.get(i)));
        }
    }

    public List<E> uncommitted() {
        return List.copyOf(events.subList(committed, events.size()));
    }

    public List<E> all() {
        return Collections.unmodifiableList(events);
    }

    public boolean hasUncommitted() {
        return committed < events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public EventId committedVersion() {
        return committed == 0 ? EventId.UNSET : events.get(committed - 1).eventId();
    }

    public Instant createdAt() {
        if (events.isEmpty()) {
            throw new IllegalStateException("Aggregate has no events");
        }
        return events.get(0).eventTime();
    }

    public Instant updatedAt() {
        if (events.isEmpty()) {
            throw new IllegalStateException("Aggregate has no events");
        }
        return events.get(events.size() - 1).eventTime();
    }
}
