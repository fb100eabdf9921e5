package com.accesslist.core.aggregate;

/**
 * Persisted sequence id of an aggregate event.
 * Zero means the event has not been persisted yet.
 */
public record EventId(long value) {

    public static final EventId UNSET = new EventId(0);

    public EventId {
        if (value < 0) {
            throw new IllegalArgumentException("Event id must not be negative: " + value);
        }
    }

    public static EventId of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Persisted event id must be positive: " + value);
        }
        return new EventId(value);
    }

    public boolean isSet() {
        return value != 0;
    }

    /**
     * The id as stored in the database. Only valid for persisted events.
     */
    public long dbValue() {
        if (!isSet()) {
            throw new IllegalStateException("Event id is not set");
        }
        return value;
    }

    /**
     * The id that follows this one in the same aggregate's stream.
     */
    public EventId next() {
        return new EventId(value + 1);
    }

    @Override
    public String toString() {
        return isSet() ? Long.toString(value) : "unset";
    }
}
