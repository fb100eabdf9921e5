package com.accesslist.core.aggregate;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Events of the access list aggregate.
 *
 * <p>The set of kinds is closed: every implementation is one of the nested records, and
 * {@link Handler} has one typed {@code apply} method per kind. Events are immutable; assigning
 * a persisted id produces a copy via {@link #withEventId(EventId)}.</p>
 */
public interface AccessListEvent extends AggregateEvent {

    AccessListEventKind kind();

    void applyTo(Handler handler);

    AccessListEvent withEventId(EventId eventId);

    EventValues asValues();

    /**
     * Projection side of the event fold.
     */
    interface Handler {
        void apply(Created event);

        void apply(Updated event);

        void apply(Deleted event);

        void apply(ResourceConnectionCreated event);

        void apply(ResourceConnectionActionsAdded event);

        void apply(ResourceConnectionActionsRemoved event);

        void apply(ResourceConnectionDeleted event);

        void apply(MembersAdded event);

        void apply(MembersRemoved event);
    }

    /**
     * Rebuilds an event from its flat stored form.
     */
    static AccessListEvent fromValues(EventValues values) {
        EventId id = values.eventId() != null ? values.eventId() : EventId.UNSET;
        UUID aggregateId = values.aggregateId();
        Instant time = values.eventTime();
        return switch (values.kind()) {
            case CREATED -> new Created(id, aggregateId, time,
                values.resourceOwner(), values.identifier(), values.name(), values.description());
            case UPDATED -> new Updated(id, aggregateId, time,
                values.identifier(), values.name(), values.description());
            case DELETED -> new Deleted(id, aggregateId, time);
            case RESOURCE_CONNECTION_CREATED -> new ResourceConnectionCreated(id, aggregateId, time,
                values.identifier(), values.actions());
            case RESOURCE_CONNECTION_ACTIONS_ADDED -> new ResourceConnectionActionsAdded(id, aggregateId, time,
                values.identifier(), values.actions());
            case RESOURCE_CONNECTION_ACTIONS_REMOVED -> new ResourceConnectionActionsRemoved(id, aggregateId, time,
                values.identifier(), values.actions());
            case RESOURCE_CONNECTION_DELETED -> new ResourceConnectionDeleted(id, aggregateId, time,
                values.identifier());
            case MEMBERS_ADDED -> new MembersAdded(id, aggregateId, time, values.partyIds());
            case MEMBERS_REMOVED -> new MembersRemoved(id, aggregateId, time, values.partyIds());
        };
    }

    private static <T extends Comparable<T>> SortedSet<T> sortedCopy(Collection<T> items, String name) {
        Objects.requireNonNull(items, name + " must be specified");
        return Collections.unmodifiableSortedSet(new TreeSet<>(items));
    }

    record Created(
        EventId eventId,
        UUID aggregateId,
        Instant eventTime,
        String resourceOwner,
        String identifier,
        String name,
        String description
    ) implements AccessListEvent {

        public Created {
            Objects.requireNonNull(resourceOwner, "resourceOwner");
            Objects.requireNonNull(identifier, "identifier");
            Objects.requireNonNull(name, "name");
            description = description != null ? description : "";
        }

        @Override
        public AccessListEventKind kind() {
            return AccessListEventKind.CREATED;
        }

        @Override
        public void applyTo(Handler handler) {
            handler.apply(this);
        }

        @Override
        public Created withEventId(EventId eventId) {
            return new Created(eventId, aggregateId, eventTime, resourceOwner, identifier, name, description);
        }

        @Override
        public EventValues asValues() {
            return new EventValues(eventId, kind(), eventTime, aggregateId,
                identifier, name, description, resourceOwner, null, null);
        }
    }

    /**
     * Null fields are left unchanged.
     */
    record Updated(
        EventId eventId,
        UUID aggregateId,
        Instant eventTime,
        String identifier,
        String name,
        String description
    ) implements AccessListEvent {

        @Override
        public AccessListEventKind kind() {
            return AccessListEventKind.UPDATED;
        }

        @Override
        public void applyTo(Handler handler) {
            handler.apply(this);
        }

        @Override
        public Updated withEventId(EventId eventId) {
            return new Updated(eventId, aggregateId, eventTime, identifier, name, description);
        }

        @Override
        public EventValues asValues() {
            return new EventValues(eventId, kind(), eventTime, aggregateId,
                identifier, name, description, null, null, null);
        }
    }

    record Deleted(EventId eventId, UUID aggregateId, Instant eventTime) implements AccessListEvent {

        @Override
        public AccessListEventKind kind() {
            return AccessListEventKind.DELETED;
        }

        @Override
        public void applyTo(Handler handler) {
            handler.apply(this);
        }

        @Override
        public Deleted withEventId(EventId eventId) {
            return new Deleted(eventId, aggregateId, eventTime);
        }

        @Override
        public EventValues asValues() {
            return new EventValues(eventId, kind(), eventTime, aggregateId,
                null, null, null, null, null, null);
        }
    }

    record ResourceConnectionCreated(
        EventId eventId,
        UUID aggregateId,
        Instant eventTime,
        String resourceIdentifier,
        Set<String> actions
    ) implements AccessListEvent {

        public ResourceConnectionCreated {
            Objects.requireNonNull(resourceIdentifier, "resourceIdentifier");
            actions = sortedCopy(actions, "actions");
        }

        @Override
        public AccessListEventKind kind() {
            return AccessListEventKind.RESOURCE_CONNECTION_CREATED;
        }

        @Override
        public void applyTo(Handler handler) {
            handler.apply(this);
        }

        @Override
        public ResourceConnectionCreated withEventId(EventId eventId) {
            return new ResourceConnectionCreated(eventId, aggregateId, eventTime, resourceIdentifier, actions);
        }

        @Override
        public EventValues asValues() {
            return new EventValues(eventId, kind(), eventTime, aggregateId,
                resourceIdentifier, null, null, null, actions, null);
        }
    }

    record ResourceConnectionActionsAdded(
        EventId eventId,
        UUID aggregateId,
        Instant eventTime,
        String resourceIdentifier,
        Set<String> actions
    ) implements AccessListEvent {

        public ResourceConnectionActionsAdded {
            Objects.requireNonNull(resourceIdentifier, "resourceIdentifier");
            actions = sortedCopy(actions, "actions");
        }

        @Override
        public AccessListEventKind kind() {
            return AccessListEventKind.RESOURCE_CONNECTION_ACTIONS_ADDED;
        }

        @Override
        public void applyTo(Handler handler) {
            handler.apply(this);
        }

        @Override
        public ResourceConnectionActionsAdded withEventId(EventId eventId) {
            return new ResourceConnectionActionsAdded(eventId, aggregateId, eventTime, resourceIdentifier, actions);
        }

        @Override
        public EventValues asValues() {
            return new EventValues(eventId, kind(), eventTime, aggregateId,
                resourceIdentifier, null, null, null, actions, null);
        }
    }

    record ResourceConnectionActionsRemoved(
        EventId eventId,
        UUID aggregateId,
        Instant eventTime,
        String resourceIdentifier,
        Set<String> actions
    ) implements AccessListEvent {

        public ResourceConnectionActionsRemoved {
            Objects.requireNonNull(resourceIdentifier, "resourceIdentifier");
            actions = sortedCopy(actions, "actions");
        }

        @Override
        public AccessListEventKind kind() {
            return AccessListEventKind.RESOURCE_CONNECTION_ACTIONS_REMOVED;
        }

        @Override
        public void applyTo(Handler handler) {
            handler.apply(this);
        }

        @Override
        public ResourceConnectionActionsRemoved withEventId(EventId eventId) {
            return new ResourceConnectionActionsRemoved(eventId, aggregateId, eventTime, resourceIdentifier, actions);
        }

        @Override
        public EventValues asValues() {
            return new EventValues(eventId, kind(), eventTime, aggregateId,
                resourceIdentifier, null, null, null, actions, null);
        }
    }

    record ResourceConnectionDeleted(
        EventId eventId,
        UUID aggregateId,
        Instant eventTime,
        String resourceIdentifier
    ) implements AccessListEvent {

        public ResourceConnectionDeleted {
            Objects.requireNonNull(resourceIdentifier, "resourceIdentifier");
        }

        @Override
        public AccessListEventKind kind() {
            return AccessListEventKind.RESOURCE_CONNECTION_DELETED;
        }

        @Override
        public void applyTo(Handler handler) {
            handler.apply(this);
        }

        @Override
        public ResourceConnectionDeleted withEventId(EventId eventId) {
            return new ResourceConnectionDeleted(eventId, aggregateId, eventTime, resourceIdentifier);
        }

        @Override
        public EventValues asValues() {
            return new EventValues(eventId, kind(), eventTime, aggregateId,
                resourceIdentifier, null, null, null, null, null);
        }
    }

    record MembersAdded(
        EventId eventId,
        UUID aggregateId,
        Instant eventTime,
        Set<UUID> partyIds
    ) implements AccessListEvent {

        public MembersAdded {
            partyIds = sortedCopy(partyIds, "partyIds");
        }

        @Override
        public AccessListEventKind kind() {
            return AccessListEventKind.MEMBERS_ADDED;
        }

        @Override
        public void applyTo(Handler handler) {
            handler.apply(this);
        }

        @Override
        public MembersAdded withEventId(EventId eventId) {
            return new MembersAdded(eventId, aggregateId, eventTime, partyIds);
        }

        @Override
        public EventValues asValues() {
            return new EventValues(eventId, kind(), eventTime, aggregateId,
                null, null, null, null, null, partyIds);
        }
    }

    record MembersRemoved(
        EventId eventId,
        UUID aggregateId,
        Instant eventTime,
        Set<UUID> partyIds
    ) implements AccessListEvent {

        public MembersRemoved {
            partyIds = sortedCopy(partyIds, "partyIds");
        }

        @Override
        public AccessListEventKind kind() {
            return AccessListEventKind.MEMBERS_REMOVED;
        }

        @Override
        public void applyTo(Handler handler) {
            handler.apply(this);
        }

        @Override
        public MembersRemoved withEventId(EventId eventId) {
            return new MembersRemoved(eventId, aggregateId, eventTime, partyIds);
        }

        @Override
        public EventValues asValues() {
            return new EventValues(eventId, kind(), eventTime, aggregateId,
                null, null, null, null, null, partyIds);
        }
    }
}
