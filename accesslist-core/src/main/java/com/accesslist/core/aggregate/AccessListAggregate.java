package com.accesslist.core.aggregate;

import com.accesslist.core.condition.VersionedEntity;
import com.accesslist.core.exception.AccessListValidationException;
import com.accesslist.core.exception.AggregateStateException;
import com.accesslist.core.model.AccessListIncludes;
import com.accesslist.core.model.AccessListInfo;
import com.accesslist.core.model.AccessListMembership;
import com.accesslist.core.model.AccessListResourceConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Event-sourced access list.
 *
 * <p>Lifecycle: uninitialized, then initialized by {@link #initialize}, then optionally
 * deleted. Every mutator checks the lifecycle state and the domain rules, then records
 * exactly one event. Recording an event folds it into the projection right away, through
 * the same code that {@link #loadFrom} uses for replay, so replay and live mutation always
 * agree.</p>
 *
 * <p>Instances are not thread-safe and live for a single unit of work.</p>
 */
public final class AccessListAggregate implements Aggregate, VersionedEntity<Long> {

    private static final Logger log = LoggerFactory.getLogger(AccessListAggregate.class);

    private final UUID id;
    private final Clock clock;
    private final EventLog<AccessListEvent> eventLog = new EventLog<>();
    private final Projection projection = new Projection();

    private boolean initialized;
    private boolean deleted;
    private String resourceOwner;
    private String identifier;
    private String name;
    private String description;
    private final Map<String, AccessListResourceConnection> resourceConnections = new TreeMap<>();
    private final Map<UUID, Instant> members = new TreeMap<>();

    private AccessListAggregate(Clock clock, UUID id) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.id = Objects.requireNonNull(id, "id");
    }

    /**
     * An empty, uninitialized aggregate.
     */
    public static AccessListAggregate create(Clock clock, UUID id) {
        return new AccessListAggregate(clock, id);
    }

    /**
     * Rebuilds an aggregate from its persisted events, given in ascending id order.
     * All replayed events are committed.
     */
    public static AccessListAggregate loadFrom(Clock clock, UUID id, Iterable<? extends AccessListEvent> events) {
        AccessListAggregate aggregate = new AccessListAggregate(clock, id);
        aggregate.eventLog.replay(events, aggregate::applyStored);
        return aggregate;
    }

    // ========== Aggregate ==========

    @Override
    public UUID id() {
        return id;
    }

    @Override
    public EventId committedVersion() {
        return eventLog.committedVersion();
    }

    @Override
    public Instant createdAt() {
        return eventLog.createdAt();
    }

    @Override
    public Instant updatedAt() {
        return eventLog.updatedAt();
    }

    @Override
    public boolean hasUncommittedEvents() {
        return eventLog.hasUncommitted();
    }

    @Override
    public void commit() {
        eventLog.commit();
    }

    public List<AccessListEvent> uncommittedEvents() {
        return eventLog.uncommitted();
    }

    public List<AccessListEvent> events() {
        return eventLog.all();
    }

    /**
     * Gives the uncommitted events the ids they were persisted under, in order.
     */
    public void assignEventIds(List<EventId> ids) {
        eventLog.assignEventIds(ids, AccessListEvent::withEventId);
    }

    // ========== VersionedEntity ==========

    @Override
    public boolean exists() {
        return initialized && !deleted;
    }

    @Override
    public boolean versionEquals(Long tag) {
        EventId version = committedVersion();
        return exists() && version.isSet() && tag != null && tag == version.value();
    }

    @Override
    public boolean modifiedSince(Instant since) {
        return exists() && VersionedEntity.isModifiedSince(updatedAt(), since);
    }

    // ========== State ==========

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public String resourceOwner() {
        assertInitialized();
        return resourceOwner;
    }

    public String identifier() {
        assertInitialized();
        return identifier;
    }

    public String name() {
        assertInitialized();
        return name;
    }

    public String description() {
        assertInitialized();
        return description;
    }

    public Optional<AccessListResourceConnection> resourceConnection(String resourceIdentifier) {
        return Optional.ofNullable(resourceConnections.get(resourceIdentifier));
    }

    /**
     * Connections ordered by resource identifier.
     */
    public List<AccessListResourceConnection> resourceConnections() {
        return List.copyOf(resourceConnections.values());
    }

    public Set<UUID> members() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(members.keySet()));
    }

    /**
     * Memberships ordered by party id.
     */
    public List<AccessListMembership> memberships() {
        List<AccessListMembership> result = new ArrayList<>(members.size());
        members.forEach((partyId, since) -> result.add(new AccessListMembership(partyId, since)));
        return result;
    }

    /**
     * Committed snapshot without resource connections.
     */
    public AccessListInfo asInfo() {
        return asInfo(EnumSet.noneOf(AccessListIncludes.class));
    }

    /**
     * Committed snapshot.
     *
     * @throws IllegalStateException if the aggregate has uncommitted events or was never committed
     */
    public AccessListInfo asInfo(Set<AccessListIncludes> includes) {
        assertInitialized();
        if (hasUncommittedEvents() || !committedVersion().isSet()) {
            throw new IllegalStateException("Cannot get access list info for uncommitted aggregate");
        }

        List<AccessListResourceConnection> connections = null;
        if (AccessListIncludes.resourceConnections(includes)) {
            boolean withActions = AccessListIncludes.resourceConnectionActions(includes);
            connections = resourceConnections.values().stream()
                .map(connection -> withActions ? connection : connection.withoutActions())
                .toList();
        }

        return new AccessListInfo(id, resourceOwner, identifier, name, description,
            createdAt(), updatedAt(), connections, committedVersion().value());
    }

    // ========== Mutators ==========

    public void initialize(String resourceOwner, String identifier, String name, String description) {
        if (initialized) {
            throw AggregateStateException.alreadyInitialized(id);
        }

        addEvent(new AccessListEvent.Created(EventId.UNSET, id, nextEventTime(),
            resourceOwner, identifier, name, description));
    }

    /**
     * Changes the given fields; null means "leave unchanged".
     */
    public void update(String identifier, String name, String description) {
        assertLive();

        if (identifier == null && name == null && description == null) {
            throw new AccessListValidationException("identifier", "At least one of the parameters must be specified");
        }

        addEvent(new AccessListEvent.Updated(EventId.UNSET, id, nextEventTime(), identifier, name, description));
    }

    public void delete() {
        assertLive();

        addEvent(new AccessListEvent.Deleted(EventId.UNSET, id, nextEventTime()));
    }

    public AccessListResourceConnection addResourceConnection(String resourceIdentifier, Collection<String> actions) {
        assertLive();

        if (resourceConnections.containsKey(resourceIdentifier)) {
            throw new AccessListValidationException("resourceIdentifier", String.format(
                "Resource connection for resource '%s' already exists", resourceIdentifier));
        }
        requireSpecified(actions, "actions", "Actions must be specified");

        addEvent(new AccessListEvent.ResourceConnectionCreated(EventId.UNSET, id, nextEventTime(),
            resourceIdentifier, new HashSet<>(actions)));
        return resourceConnections.get(resourceIdentifier);
    }

    public AccessListResourceConnection addResourceConnectionActions(String resourceIdentifier, Collection<String> actions) {
        assertLive();

        AccessListResourceConnection connection = requireConnection(resourceIdentifier);
        requireSpecified(actions, "actions", "Actions must be specified");

        if (actions.stream().anyMatch(connection.actions()::contains)) {
            throw new AccessListValidationException("actions", "One or more actions already exist in the resource connection");
        }

        addEvent(new AccessListEvent.ResourceConnectionActionsAdded(EventId.UNSET, id, nextEventTime(),
            resourceIdentifier, new HashSet<>(actions)));
        return resourceConnections.get(resourceIdentifier);
    }

    public AccessListResourceConnection removeResourceConnectionActions(String resourceIdentifier, Collection<String> actions) {
        assertLive();

        AccessListResourceConnection connection = requireConnection(resourceIdentifier);
        requireSpecified(actions, "actions", "Actions must be specified");

        if (!connection.actions().containsAll(actions)) {
            throw new AccessListValidationException("actions", "One or more actions do not exist in the resource connection");
        }

        addEvent(new AccessListEvent.ResourceConnectionActionsRemoved(EventId.UNSET, id, nextEventTime(),
            resourceIdentifier, new HashSet<>(actions)));
        return resourceConnections.get(resourceIdentifier);
    }

    /**
     * @return the connection as it was before removal
     */
    public AccessListResourceConnection removeResourceConnection(String resourceIdentifier) {
        assertLive();

        AccessListResourceConnection connection = requireConnection(resourceIdentifier);

        addEvent(new AccessListEvent.ResourceConnectionDeleted(EventId.UNSET, id, nextEventTime(), resourceIdentifier));
        return connection;
    }

    /**
     * @return the members after the change
     */
    public Set<UUID> addMembers(Collection<UUID> partyIds) {
        assertLive();

        requireSpecified(partyIds, "partyIds", "Party IDs must be specified");
        if (partyIds.stream().anyMatch(members::containsKey)) {
            throw new AccessListValidationException("partyIds", "One or more party IDs already exist in the registry");
        }

        addEvent(new AccessListEvent.MembersAdded(EventId.UNSET, id, nextEventTime(), new HashSet<>(partyIds)));
        return members();
    }

    /**
     * @return the members after the change
     */
    public Set<UUID> removeMembers(Collection<UUID> partyIds) {
        assertLive();

        requireSpecified(partyIds, "partyIds", "Party IDs must be specified");
        if (!members.keySet().containsAll(partyIds)) {
            throw new AccessListValidationException("partyIds", "One or more party IDs do not exist in the registry");
        }

        addEvent(new AccessListEvent.MembersRemoved(EventId.UNSET, id, nextEventTime(), new HashSet<>(partyIds)));
        return members();
    }

    // ========== Internals ==========

    private void addEvent(AccessListEvent event) {
        event.applyTo(projection);
        eventLog.append(event);
        log.debug("Recorded {} event for access list {}", event.kind().dbName(), id);
    }

    private void applyStored(AccessListEvent event) {
        if (!id.equals(event.aggregateId())) {
            throw new IllegalArgumentException(String.format(
                "Event %s belongs to aggregate %s, not %s", event.eventId(), event.aggregateId(), id));
        }
        event.applyTo(projection);
    }

    /**
     * Event time never goes backwards, even if the clock does.
     */
    private Instant nextEventTime() {
        Instant now = clock.instant();
        if (eventLog.isEmpty()) {
            return now;
        }
        Instant last = eventLog.updatedAt();
        return now.isBefore(last) ? last : now;
    }

    private void assertInitialized() {
        if (!initialized) {
            throw AggregateStateException.notInitialized(id);
        }
    }

    private void assertLive() {
        assertInitialized();
        if (deleted) {
            throw AggregateStateException.deleted(id);
        }
    }

    private AccessListResourceConnection requireConnection(String resourceIdentifier) {
        AccessListResourceConnection connection = resourceConnections.get(resourceIdentifier);
        if (connection == null) {
            throw new AccessListValidationException("resourceIdentifier", String.format(
                "Resource connection for resource '%s' does not exist", resourceIdentifier));
        }
        return connection;
    }

    private static void requireSpecified(Collection<?> values, String parameter, String message) {
        if (values == null) {
            throw new AccessListValidationException(parameter, message);
        }
    }

    /**
     * The fold. Shared by live mutation and replay.
     */
    private final class Projection implements AccessListEvent.Handler {

        @Override
        public void apply(AccessListEvent.Created event) {
            initialized = true;
            resourceOwner = event.resourceOwner();
            identifier = event.identifier();
            name = event.name();
            description = event.description();
        }

        @Override
        public void apply(AccessListEvent.Updated event) {
            if (event.identifier() != null) {
                identifier = event.identifier();
            }
            if (event.name() != null) {
                name = event.name();
            }
            if (event.description() != null) {
                description = event.description();
            }
        }

        @Override
        public void apply(AccessListEvent.Deleted event) {
            deleted = true;
        }

        @Override
        public void apply(AccessListEvent.ResourceConnectionCreated event) {
            resourceConnections.put(event.resourceIdentifier(), new AccessListResourceConnection(
                event.resourceIdentifier(), event.actions(), event.eventTime(), event.eventTime()));
        }

        @Override
        public void apply(AccessListEvent.ResourceConnectionActionsAdded event) {
            AccessListResourceConnection connection = resourceConnections.get(event.resourceIdentifier());
            if (connection != null) {
                Set<String> actions = new HashSet<>(connection.actions());
                actions.addAll(event.actions());
                resourceConnections.put(event.resourceIdentifier(), new AccessListResourceConnection(
                    event.resourceIdentifier(), actions, connection.createdAt(), event.eventTime()));
            }
        }

        @Override
        public void apply(AccessListEvent.ResourceConnectionActionsRemoved event) {
            AccessListResourceConnection connection = resourceConnections.get(event.resourceIdentifier());
            if (connection != null) {
                Set<String> actions = new HashSet<>(connection.actions());
                actions.removeAll(event.actions());
                resourceConnections.put(event.resourceIdentifier(), new AccessListResourceConnection(
                    event.resourceIdentifier(), actions, connection.createdAt(), event.eventTime()));
            }
        }

        @Override
        public void apply(AccessListEvent.ResourceConnectionDeleted event) {
            resourceConnections.remove(event.resourceIdentifier());
        }

        @Override
        public void apply(AccessListEvent.MembersAdded event) {
            for (UUID partyId : event.partyIds()) {
                members.putIfAbsent(partyId, event.eventTime());
            }
        }

        @Override
        public void apply(AccessListEvent.MembersRemoved event) {
            for (UUID partyId : event.partyIds()) {
                members.remove(partyId);
            }
        }
    }
}
