package com.accesslist.engine.persistence;

import com.accesslist.core.aggregate.AccessListAggregate;
import com.accesslist.core.aggregate.AccessListEvent;
import com.accesslist.core.aggregate.EventValues;
import com.accesslist.core.aggregate.EventId;
import com.accesslist.core.exception.DuplicateAccessListException;
import com.accesslist.core.exception.OptimisticConcurrencyException;
import com.accesslist.core.model.*;
import com.accesslist.core.repository.AccessListLoadOrCreateResult;
import com.accesslist.core.repository.AccessListRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AccessListRepository.
 * Keeps each list's committed event stream and replays it on every load.
 * For demonstration and testing purposes.
 */
@Repository("inMemoryAccessListRepository")
@ConditionalOnProperty(name = "accesslist.persistence", havingValue = "memory")
public class InMemoryAccessListRepository implements AccessListRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAccessListRepository.class);

    private final Clock clock;
    private final Map<UUID, List<AccessListEvent>> streams = new ConcurrentHashMap<>();
    private final Map<NameKey, UUID> byName = new ConcurrentHashMap<>();

    public InMemoryAccessListRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<AccessListInfo> getAccessListsByOwner(
            String resourceOwner, String continueFrom, int count, Set<AccessListIncludes> includes) {
        return byName.entrySet().stream()
            .filter(e -> e.getKey().resourceOwner().equals(resourceOwner))
            .filter(e -> continueFrom == null || e.getKey().identifier().compareTo(continueFrom) >= 0)
            .sorted(Map.Entry.comparingByKey(Comparator.comparing(NameKey::identifier)))
            .limit(count)
            .map(e -> load(e.getValue()))
            .flatMap(Optional::stream)
            .map(aggregate -> aggregate.asInfo(includes))
            .collect(Collectors.toList());
    }

    @Override
    public List<AccessListInfo> getAccessListsByMember(UUID partyId) {
        return byName.values().stream()
            .map(this::load)
            .flatMap(Optional::stream)
            .filter(aggregate -> aggregate.members().contains(partyId))
            .map(AccessListAggregate::asInfo)
            .sorted(Comparator.comparing(AccessListInfo::resourceOwner).thenComparing(AccessListInfo::identifier))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<AccessListInfo> lookupInfo(AccessListIdentifier identifier, Set<AccessListIncludes> includes) {
        return load(identifier).map(aggregate -> aggregate.asInfo(includes));
    }

    @Override
    public Optional<AccessListData<List<AccessListResourceConnection>>> getResourceConnections(
            AccessListIdentifier identifier, String continueFrom, int count, boolean includeActions) {
        return load(identifier).map(aggregate -> {
            List<AccessListResourceConnection> connections = aggregate.resourceConnections().stream()
                .filter(c -> continueFrom == null || c.resourceIdentifier().compareTo(continueFrom) >= 0)
                .limit(count)
                .map(c -> includeActions ? c : c.withoutActions())
                .collect(Collectors.toList());
            return AccessListData.of(aggregate.asInfo(), connections);
        });
    }

    @Override
    public Optional<AccessListData<List<AccessListMembership>>> getMemberships(
            AccessListIdentifier identifier, UUID continueFrom, int count) {
        return load(identifier).map(aggregate -> {
            List<AccessListMembership> memberships = aggregate.memberships().stream()
                .filter(m -> continueFrom == null || m.partyId().compareTo(continueFrom) >= 0)
                .limit(count)
                .collect(Collectors.toList());
            return AccessListData.of(aggregate.asInfo(), memberships);
        });
    }

    @Override
    public AccessListAggregate createAccessList(String resourceOwner, String identifier, String name, String description) {
        AccessListAggregate aggregate = AccessListAggregate.create(clock, UUID.randomUUID());
        aggregate.initialize(resourceOwner, identifier, name, description);
        applyChanges(aggregate);
        return aggregate;
    }

    @Override
    public synchronized Optional<AccessListLoadOrCreateResult> loadOrCreate(
            String resourceOwner, String identifier, String name, String description) {
        UUID existing = byName.get(new NameKey(resourceOwner, identifier));
        if (existing != null) {
            return load(existing).map(AccessListLoadOrCreateResult::loaded);
        }
        return Optional.of(AccessListLoadOrCreateResult.created(
            createAccessList(resourceOwner, identifier, name, description)));
    }

    @Override
    public Optional<AccessListAggregate> load(UUID id) {
        List<AccessListEvent> events = streams.get(id);
        if (events == null) {
            return Optional.empty();
        }

        AccessListAggregate aggregate = AccessListAggregate.loadFrom(clock, id, events);
        return aggregate.exists() ? Optional.of(aggregate) : Optional.empty();
    }

    @Override
    public Optional<AccessListAggregate> load(String resourceOwner, String identifier) {
        UUID id = byName.get(new NameKey(resourceOwner, identifier));
        return id != null ? load(id) : Optional.empty();
    }

    @Override
    public synchronized int applyChanges(AccessListAggregate aggregate) {
        if (!aggregate.hasUncommittedEvents()) {
            return 0;
        }

        UUID id = aggregate.id();
        List<AccessListEvent> stored = streams.getOrDefault(id, List.of());
        EventId storedVersion = stored.isEmpty() ? EventId.UNSET : stored.get(stored.size() - 1).eventId();
        EventId expectedVersion = aggregate.committedVersion();
        if (!storedVersion.equals(expectedVersion)) {
            throw new OptimisticConcurrencyException(id, expectedVersion.value());
        }

        List<AccessListEvent> pending = aggregate.uncommittedEvents();
        Map<NameKey, UUID> names = new HashMap<>(byName);
        NameKey currentName = stored.isEmpty() ? null : nameOf(id, names);
        List<EventId> ids = new ArrayList<>(pending.size());
        List<AccessListEvent> persisted = new ArrayList<>(stored);
        EventId next = expectedVersion;

        for (AccessListEvent event : pending) {
            currentName = updateNameIndex(names, id, currentName, event);
            next = next.next();
            ids.add(next);
            persisted.add(event.withEventId(next));
        }

        byName.keySet().retainAll(names.keySet());
        byName.putAll(names);
        streams.put(id, List.copyOf(persisted));

        aggregate.assignEventIds(ids);
        aggregate.commit();

        log.debug("Persisted {} events for access list {}, version {}", ids.size(), id, next);
        return ids.size();
    }

    private NameKey updateNameIndex(Map<NameKey, UUID> names, UUID id, NameKey current, AccessListEvent event) {
        EventValues values = event.asValues();
        return switch (event.kind()) {
            case CREATED -> {
                NameKey key = new NameKey(values.resourceOwner(), values.identifier());
                claim(names, key, id);
                yield key;
            }
            case UPDATED -> {
                if (values.identifier() == null) {
                    yield current;
                }
                NameKey key = new NameKey(current.resourceOwner(), values.identifier());
                if (!key.equals(current)) {
                    claim(names, key, id);
                    names.remove(current);
                }
                yield key;
            }
            case DELETED -> {
                names.remove(current);
                yield null;
            }
            default -> current;
        };
    }

    private static void claim(Map<NameKey, UUID> names, NameKey key, UUID id) {
        UUID holder = names.putIfAbsent(key, id);
        if (holder != null && !holder.equals(id)) {
            throw new DuplicateAccessListException(key.resourceOwner(), key.identifier());
        }
    }

    private static NameKey nameOf(UUID id, Map<NameKey, UUID> names) {
        return names.entrySet().stream()
            .filter(e -> e.getValue().equals(id))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse(null);
    }

    /**
     * Clear all stored lists.
     */
    public synchronized void clear() {
        streams.clear();
        byName.clear();
    }

    private record NameKey(String resourceOwner, String identifier) {
    }
}
