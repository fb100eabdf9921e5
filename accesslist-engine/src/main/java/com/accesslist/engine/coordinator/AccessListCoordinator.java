package com.accesslist.engine.coordinator;

import com.accesslist.core.aggregate.AccessListAggregate;
import com.accesslist.core.aggregate.AccessListEvent;
import com.accesslist.core.condition.ConditionResult;
import com.accesslist.core.condition.VersionCondition;
import com.accesslist.core.condition.VersionedEntity;
import com.accesslist.core.exception.AccessListValidationException;
import com.accesslist.core.exception.OptimisticConcurrencyException;
import com.accesslist.core.exception.RetriesExhaustedException;
import com.accesslist.core.model.*;
import com.accesslist.core.repository.AccessListLoadOrCreateResult;
import com.accesslist.core.repository.AccessListRepository;
import com.accesslist.engine.logging.LoggingContext;
import com.accesslist.engine.metrics.AccessListMetrics;
import com.accesslist.engine.service.AccessListService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.util.*;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Orchestrates access list operations: load, check preconditions, mutate, persist.
 *
 * Each write runs as one unit of work inside its own transaction. When persisting loses an
 * optimistic concurrency race the whole unit is retried with backoff, starting again from the
 * load, until the retry policy runs out.
 */
public class AccessListCoordinator implements AccessListService {

    private static final Logger log = LoggerFactory.getLogger(AccessListCoordinator.class);

    private final AccessListRepository repository;
    private final TransactionOperations transactions;
    private final ConflictRetryPolicy retryPolicy;
    private final AccessListMetrics metrics;
    private final int pageSize;

    public AccessListCoordinator(
            AccessListRepository repository,
            TransactionOperations transactions,
            ConflictRetryPolicy retryPolicy,
            AccessListMetrics metrics,
            int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
        this.repository = repository;
        this.transactions = transactions;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.pageSize = pageSize;
    }

    // ========== Lists ==========

    @Override
    public Page<AccessListInfo> getAccessListsByOwner(
            String resourceOwner, String continuationToken, Set<AccessListIncludes> includes) {
        requireText(resourceOwner, "resourceOwner");

        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, null, "getAccessListsByOwner")) {
            // one extra item tells whether there is a next page
            List<AccessListInfo> lists = repository.getAccessListsByOwner(
                resourceOwner, continuationToken, pageSize + 1, normalize(includes));
            Page<AccessListInfo> page = Page.create(lists, pageSize, AccessListInfo::identifier);

            log.info("Listed {} access lists of {} (more: {})", page.items().size(), resourceOwner, page.hasNext());
            return page;
        }
    }

    @Override
    public List<AccessListInfo> getAccessListsByMember(UUID partyId) {
        Objects.requireNonNull(partyId, "partyId");

        try (LoggingContext ctx = LoggingContext.forOperation("getAccessListsByMember")) {
            List<AccessListInfo> lists = repository.getAccessListsByMember(partyId);

            log.info("Party {} is a member of {} access lists", partyId, lists.size());
            return lists;
        }
    }

    @Override
    public Conditional<AccessListInfo, Long> getAccessList(
            String resourceOwner, String identifier, Set<AccessListIncludes> includes, VersionCondition<Long> condition) {
        String operation = "getAccessList";
        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, identifier, operation)) {
            log.info("Getting access list {}/{}", resourceOwner, identifier);

            Optional<AccessListData<AccessListInfo>> info = repository
                .lookupInfo(AccessListIdentifier.byName(resourceOwner, identifier), normalize(includes))
                .map(found -> AccessListData.of(found, found));

            return completed(operation, evaluateRead(info, condition, AccessListData::value));
        }
    }

    @Override
    public Conditional<AccessListInfo, Long> deleteAccessList(
            String resourceOwner, String identifier, VersionCondition<Long> condition) {
        String operation = "deleteAccessList";
        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, identifier, operation)) {
            log.info("Deleting access list {}/{}", resourceOwner, identifier);

            return completed(operation, writeFlow(operation, resourceOwner, identifier, condition, aggregate -> {
                aggregate.delete();
                return Optional.of(aggregate::asInfo);
            }));
        }
    }

    @Override
    public Conditional<AccessListInfo, Long> createOrUpdateAccessList(
            UpsertAccessListRequest request, VersionCondition<Long> condition) {
        requireText(request.resourceOwner(), "resourceOwner");
        requireText(request.identifier(), "identifier");
        requireText(request.name(), "name");

        String operation = "createOrUpdateAccessList";
        try (LoggingContext ctx = LoggingContext.forAccessList(request.resourceOwner(), request.identifier(), operation)) {
            log.info("Creating or updating access list {}/{}", request.resourceOwner(), request.identifier());

            return completed(operation, inTransactionWithRetry(operation,
                () -> createOrUpdateOnce(operation, request, condition)));
        }
    }

    private Conditional<AccessListInfo, Long> createOrUpdateOnce(
            String operation, UpsertAccessListRequest request, VersionCondition<Long> condition) {
        AccessListAggregate aggregate;

        // Creating must be decided before anything is loaded so that it is atomic with loadOrCreate
        if (condition.validate(VersionedEntity.absent()) == ConditionResult.SUCCEEDED) {
            AccessListLoadOrCreateResult result = repository.loadOrCreate(
                    request.resourceOwner(), request.identifier(), request.name(), request.description())
                .orElseThrow(() -> OptimisticConcurrencyException.listVanished(
                    request.resourceOwner(), request.identifier()));

            aggregate = result.aggregate();
            LoggingContext.setAccessListId(aggregate.id());
            if (result.isCreated()) {
                metrics.eventsAppended(aggregate.events());
                log.info("Created access list {}", aggregate.id());
                return Conditional.found(aggregate.asInfo());
            }
        } else {
            Optional<AccessListAggregate> loaded = repository.load(request.resourceOwner(), request.identifier());
            if (loaded.isEmpty()) {
                return Conditional.conditionFailed();
            }
            aggregate = loaded.get();
            LoggingContext.setAccessListId(aggregate.id());
        }

        if (!writeAllowed(operation, condition.validate(aggregate))) {
            return Conditional.conditionFailed();
        }

        String name = request.name().equals(aggregate.name()) ? null : request.name();
        String description = request.description() == null || request.description().equals(aggregate.description())
            ? null
            : request.description();

        if (name != null || description != null) {
            aggregate.update(null, name, description);
            persist(aggregate);
            log.info("Updated access list {} to version {}", aggregate.id(), aggregate.committedVersion());
        }

        return Conditional.found(aggregate.asInfo());
    }

    // ========== Resource connections ==========

    @Override
    public Conditional<AccessListData<Page<AccessListResourceConnection>>, Long> getResourceConnections(
            String resourceOwner, String identifier, String continuationToken, VersionCondition<Long> condition) {
        String operation = "getResourceConnections";
        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, identifier, operation)) {
            log.info("Getting resource connections of {}/{}", resourceOwner, identifier);

            Optional<AccessListData<List<AccessListResourceConnection>>> connections = repository.getResourceConnections(
                AccessListIdentifier.byName(resourceOwner, identifier), continuationToken, pageSize + 1, true);

            return completed(operation, evaluateRead(connections, condition,
                data -> data.map(items -> Page.create(items, pageSize, AccessListResourceConnection::resourceIdentifier))));
        }
    }

    @Override
    public Conditional<AccessListData<AccessListResourceConnection>, Long> upsertResourceConnection(
            String resourceOwner, String identifier, String resourceIdentifier, Set<String> actions,
            VersionCondition<Long> condition) {
        requireText(resourceIdentifier, "resourceIdentifier");
        Set<String> requested = actions != null ? actions : Set.of();

        String operation = "upsertResourceConnection";
        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, identifier, operation)) {
            log.info("Upserting connection of {}/{} to resource {} with actions {}",
                resourceOwner, identifier, resourceIdentifier, requested);

            return completed(operation, writeFlow(operation, resourceOwner, identifier, condition, aggregate -> {
                Optional<AccessListResourceConnection> existing = aggregate.resourceConnection(resourceIdentifier);
                AccessListResourceConnection connection;
                if (existing.isEmpty()) {
                    connection = aggregate.addResourceConnection(resourceIdentifier, requested);
                } else {
                    Set<String> missing = new TreeSet<>(requested);
                    missing.removeAll(existing.get().actions());
                    connection = missing.isEmpty()
                        ? existing.get()
                        : aggregate.addResourceConnectionActions(resourceIdentifier, missing);
                }
                return Optional.of(() -> AccessListData.of(aggregate.asInfo(), connection));
            }));
        }
    }

    @Override
    public Conditional<AccessListData<AccessListResourceConnection>, Long> deleteResourceConnection(
            String resourceOwner, String identifier, String resourceIdentifier, VersionCondition<Long> condition) {
        requireText(resourceIdentifier, "resourceIdentifier");

        String operation = "deleteResourceConnection";
        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, identifier, operation)) {
            log.info("Deleting connection of {}/{} to resource {}", resourceOwner, identifier, resourceIdentifier);

            return completed(operation, writeFlow(operation, resourceOwner, identifier, condition, aggregate -> {
                if (aggregate.resourceConnection(resourceIdentifier).isEmpty()) {
                    return Optional.empty();
                }
                AccessListResourceConnection removed = aggregate.removeResourceConnection(resourceIdentifier);
                return Optional.of(() -> AccessListData.of(aggregate.asInfo(), removed));
            }));
        }
    }

    // ========== Members ==========

    @Override
    public Conditional<AccessListData<Page<AccessListMembership>>, Long> getMembers(
            String resourceOwner, String identifier, String continuationToken, VersionCondition<Long> condition) {
        UUID continueFrom = parsePartyToken(continuationToken);

        String operation = "getMembers";
        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, identifier, operation)) {
            log.info("Getting members of {}/{}", resourceOwner, identifier);

            Optional<AccessListData<List<AccessListMembership>>> members = repository.getMemberships(
                AccessListIdentifier.byName(resourceOwner, identifier), continueFrom, pageSize + 1);

            return completed(operation, evaluateRead(members, condition,
                data -> data.map(items -> Page.create(items, pageSize, m -> m.partyId().toString()))));
        }
    }

    @Override
    public Conditional<AccessListData<List<AccessListMembership>>, Long> addMembers(
            String resourceOwner, String identifier, Set<UUID> partyIds, VersionCondition<Long> condition) {
        requireParties(partyIds);

        String operation = "addMembers";
        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, identifier, operation)) {
            log.info("Adding {} members to {}/{}", partyIds.size(), resourceOwner, identifier);

            return completed(operation, writeFlow(operation, resourceOwner, identifier, condition, aggregate -> {
                Set<UUID> toAdd = new TreeSet<>(partyIds);
                toAdd.removeAll(aggregate.members());
                if (!toAdd.isEmpty()) {
                    aggregate.addMembers(toAdd);
                }
                return Optional.of(() -> AccessListData.of(aggregate.asInfo(), aggregate.memberships()));
            }));
        }
    }

    @Override
    public Conditional<AccessListData<List<AccessListMembership>>, Long> removeMembers(
            String resourceOwner, String identifier, Set<UUID> partyIds, VersionCondition<Long> condition) {
        requireParties(partyIds);

        String operation = "removeMembers";
        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, identifier, operation)) {
            log.info("Removing {} members from {}/{}", partyIds.size(), resourceOwner, identifier);

            return completed(operation, writeFlow(operation, resourceOwner, identifier, condition, aggregate -> {
                Set<UUID> toRemove = new TreeSet<>(partyIds);
                toRemove.retainAll(aggregate.members());
                if (!toRemove.isEmpty()) {
                    aggregate.removeMembers(toRemove);
                }
                return Optional.of(() -> AccessListData.of(aggregate.asInfo(), aggregate.memberships()));
            }));
        }
    }

    @Override
    public Conditional<AccessListData<List<AccessListMembership>>, Long> replaceMembers(
            String resourceOwner, String identifier, Set<UUID> partyIds, VersionCondition<Long> condition) {
        requireParties(partyIds);

        String operation = "replaceMembers";
        try (LoggingContext ctx = LoggingContext.forAccessList(resourceOwner, identifier, operation)) {
            log.info("Replacing members of {}/{} with {} parties", resourceOwner, identifier, partyIds.size());

            return completed(operation, writeFlow(operation, resourceOwner, identifier, condition, aggregate -> {
                Set<UUID> current = aggregate.members();

                Set<UUID> toRemove = new TreeSet<>(current);
                toRemove.removeAll(partyIds);
                Set<UUID> toAdd = new TreeSet<>(partyIds);
                toAdd.removeAll(current);

                if (!toRemove.isEmpty()) {
                    aggregate.removeMembers(toRemove);
                }
                if (!toAdd.isEmpty()) {
                    aggregate.addMembers(toAdd);
                }
                return Optional.of(() -> AccessListData.of(aggregate.asInfo(), aggregate.memberships()));
            }));
        }
    }

    // ========== Flows ==========

    /**
     * Read flow: not found, then the condition decides between found, unmodified and failed.
     */
    private <T, R> Conditional<R, Long> evaluateRead(
            Optional<AccessListData<T>> data,
            VersionCondition<Long> condition,
            Function<AccessListData<T>, R> value) {
        if (data.isEmpty()) {
            return Conditional.notFound();
        }

        AccessListData<T> entity = data.get();
        LoggingContext.setAccessListId(entity.id());

        return switch (condition.validate(entity)) {
            case SUCCEEDED -> Conditional.found(value.apply(entity));
            case UNMODIFIED -> Conditional.unmodified(entity.version(), entity.updatedAt());
            case FAILED -> Conditional.conditionFailed();
        };
    }

    /**
     * Write flow on an existing list, retried as a whole on concurrency conflicts.
     * {@code change} mutates the aggregate and returns the result to build once the changes are
     * committed, or empty for "not found".
     */
    private <R> Conditional<R, Long> writeFlow(
            String operation,
            String resourceOwner,
            String identifier,
            VersionCondition<Long> condition,
            Function<AccessListAggregate, Optional<Supplier<R>>> change) {
        return inTransactionWithRetry(operation,
            () -> writeOnce(operation, resourceOwner, identifier, condition, change));
    }

    private <R> Conditional<R, Long> writeOnce(
            String operation,
            String resourceOwner,
            String identifier,
            VersionCondition<Long> condition,
            Function<AccessListAggregate, Optional<Supplier<R>>> change) {
        Optional<AccessListAggregate> loaded = repository.load(resourceOwner, identifier);
        if (loaded.isEmpty()) {
            return Conditional.notFound();
        }

        AccessListAggregate aggregate = loaded.get();
        LoggingContext.setAccessListId(aggregate.id());

        if (!writeAllowed(operation, condition.validate(aggregate))) {
            return Conditional.conditionFailed();
        }

        Optional<Supplier<R>> result = change.apply(aggregate);
        if (result.isEmpty()) {
            return Conditional.notFound();
        }

        if (aggregate.hasUncommittedEvents()) {
            persist(aggregate);
        }
        return Conditional.found(result.get().get());
    }

    /**
     * Writes are never conditional cache reads, so UNMODIFIED is not expected here.
     * It is treated as a failed precondition.
     */
    private boolean writeAllowed(String operation, ConditionResult result) {
        if (result == ConditionResult.UNMODIFIED) {
            log.warn("Precondition of write operation {} evaluated to UNMODIFIED, treating it as failed", operation);
        }
        return result == ConditionResult.SUCCEEDED;
    }

    private void persist(AccessListAggregate aggregate) {
        List<AccessListEvent> pending = aggregate.uncommittedEvents();
        metrics.recordPersist(() -> repository.applyChanges(aggregate));
        metrics.eventsAppended(pending);
    }

    /**
     * Runs {@code unitOfWork} in a fresh transaction, retrying it from scratch when it loses an
     * optimistic concurrency race.
     */
    private <T> T inTransactionWithRetry(String operation, Supplier<T> unitOfWork) {
        metrics.writeStarted();
        try {
            int attempt = 1;
            while (true) {
                LoggingContext.setAttempt(attempt);
                try {
                    return transactions.execute(status -> unitOfWork.get());
                } catch (OptimisticConcurrencyException e) {
                    metrics.concurrencyConflict(operation);

                    if (!retryPolicy.hasMoreAttempts(attempt)) {
                        metrics.retriesExhausted(operation);
                        log.error("Operation {} gave up after {} attempts: {}", operation, attempt, e.getMessage());
                        throw new RetriesExhaustedException(operation, attempt, e);
                    }

                    Duration backoff = retryPolicy.computeBackoff(attempt);
                    log.warn("Concurrency conflict in {} on attempt {}/{}, retrying in {}ms: {}",
                        operation, attempt, retryPolicy.maxAttempts(), backoff.toMillis(), e.getMessage());
                    backOff(backoff, operation, attempt, e);
                    attempt++;
                }
            }
        } finally {
            metrics.writeFinished();
        }
    }

    private static void backOff(Duration backoff, String operation, int attempt, OptimisticConcurrencyException conflict) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            RetriesExhaustedException interrupted = new RetriesExhaustedException(operation, attempt, conflict);
            interrupted.addSuppressed(e);
            throw interrupted;
        }
    }

    private <T> Conditional<T, Long> completed(String operation, Conditional<T, Long> result) {
        metrics.operationCompleted(operation, result.kind());
        log.info("Operation {} finished: {}", operation, result.kind());
        return result;
    }

    // ========== Validation ==========

    private static Set<AccessListIncludes> normalize(Set<AccessListIncludes> includes) {
        return includes != null ? includes : EnumSet.noneOf(AccessListIncludes.class);
    }

    private static void requireText(String value, String parameter) {
        if (value == null || value.isBlank()) {
            throw new AccessListValidationException(parameter, String.format("%s must be specified", parameter));
        }
    }

    private static void requireParties(Set<UUID> partyIds) {
        if (partyIds == null) {
            throw new AccessListValidationException("partyIds", "Party IDs must be specified");
        }
        // immutable sets reject contains(null)
        if (partyIds.stream().anyMatch(Objects::isNull)) {
            throw new AccessListValidationException("partyIds", "Party IDs must not contain null");
        }
    }

    private static UUID parsePartyToken(String continuationToken) {
        if (continuationToken == null) {
            return null;
        }
        try {
            return UUID.fromString(continuationToken);
        } catch (IllegalArgumentException e) {
            throw new AccessListValidationException("continuationToken",
                String.format("Invalid continuation token '%s'", continuationToken));
        }
    }
}
