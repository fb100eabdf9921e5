package com.accesslist.engine.persistence.jdbc;

import com.accesslist.core.aggregate.AccessListAggregate;
import com.accesslist.core.aggregate.AccessListEvent;
import com.accesslist.core.aggregate.AccessListEventKind;
import com.accesslist.core.aggregate.EventId;
import com.accesslist.core.aggregate.EventValues;
import com.accesslist.core.exception.DuplicateAccessListException;
import com.accesslist.core.exception.OptimisticConcurrencyException;
import com.accesslist.core.model.*;
import com.accesslist.core.repository.AccessListLoadOrCreateResult;
import com.accesslist.core.repository.AccessListRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL-backed implementation of AccessListRepository.
 *
 * Aggregates are rebuilt from {@code access_list_events}. Every append also maintains the
 * state tables that serve the read queries. Event ids are numbered per aggregate and form the
 * primary key together with the aggregate id, so two writers appending on top of the same
 * version collide on insert; the state row's version column is checked as well.
 */
@Repository("jdbcAccessListRepository")
@ConditionalOnProperty(name = "accesslist.persistence", havingValue = "jdbc", matchIfMissing = true)
public class JdbcAccessListRepository implements AccessListRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAccessListRepository.class);

    static final String OWNER_IDENTIFIER_CONSTRAINT = "uq_access_list_state_owner_ident";

    private static final UUID NIL_UUID = new UUID(0L, 0L);
    private static final TypeReference<Set<String>> ACTIONS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Set<UUID>> PARTY_IDS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate savepointTemplate;
    private final Clock clock;

    private final EventRowMapper eventRowMapper = new EventRowMapper();
    private final InfoRowMapper infoRowMapper = new InfoRowMapper();
    private final ConnectionRowMapper connectionRowMapper = new ConnectionRowMapper();

    public JdbcAccessListRepository(
            JdbcTemplate jdbcTemplate,
            ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.savepointTemplate = new TransactionTemplate(transactionManager);
        this.savepointTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    // ========== Read models ==========

    @Override
    public List<AccessListInfo> getAccessListsByOwner(
            String resourceOwner, String continueFrom, int count, Set<AccessListIncludes> includes) {
        String sql = """
            SELECT * FROM access_list_state
            WHERE resource_owner = ? AND identifier COLLATE "C" >= ?
            ORDER BY identifier COLLATE "C" ASC
            LIMIT ?
            """;
        List<AccessListInfo> lists = jdbcTemplate.query(sql, infoRowMapper,
            resourceOwner, continueFrom != null ? continueFrom : "", count);
        return withResourceConnections(lists, includes);
    }

    @Override
    public List<AccessListInfo> getAccessListsByMember(UUID partyId) {
        String sql = """
            SELECT s.* FROM access_list_state s
            JOIN access_list_members_state m ON m.aggregate_id = s.aggregate_id
            WHERE m.party_id = ?
            ORDER BY s.resource_owner COLLATE "C" ASC, s.identifier COLLATE "C" ASC
            """;
        return jdbcTemplate.query(sql, infoRowMapper, partyId);
    }

    @Override
    public Optional<AccessListInfo> lookupInfo(AccessListIdentifier identifier, Set<AccessListIncludes> includes) {
        return findState(identifier)
            .map(info -> withResourceConnections(List.of(info), includes).get(0));
    }

    @Override
    public Optional<AccessListData<List<AccessListResourceConnection>>> getResourceConnections(
            AccessListIdentifier identifier, String continueFrom, int count, boolean includeActions) {
        return findState(identifier).map(info -> {
            String sql = """
                SELECT * FROM access_list_resource_connections_state
                WHERE aggregate_id = ? AND resource_identifier COLLATE "C" >= ?
                ORDER BY resource_identifier COLLATE "C" ASC
                LIMIT ?
                """;
            List<AccessListResourceConnection> connections = jdbcTemplate.query(sql, connectionRowMapper,
                    info.id(), continueFrom != null ? continueFrom : "", count).stream()
                .map(ConnectionRow::connection)
                .map(connection -> includeActions ? connection : connection.withoutActions())
                .toList();
            return AccessListData.of(info, connections);
        });
    }

    @Override
    public Optional<AccessListData<List<AccessListMembership>>> getMemberships(
            AccessListIdentifier identifier, UUID continueFrom, int count) {
        return findState(identifier).map(info -> {
            String sql = """
                SELECT party_id, since FROM access_list_members_state
                WHERE aggregate_id = ? AND party_id >= ?
                ORDER BY party_id ASC
                LIMIT ?
                """;
            List<AccessListMembership> memberships = jdbcTemplate.query(sql,
                (rs, rowNum) -> new AccessListMembership(
                    rs.getObject("party_id", UUID.class),
                    toInstant(rs.getTimestamp("since"))),
                info.id(), continueFrom != null ? continueFrom : NIL_UUID, count);
            return AccessListData.of(info, memberships);
        });
    }

    private Optional<AccessListInfo> findState(AccessListIdentifier identifier) {
        List<AccessListInfo> results = identifier.isById()
            ? jdbcTemplate.query("SELECT * FROM access_list_state WHERE aggregate_id = ?",
                infoRowMapper, identifier.id())
            : jdbcTemplate.query("SELECT * FROM access_list_state WHERE resource_owner = ? AND identifier = ?",
                infoRowMapper, identifier.resourceOwner(), identifier.identifier());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private List<AccessListInfo> withResourceConnections(List<AccessListInfo> lists, Set<AccessListIncludes> includes) {
        if (lists.isEmpty() || !AccessListIncludes.resourceConnections(includes)) {
            return lists;
        }
        boolean withActions = AccessListIncludes.resourceConnectionActions(includes);

        String sql = """
            SELECT * FROM access_list_resource_connections_state
            WHERE aggregate_id = ANY(?)
            ORDER BY aggregate_id, resource_identifier COLLATE "C" ASC
            """;
        Object[] ids = lists.stream().map(AccessListInfo::id).toArray();
        List<ConnectionRow> rows = jdbcTemplate.query(sql,
            ps -> ps.setArray(1, ps.getConnection().createArrayOf("uuid", ids)),
            connectionRowMapper);

        Map<UUID, List<AccessListResourceConnection>> byList = new HashMap<>();
        for (ConnectionRow row : rows) {
            byList.computeIfAbsent(row.aggregateId(), k -> new ArrayList<>())
                .add(withActions ? row.connection() : row.connection().withoutActions());
        }

        return lists.stream()
            .map(info -> info.withResourceConnections(byList.getOrDefault(info.id(), List.of())))
            .toList();
    }

    // ========== Aggregates ==========

    @Override
    public Optional<AccessListAggregate> load(UUID id) {
        String sql = """
            SELECT * FROM access_list_events
            WHERE aggregate_id = ?
            ORDER BY eid ASC
            """;
        List<AccessListEvent> events = jdbcTemplate.query(sql, eventRowMapper, id);
        if (events.isEmpty()) {
            return Optional.empty();
        }

        AccessListAggregate aggregate = AccessListAggregate.loadFrom(clock, id, events);
        return aggregate.exists() ? Optional.of(aggregate) : Optional.empty();
    }

    @Override
    public Optional<AccessListAggregate> load(String resourceOwner, String identifier) {
        String sql = "SELECT aggregate_id FROM access_list_state WHERE resource_owner = ? AND identifier = ?";
        List<UUID> ids = jdbcTemplate.query(sql,
            (rs, rowNum) -> rs.getObject("aggregate_id", UUID.class), resourceOwner, identifier);
        return ids.isEmpty() ? Optional.empty() : load(ids.get(0));
    }

    @Override
    @Transactional
    public AccessListAggregate createAccessList(String resourceOwner, String identifier, String name, String description) {
        AccessListAggregate aggregate = AccessListAggregate.create(clock, UUID.randomUUID());
        aggregate.initialize(resourceOwner, identifier, name, description);
        applyChanges(aggregate);

        log.debug("Created access list {} for {}/{}", aggregate.id(), resourceOwner, identifier);
        return aggregate;
    }

    /**
     * Creates the list inside a savepoint. If the owner and identifier are taken, rolls back to
     * the savepoint and loads the existing list instead.
     */
    @Override
    @Transactional
    public Optional<AccessListLoadOrCreateResult> loadOrCreate(
            String resourceOwner, String identifier, String name, String description) {
        try {
            AccessListAggregate created = savepointTemplate.execute(
                status -> createAccessList(resourceOwner, identifier, name, description));
            return Optional.of(AccessListLoadOrCreateResult.created(created));
        } catch (DuplicateAccessListException e) {
            log.debug("Access list {}/{} already exists, loading it", resourceOwner, identifier);
        }

        Optional<AccessListAggregate> existing = load(resourceOwner, identifier);
        if (existing.isEmpty()) {
            log.debug("Access list {}/{} disappeared after a failed create", resourceOwner, identifier);
        }
        return existing.map(AccessListLoadOrCreateResult::loaded);
    }

    @Override
    @Transactional
    public int applyChanges(AccessListAggregate aggregate) {
        if (!aggregate.hasUncommittedEvents()) {
            return 0;
        }

        UUID id = aggregate.id();
        long expectedVersion = aggregate.committedVersion().value();
        List<EventValues> pending = new ArrayList<>();
        List<EventId> ids = new ArrayList<>();
        EventId next = aggregate.committedVersion();
        for (AccessListEvent event : aggregate.uncommittedEvents()) {
            next = next.next();
            ids.add(next);
            pending.add(event.withEventId(next).asValues());
        }

        try {
            insertEvents(pending);
            for (EventValues event : pending) {
                applyToState(aggregate, event, expectedVersion);
            }
            if (!aggregate.isDeleted()) {
                updateVersion(id, expectedVersion, pending.get(pending.size() - 1));
            }
        } catch (DuplicateKeyException e) {
            if (isOwnerIdentifierViolation(e)) {
                throw new DuplicateAccessListException(aggregate.resourceOwner(), aggregate.identifier(), e);
            }
            throw new OptimisticConcurrencyException(id, expectedVersion, e);
        }

        aggregate.assignEventIds(ids);
        aggregate.commit();

        log.debug("Appended {} events to access list {} (version {} -> {})",
            ids.size(), id, expectedVersion, next);
        return ids.size();
    }

    private void insertEvents(List<EventValues> events) {
        String sql = """
            INSERT INTO access_list_events (
                aggregate_id, eid, etime, kind,
                identifier, name, description, resource_owner,
                actions, party_ids
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb)
            """;

        jdbcTemplate.batchUpdate(sql, events, events.size(), (ps, event) -> {
            ps.setObject(1, event.aggregateId());
            ps.setLong(2, event.eventId().dbValue());
            ps.setTimestamp(3, Timestamp.from(event.eventTime()));
            ps.setString(4, event.kind().dbName());
            ps.setString(5, event.identifier());
            ps.setString(6, event.name());
            ps.setString(7, event.description());
            ps.setString(8, event.resourceOwner());
            ps.setString(9, toJson(event.actions()));
            ps.setString(10, toJson(event.partyIds()));
        });
    }

    private void applyToState(AccessListAggregate aggregate, EventValues event, long expectedVersion) {
        UUID id = event.aggregateId();
        Timestamp time = Timestamp.from(event.eventTime());

        switch (event.kind()) {
            case CREATED -> jdbcTemplate.update("""
                INSERT INTO access_list_state (
                    aggregate_id, resource_owner, identifier, name, description,
                    created, modified, version
                ) VALUES (?, ?, ?, ?, ?, ?, ?, 0)
                """,
                id, event.resourceOwner(), event.identifier(), event.name(), event.description(), time, time);

            case UPDATED -> jdbcTemplate.update("""
                UPDATE access_list_state
                SET identifier = COALESCE(?, identifier),
                    name = COALESCE(?, name),
                    description = COALESCE(?, description)
                WHERE aggregate_id = ?
                """,
                event.identifier(), event.name(), event.description(), id);

            case DELETED -> {
                int rows = jdbcTemplate.update(
                    "DELETE FROM access_list_state WHERE aggregate_id = ? AND version = ?",
                    id, expectedVersion);
                if (rows == 0) {
                    throw new OptimisticConcurrencyException(id, expectedVersion);
                }
            }

            case RESOURCE_CONNECTION_CREATED,
                 RESOURCE_CONNECTION_ACTIONS_ADDED,
                 RESOURCE_CONNECTION_ACTIONS_REMOVED -> aggregate.resourceConnection(event.identifier())
                .ifPresent(connection -> jdbcTemplate.update("""
                    INSERT INTO access_list_resource_connections_state (
                        aggregate_id, resource_identifier, actions, created, modified
                    ) VALUES (?, ?, ?::jsonb, ?, ?)
                    ON CONFLICT (aggregate_id, resource_identifier)
                    DO UPDATE SET actions = EXCLUDED.actions, modified = EXCLUDED.modified
                    """,
                    id, connection.resourceIdentifier(), toJson(connection.actions()),
                    Timestamp.from(connection.createdAt()), Timestamp.from(connection.modifiedAt())));

            case RESOURCE_CONNECTION_DELETED -> jdbcTemplate.update(
                "DELETE FROM access_list_resource_connections_state WHERE aggregate_id = ? AND resource_identifier = ?",
                id, event.identifier());

            case MEMBERS_ADDED -> jdbcTemplate.batchUpdate(
                "INSERT INTO access_list_members_state (aggregate_id, party_id, since) VALUES (?, ?, ?)",
                new ArrayList<>(event.partyIds()), event.partyIds().size(), (ps, partyId) -> {
                    ps.setObject(1, id);
                    ps.setObject(2, partyId);
                    ps.setTimestamp(3, time);
                });

            case MEMBERS_REMOVED -> jdbcTemplate.batchUpdate(
                "DELETE FROM access_list_members_state WHERE aggregate_id = ? AND party_id = ?",
                new ArrayList<>(event.partyIds()), event.partyIds().size(), (ps, partyId) -> {
                    ps.setObject(1, id);
                    ps.setObject(2, partyId);
                });
        }
    }

    private void updateVersion(UUID id, long expectedVersion, EventValues last) {
        String sql = """
            UPDATE access_list_state
            SET modified = ?, version = ?
            WHERE aggregate_id = ? AND version = ?
            """;
        int rows = jdbcTemplate.update(sql,
            Timestamp.from(last.eventTime()), last.eventId().dbValue(), id, expectedVersion);
        if (rows == 0) {
            throw new OptimisticConcurrencyException(id, expectedVersion);
        }
    }

    static boolean isOwnerIdentifierViolation(DuplicateKeyException e) {
        Throwable cause = e.getMostSpecificCause();
        if (cause instanceof PSQLException) {
            ServerErrorMessage message = ((PSQLException) cause).getServerErrorMessage();
            return message != null && OWNER_IDENTIFIER_CONSTRAINT.equals(message.getConstraint());
        }
        return false;
    }

    // ========== Mapping ==========

    private String toJson(Collection<?> values) {
        if (values == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + values, e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + json, e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private class EventRowMapper implements RowMapper<AccessListEvent> {
        @Override
        public AccessListEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AccessListEvent.fromValues(new EventValues(
                EventId.of(rs.getLong("eid")),
                AccessListEventKind.fromDbName(rs.getString("kind")),
                toInstant(rs.getTimestamp("etime")),
                rs.getObject("aggregate_id", UUID.class),
                rs.getString("identifier"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("resource_owner"),
                fromJson(rs.getString("actions"), ACTIONS_TYPE),
                fromJson(rs.getString("party_ids"), PARTY_IDS_TYPE)
            ));
        }
    }

    private static class InfoRowMapper implements RowMapper<AccessListInfo> {
        @Override
        public AccessListInfo mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new AccessListInfo(
                rs.getObject("aggregate_id", UUID.class),
                rs.getString("resource_owner"),
                rs.getString("identifier"),
                rs.getString("name"),
                rs.getString("description"),
                toInstant(rs.getTimestamp("created")),
                toInstant(rs.getTimestamp("modified")),
                null,
                rs.getLong("version")
            );
        }
    }

    private record ConnectionRow(UUID aggregateId, AccessListResourceConnection connection) {
    }

    private class ConnectionRowMapper implements RowMapper<ConnectionRow> {
        @Override
        public ConnectionRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ConnectionRow(
                rs.getObject("aggregate_id", UUID.class),
                new AccessListResourceConnection(
                    rs.getString("resource_identifier"),
                    fromJson(rs.getString("actions"), ACTIONS_TYPE),
                    toInstant(rs.getTimestamp("created")),
                    toInstant(rs.getTimestamp("modified"))
                ));
        }
    }
}
