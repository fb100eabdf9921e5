package com.accesslist.core.aggregate;

import com.accesslist.core.model.AccessListIncludes;
import com.accesslist.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Replaying a stream must rebuild exactly the state the live mutations produced.
 */
@DisplayName("Replay determinism")
class ReplayDeterminismTest {

    private static final EnumSet<AccessListIncludes> ALL = EnumSet.of(AccessListIncludes.RESOURCE_CONNECTIONS_ACTIONS);

    private TimeController time;
    private AccessListAggregate original;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2024-03-01T08:00:00Z"));
        original = AccessListAggregate.create(time, UUID.randomUUID());

        UUID p1 = UUID.randomUUID();
        UUID p2 = UUID.randomUUID();
        UUID p3 = UUID.randomUUID();

        original.initialize("skd", "banks", "Approved banks", "desc");
        AccessListAggregateTest.persist(original);

        time.advanceSeconds(5);
        original.addResourceConnection("tax-api", List.of("read"));
        original.addResourceConnection("pay-api", List.of("read", "write"));
        original.addMembers(List.of(p1, p2));
        AccessListAggregateTest.persist(original);

        time.advanceSeconds(5);
        original.addResourceConnectionActions("tax-api", List.of("write"));
        original.removeResourceConnectionActions("pay-api", List.of("read"));
        original.removeResourceConnection("pay-api");
        original.addMembers(List.of(p3));
        original.removeMembers(List.of(p1));
        original.update("banks-v2", "Banks", null);
        AccessListAggregateTest.persist(original);
    }

    @Test
    @DisplayName("Replayed aggregate equals the live one")
    void replayMatchesLive() {
        AccessListAggregate replayed = AccessListAggregate.loadFrom(time, original.id(), original.events());

        assertThat(replayed.asInfo(ALL)).isEqualTo(original.asInfo(ALL));
        assertThat(replayed.memberships()).isEqualTo(original.memberships());
        assertThat(replayed.committedVersion()).isEqualTo(EventId.of(original.events().size()));
    }

    @Test
    @DisplayName("Replay does not depend on the clock")
    void replayIgnoresClock() {
        TimeController later = TimeController.frozenAt(Instant.parse("2030-01-01T00:00:00Z"));

        AccessListAggregate first = AccessListAggregate.loadFrom(time, original.id(), original.events());
        AccessListAggregate second = AccessListAggregate.loadFrom(later, original.id(), original.events());

        assertThat(second.asInfo(ALL)).isEqualTo(first.asInfo(ALL));
        assertThat(second.memberships()).isEqualTo(first.memberships());
    }

    @Test
    @DisplayName("Events survive their flat stored form")
    void replayFromStoredValues() {
        List<AccessListEvent> stored = original.events().stream()
            .map(AccessListEvent::asValues)
            .map(AccessListEvent::fromValues)
            .toList();

        AccessListAggregate replayed = AccessListAggregate.loadFrom(time, original.id(), stored);

        assertThat(replayed.asInfo(ALL)).isEqualTo(original.asInfo(ALL));
        assertThat(replayed.memberships()).isEqualTo(original.memberships());
    }

    @Test
    @DisplayName("Events of another aggregate are rejected")
    void replayForeignEvents() {
        assertThatThrownBy(() -> AccessListAggregate.loadFrom(time, UUID.randomUUID(), original.events()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("belongs to aggregate");
    }
}
