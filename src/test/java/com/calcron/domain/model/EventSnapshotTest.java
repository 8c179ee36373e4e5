package com.calcron.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSnapshotTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @Test
    void shouldKeepLastEntryForDuplicateIdsAndSortByStart() {
        // Given
        CalendarEvent first = new CalendarEvent("a", NOW.plusSeconds(300), "echo 1", "r1");
        CalendarEvent other = new CalendarEvent("b", NOW.plusSeconds(100), "echo b", "r1");
        CalendarEvent latest = new CalendarEvent("a", NOW.plusSeconds(200), "echo 2", "r2");

        // When
        EventSnapshot snapshot = EventSnapshot.of(NOW, NOW.plusSeconds(3600), List.of(first, other, latest));

        // Then
        assertThat(snapshot.events()).containsExactly(other, latest);
        assertThat(snapshot.byId()).containsOnlyKeys("a", "b");
    }

    @Test
    void shouldRejectDuplicateIdsWhenBuiltDirectly() {
        // Given
        CalendarEvent one = new CalendarEvent("a", NOW.plusSeconds(1), "echo", "r1");
        CalendarEvent two = new CalendarEvent("a", NOW.plusSeconds(2), "echo", "r2");
        EventSnapshot snapshot = new EventSnapshot(NOW, NOW.plusSeconds(60), List.of(one, two));

        // When / Then
        assertThatThrownBy(snapshot::byId).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectHorizonBeforeReferenceTime() {
        assertThatThrownBy(() -> EventSnapshot.empty(NOW, NOW.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldTreatOnlyStrictlyLaterStartsAsUpcoming() {
        // Given
        EventSnapshot snapshot = EventSnapshot.empty(NOW, NOW.plusSeconds(60));

        // Then
        assertThat(snapshot.isUpcoming(new CalendarEvent("a", NOW, "x", "r"))).isFalse();
        assertThat(snapshot.isUpcoming(new CalendarEvent("b", NOW.plusMillis(1), "x", "r"))).isTrue();
    }
}
