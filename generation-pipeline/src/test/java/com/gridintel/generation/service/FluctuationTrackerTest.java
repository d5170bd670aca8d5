package com.gridintel.generation.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FluctuationTrackerTest {

    private static final LocalDateTime TS = LocalDateTime.of(2025, 1, 1, 9, 30);

    private final FluctuationTracker tracker = new FluctuationTracker();

    @Test
    @DisplayName("diff - reports added and missing units as sorted sets")
    void diff_AddedAndMissing() {
        FluctuationTracker.UnitDiff diff = tracker.diff(Set.of("B", "A"), Set.of("B", "C"));

        assertThat(diff.added()).containsExactly("A");
        assertThat(diff.missing()).containsExactly("C");
        assertThat(diff.isStable()).isFalse();
    }

    @Test
    @DisplayName("diff - identical sets are stable")
    void diff_IdenticalIsStable() {
        Set<String> units = Set.of("林口#1", "大潭#7");

        FluctuationTracker.UnitDiff diff = tracker.diff(units, units);

        assertThat(diff.added()).isEmpty();
        assertThat(diff.missing()).isEmpty();
        assertThat(diff.isStable()).isTrue();
    }

    @Test
    @DisplayName("diff - empty previous state counts every current unit as added")
    void diff_EmptyPrevious() {
        FluctuationTracker.UnitDiff diff = tracker.diff(Set.of("Z", "Y"), Set.of());

        assertThat(diff.added()).containsExactly("Y", "Z");
        assertThat(diff.missing()).isEmpty();
    }

    @Test
    @DisplayName("describe - renders header and only the non-empty sections")
    void describe_Format() {
        String changed = tracker.describe(TS, 2, tracker.diff(Set.of("A", "D"), Set.of("C", "D")));
        String stable = tracker.describe(TS, 1, tracker.diff(Set.of("A"), Set.of("A")));

        assertThat(changed).isEqualTo("""
                --- Fluctuation Report @ 2025-01-01 09:30:00 (2 plants) ❌ ---
                  [ADDED] A
                  [MISSING] C
                """);
        assertThat(stable).isEqualTo("--- Fluctuation Report @ 2025-01-01 09:30:00 (1 plants) ✅ ---\n");
    }
}
