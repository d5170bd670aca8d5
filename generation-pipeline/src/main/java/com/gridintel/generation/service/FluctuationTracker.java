package com.gridintel.generation.service;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Diffs this run's unit names against the previous run's and renders the
 * per-run fluctuation log block.
 */
@Component
public class FluctuationTracker {

    public record UnitDiff(SortedSet<String> added, SortedSet<String> missing) {

        public UnitDiff {
            added = Collections.unmodifiableSortedSet(new TreeSet<>(added));
            missing = Collections.unmodifiableSortedSet(new TreeSet<>(missing));
        }

        public boolean isStable() {
            return added.isEmpty() && missing.isEmpty();
        }
    }

    public UnitDiff diff(Set<String> currentUnits, Set<String> previousUnits) {
        Set<String> current = currentUnits == null ? Set.of() : currentUnits;
        Set<String> previous = previousUnits == null ? Set.of() : previousUnits;

        SortedSet<String> added = new TreeSet<>(current);
        added.removeAll(previous);

        SortedSet<String> missing = new TreeSet<>(previous);
        missing.removeAll(current);

        return new UnitDiff(added, missing);
    }

    /**
     * Human-readable block, e.g.
     * <pre>
     * --- Fluctuation Report @ 2025-01-01 09:30:00 (212 plants) ❌ ---
     *   [ADDED] 林口#4
     *   [MISSING] 大潭#7
     * </pre>
     */
    public String describe(LocalDateTime timestamp, int plantCount, UnitDiff diff) {
        StringBuilder sb = new StringBuilder()
                .append("--- Fluctuation Report @ ").append(EffectiveTimestamps.format(timestamp))
                .append(" (").append(plantCount).append(" plants) ")
                .append(diff.isStable() ? "✅" : "❌")
                .append(" ---\n");
        if (!diff.added().isEmpty()) {
            sb.append("  [ADDED] ").append(String.join(", ", diff.added())).append('\n');
        }
        if (!diff.missing().isEmpty()) {
            sb.append("  [MISSING] ").append(String.join(", ", diff.missing())).append('\n');
        }
        return sb.toString();
    }
}
