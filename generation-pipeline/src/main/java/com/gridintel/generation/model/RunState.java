package com.gridintel.generation.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Unit names seen by the previous run. Read once at run start and replaced
 * once at run end.
 */
public record RunState(Set<String> unitNames) {

    /** Null and blank names are dropped. */
    public RunState {
        unitNames = unitNames == null
                ? Set.of()
                : Collections.unmodifiableSet(unitNames.stream()
                        .filter(name -> name != null && !name.isBlank())
                        .collect(Collectors.<String, TreeSet<String>>toCollection(TreeSet::new)));
    }

    public static RunState empty() {
        return new RunState(Set.of());
    }

    public static RunState of(Collection<String> unitNames) {
        return new RunState(unitNames == null ? Set.of() : new HashSet<>(unitNames));
    }

    public boolean isEmpty() {
        return unitNames.isEmpty();
    }
}
