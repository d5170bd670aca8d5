package com.gridintel.generation.model;

import java.util.List;
import java.util.Optional;

/**
 * Canonical, casing-free view of one county's cached forecast.
 *
 * <p>{@code sharedElements} are elements published at the location-group
 * level; they stand in for any town that carries no elements of its own.
 */
public record ForecastDocument(List<ForecastLocation> locations, List<ForecastElement> sharedElements) {

    public static final ForecastDocument EMPTY = new ForecastDocument(List.of(), List.of());

    public ForecastDocument {
        locations = locations == null ? List.of() : List.copyOf(locations);
        sharedElements = sharedElements == null ? List.of() : List.copyOf(sharedElements);
    }

    public Optional<ForecastLocation> location(String name) {
        if (name == null) return Optional.empty();
        return locations.stream().filter(l -> name.equals(l.name())).findFirst();
    }

    /** Elements that apply to the named town, falling back to the shared ones. */
    public List<ForecastElement> elementsFor(String townName) {
        return location(townName)
                .map(ForecastLocation::elements)
                .filter(elements -> !elements.isEmpty())
                .orElse(sharedElements);
    }
}
