package com.gridintel.generation.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Which townships stand in for a region's weather: temperature and wind are
 * averaged over {@code averagingTowns}; the categorical weather code comes from
 * the single {@code codeTown}.
 */
public record RegionWeatherProfile(List<ForecastTown> averagingTowns, ForecastTown codeTown) {

    public RegionWeatherProfile {
        averagingTowns = List.copyOf(averagingTowns);
    }

    /** Counties whose cached forecasts must all be present to enrich the region. */
    public Set<String> requiredCounties() {
        Set<String> counties = new LinkedHashSet<>();
        averagingTowns.forEach(t -> counties.add(t.county()));
        counties.add(codeTown.county());
        return counties;
    }
}
