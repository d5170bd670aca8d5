package com.gridintel.generation.service;

import com.gridintel.generation.model.AggregatedRow;
import com.gridintel.generation.model.EnrichedRecord;
import com.gridintel.generation.model.Region;
import com.gridintel.generation.model.WeatherFeatureSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses unit records into one row per (timestamp, region, fuel type).
 *
 * Net power is summed. Weather features are a function of (timestamp, region)
 * and are therefore identical across a group; that is checked rather than
 * assumed, and a mismatch is a programming error.
 */
@Component
@Slf4j
public class GenerationAggregator {

    private record GroupKey(LocalDateTime timestamp, Region region, String fuelType) {
    }

    private static final class Group {
        private final WeatherFeatureSet weather;
        private double netPowerSum;

        private Group(WeatherFeatureSet weather) {
            this.weather = weather;
        }
    }

    public List<AggregatedRow> aggregate(List<EnrichedRecord> records) {
        Map<GroupKey, Group> groups = new LinkedHashMap<>();

        for (EnrichedRecord r : records) {
            GroupKey key = new GroupKey(r.getTimestamp(), r.getRegion(), r.getFuelType());
            WeatherFeatureSet weather = r.getWeather() == null ? WeatherFeatureSet.EMPTY : r.getWeather();
            Group group = groups.computeIfAbsent(key, k -> new Group(weather));
            if (!Objects.equals(group.weather, weather)) {
                throw new IllegalStateException(String.format(
                        "Non-uniform weather features in group %s: unit %s has %s, group has %s",
                        key, r.getUnitName(), weather, group.weather));
            }
            group.netPowerSum += r.getNetPower();
        }

        List<AggregatedRow> rows = new ArrayList<>(groups.size());
        groups.forEach((key, group) -> rows.add(AggregatedRow.builder()
                .timestamp(key.timestamp())
                .region(key.region())
                .fuelType(key.fuelType())
                .netPowerSum(group.netPowerSum)
                .weather(group.weather)
                .build()));

        rows.sort(Comparator.comparing(AggregatedRow::getTimestamp)
                .thenComparing(AggregatedRow::getRegion)
                .thenComparing(AggregatedRow::getFuelType, Comparator.nullsFirst(Comparator.naturalOrder())));

        log.info("Aggregated {} unit records into {} rows", records.size(), rows.size());
        return rows;
    }
}
