package com.gridintel.generation.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A generation record after region resolution and weather enrichment,
 * i.e. one input row for aggregation.
 */
@Value
@Builder
public class EnrichedRecord {

    LocalDateTime timestamp;
    String unitName;
    Region region;
    String fuelType;
    double netPower;
    WeatherFeatureSet weather;

    public static EnrichedRecord of(GenerationRecord record, Region region, WeatherFeatureSet weather) {
        return EnrichedRecord.builder()
                .timestamp(record.getTimestamp())
                .unitName(record.getUnitName())
                .region(region)
                .fuelType(record.getFuelType())
                .netPower(record.getNetPower())
                .weather(weather == null ? WeatherFeatureSet.EMPTY : weather)
                .build();
    }
}
