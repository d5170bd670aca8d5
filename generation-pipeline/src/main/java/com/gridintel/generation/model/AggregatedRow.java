package com.gridintel.generation.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Unit of persistence: one row per (timestamp, region, fuel type) per run.
 * Within its segment table the timestamp is the primary key.
 */
@Value
@Builder
public class AggregatedRow {

    LocalDateTime timestamp;
    Region region;
    String fuelType;
    double netPowerSum;
    WeatherFeatureSet weather;

    public SegmentKey segmentKey() {
        return new SegmentKey(region, fuelType);
    }
}
