package com.gridintel.generation.model;

/**
 * Identifies one segment table: a clean time series for a single
 * (region, fuel type) pair.
 */
public record SegmentKey(Region region, String fuelType) {
}
