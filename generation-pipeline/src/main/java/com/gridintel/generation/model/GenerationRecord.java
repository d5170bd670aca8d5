package com.gridintel.generation.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One active generator unit's output at the run's effective timestamp.
 * Lives only until aggregation; individual units are persisted solely
 * through the unit-details log.
 */
@Value
@Builder
public class GenerationRecord {

    LocalDateTime timestamp;
    String unitName;

    /** Bilingual label, e.g. "燃煤(Coal)" */
    String fuelType;

    /** Net output in MW */
    double netPower;
}
