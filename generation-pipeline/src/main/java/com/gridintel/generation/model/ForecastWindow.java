package com.gridintel.generation.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Half-open validity window [start, end) with the first element-value entry
 * of the published block. Bounds are null when the source could not be parsed;
 * such a window never matches an instant.
 */
public record ForecastWindow(Instant start, Instant end, Map<String, String> values) {

    public ForecastWindow {
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean contains(Instant instant) {
        if (start == null || end == null || instant == null) return false;
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
