package com.gridintel.generation.model;

import java.util.List;

public record ForecastLocation(String name, List<ForecastElement> elements) {

    public ForecastLocation {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }
}
