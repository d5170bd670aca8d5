package com.gridintel.generation.model;

import java.util.List;

/**
 * A weather element (e.g. 平均溫度) and its ordered validity windows.
 */
public record ForecastElement(String name, List<ForecastWindow> windows) {

    public ForecastElement {
        windows = windows == null ? List.of() : List.copyOf(windows);
    }
}
