package com.gridintel.generation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Regional weather features for the run's effective time and twelve hours
 * ahead. A {@code null} field means the value is missing, never zero.
 */
@Value
@Builder(toBuilder = true)
public class WeatherFeatureSet {

    public static final WeatherFeatureSet EMPTY = WeatherFeatureSet.builder().build();

    Double tempNow;
    Double windNow;
    Integer weatherCodeNow;
    Double tempFuture12h;
    Double windFuture12h;
    Integer weatherCodeFuture12h;

    public boolean isEmpty() {
        return tempNow == null && windNow == null && weatherCodeNow == null
                && tempFuture12h == null && windFuture12h == null && weatherCodeFuture12h == null;
    }
}
