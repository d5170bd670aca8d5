package com.gridintel.generation.model;

/**
 * A township inside a county's forecast document.
 */
public record ForecastTown(String county, String town) {
}
