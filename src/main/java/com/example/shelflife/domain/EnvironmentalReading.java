package com.example.shelflife.domain;

import java.time.Instant;

/**
 * One telemetry sample. Either channel may be missing when a sensor reports partially.
 */
public record EnvironmentalReading(Double temperatureC,
                                   Double humidityPercent,
                                   Instant capturedAt) {
  public static EnvironmentalReading of(double temperatureC, double humidityPercent) {
    return new EnvironmentalReading(temperatureC, humidityPercent, Instant.now());
  }

  public double temperatureOr(double fallback) {
    return temperatureC == null ? fallback : temperatureC;
  }

  public double humidityOr(double fallback) {
    return humidityPercent == null ? fallback : humidityPercent;
  }
}
