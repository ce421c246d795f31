package com.example.shelflife.service;

import com.example.shelflife.domain.EnvironmentalReading;
import com.example.shelflife.exception.MissingEnvironmentalDataException;
import com.example.shelflife.util.EnvironmentalContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Resolves the temperature/humidity pair a prediction runs on: caller overrides win,
 * otherwise the mean of the batch's recent readings.
 */
@Service
@Slf4j
public class EnvironmentalContextResolver {
  @Value("${shelf-life.sensors.sample-limit:50}")
  private int sampleLimit = 50;

  /**
   * @param batchId      batch the readings belong to, used in error messages only
   * @param recent       most recent readings, newest first
   */
  public EnvironmentalContext resolve(String batchId, List<EnvironmentalReading> recent,
                                      Double temperatureOverride, Double humidityOverride) {
    List<EnvironmentalReading> window = recent == null ? List.of() : recent.stream()
        .filter(Objects::nonNull)
        .limit(Math.max(1, sampleLimit))
        .toList();

    OptionalDouble avgTemp = window.stream()
        .map(EnvironmentalReading::temperatureC)
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .average();
    OptionalDouble avgHum = window.stream()
        .map(EnvironmentalReading::humidityPercent)
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .average();

    Double temperature = temperatureOverride != null ? temperatureOverride
        : (avgTemp.isPresent() ? avgTemp.getAsDouble() : null);
    Double humidity = humidityOverride != null ? humidityOverride
        : (avgHum.isPresent() ? avgHum.getAsDouble() : null);
    if (temperature == null || humidity == null) {
      throw new MissingEnvironmentalDataException(batchId);
    }
    log.debug("Resolved context for batch '{}': temp={} humidity={} samples={}",
        batchId, temperature, humidity, window.size());
    return new EnvironmentalContext(temperature, humidity, window);
  }

  public int getSampleLimit() {
    return sampleLimit;
  }
}
