package com.example.shelflife.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps the two confidence scores to the weight of the kinetic prediction. The regressor
 * receives {@code 1 - alpha}.
 */
@Slf4j
@Component
public class AlphaCalibrator {
  private final double base;
  private final double sensorWeight;
  private final double mlWeight;
  private final double min;
  private final double max;

  public AlphaCalibrator(@Value("${shelf-life.alpha.base:0.35}") double base,
                         @Value("${shelf-life.alpha.sensor-weight:0.30}") double sensorWeight,
                         @Value("${shelf-life.alpha.ml-weight:0.40}") double mlWeight,
                         @Value("${shelf-life.alpha.min:0.1}") double min,
                         @Value("${shelf-life.alpha.max:0.8}") double max) {
    if (min < 0 || max > 1 || min > max) {
      throw new IllegalArgumentException("Alpha bounds must satisfy 0 <= min <= max <= 1, got [" + min + ", " + max + "]");
    }
    this.base = base;
    this.sensorWeight = sensorWeight;
    this.mlWeight = mlWeight;
    this.min = min;
    this.max = max;
  }

  public static AlphaCalibrator defaults() {
    return new AlphaCalibrator(0.35, 0.30, 0.40, 0.1, 0.8);
  }

  public double calibrate(double sensorStability, double mlPerformance, Double override) {
    if (override != null) {
      if (Double.isFinite(override)) {
        return clamp(override, 0.0, 1.0);
      }
      log.warn("Ignoring non-finite alpha override {}", override);
    }
    double alpha = base;
    alpha += (sensorStability - 0.5) * sensorWeight;
    alpha -= (mlPerformance - 0.5) * mlWeight;
    return clamp(alpha, min, max);
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  private double clamp(double value, double lo, double hi) {
    return Math.max(lo, Math.min(hi, value));
  }
}
