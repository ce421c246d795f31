package com.example.shelflife.service;

import com.example.shelflife.domain.ProductKineticProfile;
import org.springframework.stereotype.Component;

/**
 * Closed-form shelf life from the Arrhenius law, scaled by a humidity penalty.
 */
@Component
public class ArrheniusKineticModel {
  public static final double GAS_CONSTANT = 8.314;
  public static final double KELVIN_OFFSET = 273.15;
  public static final double OPTIMAL_HUMIDITY = 90.0;

  private static final double MIN_HUMIDITY = 30.0;
  private static final double MAX_HUMIDITY = 100.0;
  private static final double HUMIDITY_PENALTY_RATE = 0.02;
  private static final double HUMIDITY_PENALTY_EXPONENT = 1.2;

  public double predictDays(ProductKineticProfile profile, double temperatureC, double humidityPercent) {
    double kInput = rateConstant(profile, temperatureC);
    double kRef = rateConstant(profile, profile.referenceTemperatureC());
    double ratio = kRef / kInput;
    return profile.referenceShelfLifeDays() * ratio * humidityFactor(humidityPercent);
  }

  /**
   * {@code k = A * exp(-Ea / (R * T))} with T in kelvin.
   */
  public double rateConstant(ProductKineticProfile profile, double temperatureC) {
    double kelvin = temperatureC + KELVIN_OFFSET;
    if (!(kelvin > 0)) {
      throw new IllegalArgumentException("Temperature must be above absolute zero, got " + temperatureC + " C");
    }
    return profile.preExponentialFactor() * Math.exp(-profile.activationEnergy() / (GAS_CONSTANT * kelvin));
  }

  public double humidityFactor(double humidityPercent) {
    double rh = clamp(humidityPercent, MIN_HUMIDITY, MAX_HUMIDITY);
    double deviation = Math.abs(rh - OPTIMAL_HUMIDITY);
    return Math.exp(-HUMIDITY_PENALTY_RATE * Math.pow(deviation, HUMIDITY_PENALTY_EXPONENT));
  }

  private double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
