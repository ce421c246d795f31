package com.example.shelflife.domain;

/**
 * Arrhenius constants for one product category.
 *
 * @param product                lower-cased product key
 * @param activationEnergy       Ea in J/mol
 * @param preExponentialFactor   A, the rate constant at infinite temperature
 * @param referenceShelfLifeDays shelf life observed at {@code referenceTemperatureC}
 * @param referenceTemperatureC  temperature the reference shelf life was measured at
 */
public record ProductKineticProfile(String product,
                                    double activationEnergy,
                                    double preExponentialFactor,
                                    double referenceShelfLifeDays,
                                    double referenceTemperatureC) {
  public static final double DEFAULT_REFERENCE_TEMPERATURE_C = 5.0;

  public ProductKineticProfile {
    if (product == null || product.isBlank()) {
      throw new IllegalArgumentException("Kinetic profile requires a product key");
    }
    if (!(activationEnergy > 0) || !(preExponentialFactor > 0) || !(referenceShelfLifeDays > 0)) {
      throw new IllegalArgumentException("Kinetic constants must be positive for product '" + product + "'");
    }
    if (referenceTemperatureC <= -273.15) {
      throw new IllegalArgumentException("Reference temperature below absolute zero for product '" + product + "'");
    }
  }

  public static ProductKineticProfile of(String product, double activationEnergy,
                                         double preExponentialFactor, double referenceShelfLifeDays) {
    return new ProductKineticProfile(product, activationEnergy, preExponentialFactor,
        referenceShelfLifeDays, DEFAULT_REFERENCE_TEMPERATURE_C);
  }
}
