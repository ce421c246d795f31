package com.example.shelflife.service;

import com.example.shelflife.exception.InvalidModelSchemaException;
import com.example.shelflife.model.ShelfLifeRegressionModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Turns (product, temperature, humidity) into the feature vector the loaded model declares
 * and returns its day-count prediction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LearnedShelfLifeRegressor {
  public static final String TEMPERATURE_FEATURE = "Temperature_C";
  public static final String HUMIDITY_FEATURE = "Humidity_%";
  public static final String PRODUCT_FEATURE_PREFIX = "Type_";

  private final ShelfLifeRegressionModel model;

  public double predictDays(String product, double temperatureC, double humidityPercent) {
    double[] features = encode(product, temperatureC, humidityPercent);
    double prediction = model.predict(features);
    if (!Double.isFinite(prediction)) {
      throw new IllegalStateException("Model " + model.description() + " returned " + prediction);
    }
    if (prediction < 0) {
      log.debug("Flooring negative ML prediction {} for product '{}'", prediction, product);
      return 0.0;
    }
    return prediction;
  }

  public double[] encode(String product, double temperatureC, double humidityPercent) {
    List<String> schema = model.featureNames();
    if (schema == null || schema.isEmpty()) {
      throw new InvalidModelSchemaException("Loaded ML model is missing feature metadata: " + model.description());
    }
    String productColumn = PRODUCT_FEATURE_PREFIX + product.trim().toLowerCase(Locale.ROOT);
    double[] features = new double[schema.size()];
    for (int i = 0; i < schema.size(); i++) {
      String column = schema.get(i);
      if (TEMPERATURE_FEATURE.equals(column)) {
        features[i] = temperatureC;
      } else if (HUMIDITY_FEATURE.equals(column)) {
        features[i] = humidityPercent;
      } else if (column.startsWith(PRODUCT_FEATURE_PREFIX)) {
        features[i] = column.equalsIgnoreCase(productColumn) ? 1.0 : 0.0;
      } else {
        features[i] = 0.0;
      }
    }
    return features;
  }
}
