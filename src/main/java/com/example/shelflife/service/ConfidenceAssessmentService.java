package com.example.shelflife.service;

import com.example.shelflife.domain.EnvironmentalReading;
import com.example.shelflife.domain.PredictionHistoryEntry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores how far each half of the hybrid estimate can be trusted, both in [0, 1].
 */
@Service
public class ConfidenceAssessmentService {
  public static final double NEUTRAL_SCORE = 0.5;
  public static final double SINGLE_READING_SCORE = 0.6;

  private static final double EPSILON = 1e-6;
  private static final double TEMPERATURE_CV_PENALTY = 10.0;
  private static final double HUMIDITY_CV_PENALTY = 5.0;
  private static final int VALIDATED_WINDOW = 20;
  private static final int CONSISTENCY_WINDOW = 10;

  @Value("${shelf-life.performance.per-product-consistency:true}")
  private boolean perProductConsistency = true;

  /**
   * Stability of the recent telemetry window; 1 means every reading was identical.
   * Temperature variation is penalised twice as hard as humidity variation.
   */
  public double sensorStability(List<EnvironmentalReading> readings, double fallbackTemperature,
                                double fallbackHumidity) {
    if (readings == null || readings.isEmpty()) {
      return NEUTRAL_SCORE;
    }
    if (readings.size() < 2) {
      return SINGLE_READING_SCORE;
    }
    double[] temps = new double[readings.size()];
    double[] hums = new double[readings.size()];
    for (int i = 0; i < readings.size(); i++) {
      EnvironmentalReading reading = readings.get(i);
      temps[i] = reading.temperatureOr(fallbackTemperature);
      hums[i] = reading.humidityOr(fallbackHumidity);
    }
    double tempScore = Math.max(0.0, 1 - coefficientOfVariation(temps) * TEMPERATURE_CV_PENALTY);
    double humScore = Math.max(0.0, 1 - coefficientOfVariation(hums) * HUMIDITY_CV_PENALTY);
    return clamp01((tempScore + humScore) / 2);
  }

  /**
   * Track record of the learned model. Uses accuracy against observed shelf lives when any
   * exist, otherwise the spread of the most recent raw ML predictions.
   */
  public double mlPerformance(List<PredictionHistoryEntry> history, String product) {
    if (history == null || history.isEmpty()) {
      return NEUTRAL_SCORE;
    }
    List<PredictionHistoryEntry> validated = history.stream()
        .filter(Objects::nonNull)
        .filter(PredictionHistoryEntry::isValidated)
        .toList();
    if (!validated.isEmpty()) {
      List<Double> scores = new ArrayList<>();
      for (PredictionHistoryEntry entry : tail(validated, VALIDATED_WINDOW)) {
        Double predicted = entry.getHybridPrediction();
        if (predicted == null || predicted == 0.0) {
          continue;
        }
        double actual = entry.getActualShelfLifeDays();
        double error = Math.abs(actual - predicted) / Math.max(actual, EPSILON);
        scores.add(Math.max(0.0, 1 - error));
      }
      if (!scores.isEmpty()) {
        return scores.stream().mapToDouble(Double::doubleValue).average().orElse(NEUTRAL_SCORE);
      }
    }

    List<PredictionHistoryEntry> pool = history;
    if (perProductConsistency && product != null) {
      pool = history.stream()
          .filter(Objects::nonNull)
          .filter(e -> product.equalsIgnoreCase(e.getProduct()))
          .toList();
    }
    double[] preds = tail(pool, CONSISTENCY_WINDOW).stream()
        .filter(Objects::nonNull)
        .map(PredictionHistoryEntry::getMlPrediction)
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .toArray();
    if (preds.length > 1) {
      double consistency = 1 - standardDeviation(preds) / (mean(preds) + EPSILON);
      return clamp01(consistency);
    }
    return NEUTRAL_SCORE;
  }

  public boolean isPerProductConsistency() {
    return perProductConsistency;
  }

  public void setPerProductConsistency(boolean perProductConsistency) {
    this.perProductConsistency = perProductConsistency;
  }

  // |mean| keeps sub-zero storage temperatures from reading as perfectly stable
  private double coefficientOfVariation(double[] values) {
    if (allEqual(values)) {
      return 0.0;
    }
    return standardDeviation(values) / (Math.abs(mean(values)) + EPSILON);
  }

  // two-pass mean/std leaves rounding residue on constant decimal windows
  private static boolean allEqual(double[] values) {
    for (double v : values) {
      if (v != values[0]) {
        return false;
      }
    }
    return true;
  }

  private static <T> List<T> tail(List<T> list, int n) {
    return list.size() <= n ? list : list.subList(list.size() - n, list.size());
  }

  private static double mean(double[] values) {
    double sum = 0.0;
    for (double v : values) {
      sum += v;
    }
    return sum / values.length;
  }

  // population standard deviation
  private static double standardDeviation(double[] values) {
    double mean = mean(values);
    double sq = 0.0;
    for (double v : values) {
      sq += (v - mean) * (v - mean);
    }
    return Math.sqrt(sq / values.length);
  }

  private static double clamp01(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
