package com.example.shelflife.service;

import com.example.shelflife.domain.KineticProfileTable;
import com.example.shelflife.domain.PredictionHistoryEntry;
import com.example.shelflife.domain.ProductKineticProfile;
import com.example.shelflife.repository.PredictionHistoryRepository;
import com.example.shelflife.util.HistorySummary;
import com.example.shelflife.util.ShelfLifeRequest;
import com.example.shelflife.util.ShelfLifeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Hybrid shelf-life estimate: {@code alpha * kinetic + (1 - alpha) * learned}.
 *
 * <p>Each call loads history, scores confidence, calibrates alpha, runs both models and
 * appends one history entry. Nothing is written unless both models succeed.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShelfLifePredictionService {
  private static final int SUMMARY_WINDOW = 10;

  private final KineticProfileTable profiles;
  private final ArrheniusKineticModel kineticModel;
  private final LearnedShelfLifeRegressor regressor;
  private final ConfidenceAssessmentService confidence;
  private final AlphaCalibrator alphaCalibrator;
  private final PredictionHistoryRepository historyRepository;

  public ShelfLifeResult predict(ShelfLifeRequest request) {
    Objects.requireNonNull(request, "request");
    String product = KineticProfileTable.normalize(request.productType());
    ProductKineticProfile profile = profiles.require(product);

    double temperature = request.temperatureC();
    double humidity = request.humidityPercent();
    int samples = request.readings().size();

    List<PredictionHistoryEntry> history = historyRepository.findAll();
    double stability = confidence.sensorStability(request.readings(), temperature, humidity);
    double performance = confidence.mlPerformance(history, product);
    double alpha = alphaCalibrator.calibrate(stability, performance, request.alphaOverride());

    double mlPrediction = regressor.predictDays(product, temperature, humidity);
    double arrheniusPrediction = kineticModel.predictDays(profile, temperature, humidity);
    double hybrid = alpha * arrheniusPrediction + (1 - alpha) * mlPrediction;

    PredictionHistoryEntry entry = new PredictionHistoryEntry();
    entry.setBatchId(request.batchId());
    entry.setProduct(product);
    entry.setTemperatureC(temperature);
    entry.setHumidityPercent(humidity);
    entry.setMlPrediction(mlPrediction);
    entry.setArrheniusPrediction(arrheniusPrediction);
    entry.setHybridPrediction(hybrid);
    entry.setAlphaUsed(alpha);
    entry.setSensorSamples(samples);
    if (!historyRepository.append(entry)) {
      log.warn("Prediction for batch '{}' returned without being recorded in history", request.batchId());
    }

    log.info("Shelf life for product='{}' batch='{}': ml={} arrhenius={} hybrid={} alpha={} (stability={}, performance={})",
        product, request.batchId(), round(mlPrediction), round(arrheniusPrediction), round(hybrid),
        round(alpha), round(stability), round(performance));
    return new ShelfLifeResult(mlPrediction, arrheniusPrediction, hybrid, alpha, temperature, humidity,
        samples, stability, performance);
  }

  public HistorySummary summariseHistory() {
    List<PredictionHistoryEntry> history = historyRepository.findAll();
    if (history.isEmpty()) {
      return HistorySummary.empty();
    }
    List<PredictionHistoryEntry> recent = history.subList(Math.max(0, history.size() - SUMMARY_WINDOW), history.size());
    double avgAlpha = recent.stream().mapToDouble(PredictionHistoryEntry::getAlphaUsed).average().orElse(0.0);
    double avgMl = recent.stream()
        .mapToDouble(e -> e.getMlPrediction() == null ? 0.0 : e.getMlPrediction())
        .average()
        .orElse(0.0);
    return new HistorySummary(history.size(), avgAlpha, avgMl);
  }

  public boolean recordObservedShelfLife(String batchId, double actualDays) {
    boolean updated = historyRepository.annotateActualShelfLife(batchId, actualDays);
    if (updated) {
      log.info("Recorded observed shelf life {} days for batch '{}'", actualDays, batchId);
    }
    return updated;
  }

  public Set<String> supportedProducts() {
    return profiles.products();
  }

  private double round(double value) {
    return Math.round(value * 1000.0) / 1000.0;
  }
}
