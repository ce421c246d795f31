package com.example.shelflife.service;

import com.example.shelflife.domain.EnvironmentalReading;
import com.example.shelflife.domain.PredictionHistoryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceAssessmentServiceTest {

  private ConfidenceAssessmentService service;

  @BeforeEach
  void setUp() {
    service = new ConfidenceAssessmentService();
  }

  private static List<EnvironmentalReading> alternating(double temp, double humidity, double noise, int count) {
    List<EnvironmentalReading> readings = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      double sign = i % 2 == 0 ? 1 : -1;
      readings.add(new EnvironmentalReading(temp + sign * noise, humidity + sign * noise, Instant.now()));
    }
    return readings;
  }

  private static PredictionHistoryEntry entry(String product, double ml, Double hybrid, Double actual) {
    PredictionHistoryEntry e = new PredictionHistoryEntry();
    e.setProduct(product);
    e.setMlPrediction(ml);
    e.setHybridPrediction(hybrid);
    e.setActualShelfLifeDays(actual);
    return e;
  }

  @Nested
  @DisplayName("Sensor stability")
  class SensorStability {

    @Test
    void noReadingsIsNeutral() {
      assertThat(service.sensorStability(List.of(), 5, 90)).isEqualTo(0.5);
      assertThat(service.sensorStability(null, 5, 90)).isEqualTo(0.5);
    }

    @Test
    void singleReadingIsModerate() {
      assertThat(service.sensorStability(List.of(EnvironmentalReading.of(5, 90)), 5, 90)).isEqualTo(0.6);
    }

    @Test
    void identicalReadingsArePerfectlyStable() {
      assertThat(service.sensorStability(alternating(7, 88, 0, 12), 7, 88)).isEqualTo(1.0);
    }

    @ParameterizedTest(name = "{2} x ({0} C, {1} %)")
    @CsvSource({
        "4.3, 87.3, 7",
        "0.1, 91.7, 3",
        "2.2, 93.1, 10",
        "-1.7, 95.3, 7",
        "12.9, 60.1, 3"
    })
    void identicalDecimalReadingsArePerfectlyStable(double temp, double humidity, int count) {
      assertThat(service.sensorStability(alternating(temp, humidity, 0, count), temp, humidity)).isEqualTo(1.0);
    }

    @Test
    void scoreFallsAsNoiseGrows() {
      double previous = service.sensorStability(alternating(5, 90, 0, 10), 5, 90);
      for (double noise : new double[]{0.05, 0.1, 0.2, 0.3, 0.45}) {
        double current = service.sensorStability(alternating(5, 90, noise, 10), 5, 90);
        assertThat(current).isLessThan(previous).isBetween(0.0, 1.0);
        previous = current;
      }
    }

    @Test
    void temperatureSwingsWeighMoreThanHumiditySwings() {
      List<EnvironmentalReading> tempNoise = List.of(
          new EnvironmentalReading(9.0, 90.0, Instant.now()),
          new EnvironmentalReading(11.0, 90.0, Instant.now()));
      List<EnvironmentalReading> humNoise = List.of(
          new EnvironmentalReading(10.0, 81.0, Instant.now()),
          new EnvironmentalReading(10.0, 99.0, Instant.now()));

      // both channels vary by 10% of their mean
      double tempScore = service.sensorStability(tempNoise, 10, 90);
      double humScore = service.sensorStability(humNoise, 10, 90);

      assertThat(tempScore).isCloseTo(0.5, within(1e-4));
      assertThat(humScore).isCloseTo(0.75, within(1e-4));
    }

    @Test
    void missingChannelsUseFallbackValues() {
      List<EnvironmentalReading> readings = List.of(
          new EnvironmentalReading(null, 90.0, Instant.now()),
          new EnvironmentalReading(5.0, null, Instant.now()));

      assertThat(service.sensorStability(readings, 5, 90)).isEqualTo(1.0);
    }

    @Test
    void subZeroWindowsAreNotTreatedAsStable() {
      double score = service.sensorStability(alternating(-2, 90, 1.0, 10), -2, 90);

      assertThat(score).isLessThan(0.6);
    }
  }

  @Nested
  @DisplayName("ML performance")
  class MlPerformance {

    @Test
    void noHistoryIsNeutral() {
      assertThat(service.mlPerformance(List.of(), "apple")).isEqualTo(0.5);
      assertThat(service.mlPerformance(null, "apple")).isEqualTo(0.5);
    }

    @Test
    void validatedOutcomesDriveAccuracy() {
      List<PredictionHistoryEntry> history = List.of(
          entry("apple", 10, 40.0, 50.0),
          entry("apple", 90, 50.0, 50.0),
          entry("banana", 3, 12.0, null));

      assertThat(service.mlPerformance(history, "apple")).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void accuracyIsFlooredAtZeroPerEntry() {
      List<PredictionHistoryEntry> history = List.of(
          entry("apple", 10, 300.0, 50.0),
          entry("apple", 10, 50.0, 50.0));

      assertThat(service.mlPerformance(history, "apple")).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void onlyTheLastTwentyValidatedEntriesCount() {
      List<PredictionHistoryEntry> history = new ArrayList<>();
      for (int i = 0; i < 5; i++) {
        history.add(entry("apple", 1, 500.0, 10.0));
      }
      for (int i = 0; i < 20; i++) {
        history.add(entry("apple", 1, 10.0, 10.0));
      }

      assertThat(service.mlPerformance(history, "apple")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void selfConsistencyFallbackWithoutValidatedOutcomes() {
      List<PredictionHistoryEntry> steady = List.of(entry("apple", 20, 20.0, null), entry("apple", 20, 20.0, null));
      List<PredictionHistoryEntry> spread = List.of(entry("apple", 10, 10.0, null), entry("apple", 30, 30.0, null));

      assertThat(service.mlPerformance(steady, "apple")).isCloseTo(1.0, within(1e-6));
      assertThat(service.mlPerformance(spread, "apple")).isCloseTo(0.5, within(1e-6));
    }

    @Test
    void singleUnvalidatedPredictionIsNeutral() {
      assertThat(service.mlPerformance(List.of(entry("apple", 20, 20.0, null)), "apple")).isEqualTo(0.5);
    }

    @Test
    void fallbackIsScopedToTheRequestedProductByDefault() {
      List<PredictionHistoryEntry> history = List.of(
          entry("apple", 20, 20.0, null),
          entry("banana", 5, 5.0, null),
          entry("apple", 20, 20.0, null));

      assertThat(service.mlPerformance(history, "apple")).isCloseTo(1.0, within(1e-6));
      assertThat(service.mlPerformance(history, "mango")).isEqualTo(0.5);

      service.setPerProductConsistency(false);
      double mixed = service.mlPerformance(history, "apple");
      assertThat(mixed).isCloseTo(1 - Math.sqrt(50) / 15, within(1e-6));
    }

    @Test
    void fallbackLooksAtTheTenMostRecentPredictions() {
      List<PredictionHistoryEntry> history = new ArrayList<>();
      history.add(entry("apple", 100, 100.0, null));
      for (int i = 0; i < 10; i++) {
        history.add(entry("apple", 25, 25.0, null));
      }

      assertThat(service.mlPerformance(history, "apple")).isCloseTo(1.0, within(1e-6));
    }
  }
}
