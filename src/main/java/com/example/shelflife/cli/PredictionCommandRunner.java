package com.example.shelflife.cli;

import com.example.shelflife.domain.EnvironmentalReading;
import com.example.shelflife.exception.ShelfLifeException;
import com.example.shelflife.service.EnvironmentalContextResolver;
import com.example.shelflife.service.ShelfLifePredictionService;
import com.example.shelflife.util.EnvironmentalContext;
import com.example.shelflife.util.HistorySummary;
import com.example.shelflife.util.ShelfLifeRequest;
import com.example.shelflife.util.ShelfLifeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One-shot command line use:
 * <pre>
 * --product=apple --temperature=8 --humidity=85 [--batch=B-1] [--alpha=0.5]
 * --product=apple --readings=8.1:85,7.9:86,8.0:  [--temperature=8] [--humidity=85]
 * --batch=B-1 --actual=41
 * --summary
 * </pre>
 * Readings are {@code temperature:humidity} pairs, newest first; either side may be left empty.
 * Explicit {@code --temperature}/{@code --humidity} override the averaged readings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PredictionCommandRunner implements ApplicationRunner {
  private final ShelfLifePredictionService predictionService;
  private final EnvironmentalContextResolver contextResolver;

  @Override
  public void run(ApplicationArguments args) {
    try {
      if (args.containsOption("actual")) {
        recordActual(args);
      } else if (args.containsOption("product")) {
        predict(args);
      }
      if (args.containsOption("summary")) {
        HistorySummary summary = predictionService.summariseHistory();
        log.info("History: entries={} recentAlpha={} recentMlPrediction={}",
            summary.entries(), summary.recentAlpha(), summary.recentMlPrediction());
      }
    } catch (ShelfLifeException | IllegalArgumentException ex) {
      log.error("Shelf-life command rejected: {}", ex.getMessage());
    }
  }

  private void predict(ApplicationArguments args) {
    String product = required(args, "product");
    Double temperature = args.containsOption("temperature") ? number(args, "temperature") : null;
    Double humidity = args.containsOption("humidity") ? number(args, "humidity") : null;
    Double alpha = args.containsOption("alpha") ? number(args, "alpha") : null;
    String batch = optional(args, "batch");

    EnvironmentalContext context = contextResolver.resolve(
        batch, readings(optional(args, "readings")), temperature, humidity);
    ShelfLifeResult result = predictionService.predict(
        ShelfLifeRequest.fromContext(product, context, alpha, batch));
    log.info(String.format(Locale.ROOT,
        "%s @ %.1fC/%.0f%% (%d samples, stability=%.2f): hybrid=%.2f days (arrhenius=%.2f, ml=%.2f, alpha=%.3f)",
        product, context.temperatureC(), context.humidityPercent(), result.sensorSamples(),
        result.sensorStability(), result.hybridPrediction(), result.arrheniusPrediction(),
        result.mlPrediction(), result.alphaUsed()));
  }

  private List<EnvironmentalReading> readings(String raw) {
    List<EnvironmentalReading> readings = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return readings;
    }
    Instant now = Instant.now();
    for (String pair : raw.split(",")) {
      String trimmed = pair.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int sep = trimmed.indexOf(':');
      if (sep < 0) {
        throw new IllegalArgumentException("--readings expects temperature:humidity pairs, got '" + trimmed + "'");
      }
      readings.add(new EnvironmentalReading(
          channel(trimmed.substring(0, sep)), channel(trimmed.substring(sep + 1)), now));
    }
    return readings;
  }

  private Double channel(String value) {
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("--readings value '" + trimmed + "' is not a number");
    }
  }

  private void recordActual(ApplicationArguments args) {
    String batch = required(args, "batch");
    double actual = number(args, "actual");
    if (!predictionService.recordObservedShelfLife(batch, actual)) {
      log.warn("No prediction waiting for an observed shelf life in batch '{}'", batch);
    }
  }

  private String required(ApplicationArguments args, String name) {
    String value = optional(args, name);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("--" + name + " is required");
    }
    return value;
  }

  private String optional(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  private double number(ApplicationArguments args, String name) {
    String value = required(args, name);
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("--" + name + " must be a number, got '" + value + "'");
    }
  }
}
