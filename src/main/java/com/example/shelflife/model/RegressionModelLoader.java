package com.example.shelflife.model;

import ai.onnxruntime.OrtException;
import com.example.shelflife.exception.InvalidModelSchemaException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Loads a {@link ShelfLifeRegressionModel} by file extension: {@code .json} tree ensembles
 * or {@code .onnx} graphs. Locations prefixed with {@code classpath:} are read from the
 * application resources, anything else from the file system.
 */
@Slf4j
@RequiredArgsConstructor
public class RegressionModelLoader {
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final ObjectMapper objectMapper;
  private final ResourceLoader resourceLoader;

  public ShelfLifeRegressionModel load(String location) {
    if (location == null || location.isBlank()) {
      throw new IllegalStateException("Shelf-life model location is not configured");
    }
    String trimmed = location.trim();
    Resource resource = trimmed.startsWith(CLASSPATH_PREFIX)
        ? resourceLoader.getResource(trimmed)
        : new FileSystemResource(trimmed);
    if (!resource.exists()) {
      throw new IllegalStateException("Shelf life model missing at " + trimmed);
    }

    String name = trimmed.toLowerCase(Locale.ROOT);
    log.info("Loading shelf-life model from {}", trimmed);
    try (InputStream in = resource.getInputStream()) {
      if (name.endsWith(".json")) {
        JsonNode root = objectMapper.readTree(in);
        TreeEnsembleRegressionModel model = TreeEnsembleRegressionModel.fromJson(root, trimmed);
        log.info("Loaded {} with {} features", model.description(), model.featureNames().size());
        return model;
      }
      if (name.endsWith(".onnx")) {
        return OnnxRegressionModel.load(in.readAllBytes(), trimmed);
      }
    } catch (IOException ex) {
      throw new InvalidModelSchemaException("Unable to read shelf-life model " + trimmed, ex);
    } catch (OrtException ex) {
      throw new InvalidModelSchemaException("Unable to open ONNX shelf-life model " + trimmed, ex);
    }
    throw new IllegalStateException("Unsupported shelf-life model format: " + trimmed);
  }
}
