package com.example.shelflife.model;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Regressor exported to ONNX (e.g. via skl2onnx). The feature order is read from the
 * {@code feature_names} custom metadata entry, comma separated.
 */
@Slf4j
public final class OnnxRegressionModel implements ShelfLifeRegressionModel, AutoCloseable {
  static final String FEATURE_NAMES_KEY = "feature_names";

  private final OrtEnvironment env;
  private final OrtSession session;
  private final String inputName;
  private final List<String> featureNames;
  private final String source;

  private OnnxRegressionModel(OrtEnvironment env, OrtSession session, String inputName,
                              List<String> featureNames, String source) {
    this.env = env;
    this.session = session;
    this.inputName = inputName;
    this.featureNames = featureNames;
    this.source = source;
  }

  public static OnnxRegressionModel load(byte[] modelBytes, String source) throws OrtException {
    OrtEnvironment env = OrtEnvironment.getEnvironment();
    OrtSession session;
    try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
      options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
      session = env.createSession(modelBytes, options);
    }

    try {
      Map<String, NodeInfo> inputs = session.getInputInfo();
      if (inputs.isEmpty()) {
        throw new OrtException("ONNX model " + source + " declares no inputs");
      }
      String inputName = inputs.keySet().iterator().next();
      String declared = session.getMetadata().getCustomMetadata().getOrDefault(FEATURE_NAMES_KEY, "");
      List<String> names = parseFeatureNames(declared);
      if (names.isEmpty()) {
        log.warn("ONNX model {} has no '{}' metadata; predictions will be rejected", source, FEATURE_NAMES_KEY);
      }
      log.info("Loaded ONNX shelf-life model from {} (input='{}', features={})", source, inputName, names.size());
      return new OnnxRegressionModel(env, session, inputName, names, source);
    } catch (OrtException | RuntimeException ex) {
      closeAfterFailure(session, ex);
      throw ex;
    }
  }

  private static void closeAfterFailure(OrtSession session, Exception cause) {
    try {
      session.close();
    } catch (OrtException closeEx) {
      cause.addSuppressed(closeEx);
    }
  }

  static List<String> parseFeatureNames(String declared) {
    if (declared == null || declared.isBlank()) {
      return List.of();
    }
    return Arrays.stream(declared.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  @Override
  public List<String> featureNames() {
    return featureNames;
  }

  @Override
  public double predict(double[] features) {
    float[][] input = new float[1][features.length];
    for (int i = 0; i < features.length; i++) {
      input[0][i] = (float) features[i];
    }
    try (OnnxTensor tensor = OnnxTensor.createTensor(env, input);
         OrtSession.Result result = session.run(Map.of(inputName, tensor))) {
      OnnxValue output = result.get(0);
      return firstScalar(output.getValue());
    } catch (OrtException ex) {
      throw new IllegalStateException("ONNX inference failed for model " + source, ex);
    }
  }

  private double firstScalar(Object value) {
    if (value instanceof float[][] matrix && matrix.length > 0 && matrix[0].length > 0) {
      return matrix[0][0];
    }
    if (value instanceof float[] vector && vector.length > 0) {
      return vector[0];
    }
    if (value instanceof double[][] matrix && matrix.length > 0 && matrix[0].length > 0) {
      return matrix[0][0];
    }
    if (value instanceof double[] vector && vector.length > 0) {
      return vector[0];
    }
    throw new IllegalStateException("Unexpected ONNX output type "
        + (value == null ? "null" : value.getClass().getSimpleName()) + " from model " + source);
  }

  @Override
  public String description() {
    return "onnx[" + source + "]";
  }

  @Override
  public void close() throws OrtException {
    session.close();
  }
}
