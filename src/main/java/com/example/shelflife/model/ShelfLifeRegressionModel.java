package com.example.shelflife.model;

import java.util.List;

/**
 * A pre-trained regressor that predicts shelf life in days.
 *
 * <p>Implementations expose the ordered feature schema they were trained with, so callers
 * can build the input vector from the model itself instead of hard-coding a layout that a
 * retrained model would silently break.</p>
 */
public interface ShelfLifeRegressionModel {

  /**
   * Feature names in the exact order {@link #predict(double[])} expects them. An empty list
   * means the model carries no schema and must not be used.
   */
  List<String> featureNames();

  /**
   * @param features one value per entry of {@link #featureNames()}, same order
   * @return predicted shelf life in days
   */
  double predict(double[] features);

  /**
   * Short human-readable origin of the model, used in logs.
   */
  String description();
}
