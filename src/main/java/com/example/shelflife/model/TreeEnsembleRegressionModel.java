package com.example.shelflife.model;

import com.example.shelflife.exception.InvalidModelSchemaException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decision-tree ensemble exported to JSON (random forest or gradient boosting).
 *
 * <pre>
 * {
 *   "feature_names": ["Temperature_C", "Humidity_%", "Type_Apple", ...],
 *   "base_prediction": 0.0,
 *   "aggregation": "mean",
 *   "trees": [ { "nodes": [ {"feature": 0, "threshold": 7.5, "left": 1, "right": 2},
 *                           {"value": 42.0}, {"value": 18.0} ] } ]
 * }
 * </pre>
 *
 * Split nodes send a sample left when {@code x[feature] <= threshold}. Child indices must
 * point forward in the node list, which rules out cycles.
 */
public final class TreeEnsembleRegressionModel implements ShelfLifeRegressionModel {
  private final List<String> featureNames;
  private final double basePrediction;
  private final boolean summed;
  private final List<Node[]> trees;
  private final String source;

  private TreeEnsembleRegressionModel(List<String> featureNames, double basePrediction, boolean summed,
                                      List<Node[]> trees, String source) {
    this.featureNames = featureNames;
    this.basePrediction = basePrediction;
    this.summed = summed;
    this.trees = trees;
    this.source = source;
  }

  public static TreeEnsembleRegressionModel fromJson(JsonNode root, String source) {
    if (root == null || !root.isObject()) {
      throw new InvalidModelSchemaException("Tree ensemble model " + source + " is not a JSON object");
    }
    List<String> names = new ArrayList<>();
    for (JsonNode name : root.path("feature_names")) {
      String value = name.asText("").trim();
      if (value.isEmpty()) {
        throw new InvalidModelSchemaException("Blank feature name in model " + source);
      }
      names.add(value);
    }
    int width = root.path("n_features").asInt(names.size());
    if (!names.isEmpty() && width != names.size()) {
      throw new InvalidModelSchemaException(String.format(Locale.ROOT,
          "Model %s declares %d features but names %d", source, width, names.size()));
    }

    String aggregation = root.path("aggregation").asText("mean").trim().toLowerCase(Locale.ROOT);
    boolean summed = switch (aggregation) {
      case "sum" -> true;
      case "mean" -> false;
      default -> throw new InvalidModelSchemaException(
          "Unknown aggregation '" + aggregation + "' in model " + source);
    };

    JsonNode treesNode = root.path("trees");
    if (!treesNode.isArray() || treesNode.isEmpty()) {
      throw new InvalidModelSchemaException("Model " + source + " contains no trees");
    }
    List<Node[]> trees = new ArrayList<>();
    int treeIndex = 0;
    for (JsonNode tree : treesNode) {
      trees.add(parseTree(tree.path("nodes"), width, source, treeIndex++));
    }
    return new TreeEnsembleRegressionModel(List.copyOf(names), root.path("base_prediction").asDouble(0.0),
        summed, List.copyOf(trees), source);
  }

  private static Node[] parseTree(JsonNode nodesNode, int width, String source, int treeIndex) {
    if (!nodesNode.isArray() || nodesNode.isEmpty()) {
      throw new InvalidModelSchemaException("Tree " + treeIndex + " of model " + source + " has no nodes");
    }
    int size = nodesNode.size();
    Node[] nodes = new Node[size];
    for (int i = 0; i < size; i++) {
      JsonNode n = nodesNode.get(i);
      if (n.has("value")) {
        nodes[i] = Node.leaf(n.path("value").asDouble());
        continue;
      }
      int feature = n.path("feature").asInt(-1);
      int left = n.path("left").asInt(-1);
      int right = n.path("right").asInt(-1);
      if (feature < 0 || (width > 0 && feature >= width)) {
        throw new InvalidModelSchemaException(String.format(Locale.ROOT,
            "Tree %d node %d of model %s references feature %d", treeIndex, i, source, feature));
      }
      if (left <= i || right <= i || left >= size || right >= size) {
        throw new InvalidModelSchemaException(String.format(Locale.ROOT,
            "Tree %d node %d of model %s has invalid children (%d, %d)", treeIndex, i, source, left, right));
      }
      if (!n.has("threshold")) {
        throw new InvalidModelSchemaException(String.format(Locale.ROOT,
            "Tree %d node %d of model %s has no threshold", treeIndex, i, source));
      }
      nodes[i] = Node.split(feature, n.path("threshold").asDouble(), left, right);
    }
    return nodes;
  }

  @Override
  public List<String> featureNames() {
    return featureNames;
  }

  @Override
  public double predict(double[] features) {
    if (features == null || (!featureNames.isEmpty() && features.length != featureNames.size())) {
      throw new IllegalArgumentException(String.format(Locale.ROOT,
          "Expected %d features, got %s", featureNames.size(), features == null ? "null" : features.length));
    }
    double total = 0.0;
    for (Node[] tree : trees) {
      total += evaluate(tree, features);
    }
    double aggregated = summed ? total : total / trees.size();
    return basePrediction + aggregated;
  }

  private double evaluate(Node[] tree, double[] features) {
    int index = 0;
    Node node = tree[index];
    while (!node.leaf()) {
      if (node.feature() >= features.length) {
        throw new IllegalArgumentException("Feature index " + node.feature() + " outside input of length " + features.length);
      }
      index = features[node.feature()] <= node.threshold() ? node.left() : node.right();
      node = tree[index];
    }
    return node.value();
  }

  public int treeCount() {
    return trees.size();
  }

  @Override
  public String description() {
    return String.format(Locale.ROOT, "tree-ensemble[%s, trees=%d, %s]", source, trees.size(), summed ? "sum" : "mean");
  }

  private record Node(boolean leaf, int feature, double threshold, int left, int right, double value) {
    static Node leaf(double value) {
      return new Node(true, -1, 0.0, -1, -1, value);
    }

    static Node split(int feature, double threshold, int left, int right) {
      return new Node(false, feature, threshold, left, right, 0.0);
    }
  }
}
