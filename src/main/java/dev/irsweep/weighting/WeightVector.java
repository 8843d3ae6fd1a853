package dev.irsweep.weighting;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable sparse term vector. Only strictly positive weights are stored, so the key set is the
 * term support. Terms iterate in natural order, which keeps floating-point sums identical between
 * runs.
 */
public final class WeightVector {

  private static final WeightVector EMPTY = new WeightVector(new TreeMap<>());

  private final SortedMap<String, Double> weights;
  private final double norm;

  private WeightVector(TreeMap<String, Double> weights) {
    this.weights = Collections.unmodifiableSortedMap(weights);
    double sumOfSquares = 0.0;
    for (double w : weights.values()) {
      sumOfSquares += w * w;
    }
    this.norm = Math.sqrt(sumOfSquares);
  }

  /**
   * Creates a vector from raw weights, dropping zero entries.
   *
   * @param weights term weights, all expected >= 0
   * @return the vector
   * @throws IllegalArgumentException if a weight is negative or not finite
   */
  public static WeightVector of(Map<String, Double> weights) {
    TreeMap<String, Double> copy = new TreeMap<>();
    for (Map.Entry<String, Double> entry : weights.entrySet()) {
      double w = entry.getValue();
      if (!Double.isFinite(w) || w < 0.0) {
        throw new IllegalArgumentException(
            "Weight for term '" + entry.getKey() + "' must be finite and >= 0 but was " + w);
      }
      if (w > 0.0) {
        copy.put(entry.getKey(), w);
      }
    }
    return copy.isEmpty() ? EMPTY : new WeightVector(copy);
  }

  public static WeightVector empty() {
    return EMPTY;
  }

  /** Weight of {@code term}, 0 when absent. */
  public double weight(String term) {
    return weights.getOrDefault(term, 0.0);
  }

  /** Terms with a non-zero weight. */
  public Set<String> support() {
    return weights.keySet();
  }

  public Map<String, Double> asMap() {
    return weights;
  }

  public int size() {
    return weights.size();
  }

  public boolean isEmpty() {
    return weights.isEmpty();
  }

  /** Euclidean length. */
  public double norm() {
    return norm;
  }

  /** Dot product, iterating over the smaller vector. */
  public double dot(WeightVector other) {
    WeightVector small = size() <= other.size() ? this : other;
    WeightVector large = small == this ? other : this;
    double sum = 0.0;
    for (Map.Entry<String, Double> entry : small.weights.entrySet()) {
      sum += entry.getValue() * large.weight(entry.getKey());
    }
    return sum;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof WeightVector other && weights.equals(other.weights);
  }

  @Override
  public int hashCode() {
    return weights.hashCode();
  }

  @Override
  public String toString() {
    return "WeightVector" + weights;
  }
}
