package dev.irsweep.similarity;

import dev.irsweep.weighting.WeightVector;
import java.util.Set;

/**
 * Query-document similarity over sparse weight vectors.
 *
 * <p>Cosine uses the numeric weights. Jaccard, Dice and overlap only look at term supports (terms
 * with a non-zero weight). Every measure returns a value in [0, 1] and returns 0 instead of
 * dividing by zero when a vector is empty.
 */
public final class SimilarityCalculator {

  private SimilarityCalculator() {}

  public static double similarity(WeightVector query, WeightVector doc, SimilarityKind kind) {
    return switch (kind) {
      case COSINE -> cosine(query, doc);
      case JACCARD -> jaccard(query, doc);
      case DICE -> dice(query, doc);
      case OVERLAP -> overlap(query, doc);
    };
  }

  public static double cosine(WeightVector q, WeightVector d) {
    double denominator = q.norm() * d.norm();
    if (denominator == 0.0) {
      return 0.0;
    }
    return clamp(q.dot(d) / denominator);
  }

  public static double jaccard(WeightVector q, WeightVector d) {
    int intersection = intersectionSize(q.support(), d.support());
    int union = q.size() + d.size() - intersection;
    if (union == 0) {
      return 0.0;
    }
    return (double) intersection / union;
  }

  public static double dice(WeightVector q, WeightVector d) {
    int total = q.size() + d.size();
    if (total == 0) {
      return 0.0;
    }
    return 2.0 * intersectionSize(q.support(), d.support()) / total;
  }

  public static double overlap(WeightVector q, WeightVector d) {
    int smaller = Math.min(q.size(), d.size());
    if (smaller == 0) {
      return 0.0;
    }
    return (double) intersectionSize(q.support(), d.support()) / smaller;
  }

  private static int intersectionSize(Set<String> a, Set<String> b) {
    Set<String> small = a.size() <= b.size() ? a : b;
    Set<String> large = small == a ? b : a;
    int count = 0;
    for (String term : small) {
      if (large.contains(term)) {
        count++;
      }
    }
    return count;
  }

  // rounding can push cosine of parallel vectors a hair above 1
  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
