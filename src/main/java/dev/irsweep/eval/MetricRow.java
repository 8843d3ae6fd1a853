package dev.irsweep.eval;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Metrics of one configuration, averaged over every query that had usable judgments.
 *
 * @param precisionAt25 interpolated precision at recall 0.25
 * @param precisionAt50 interpolated precision at recall 0.5
 * @param precisionAt75 interpolated precision at recall 0.75
 * @param precisionAt100 interpolated precision at recall 1.0
 * @param meanPrecision1 mean of the four recall-level precisions
 * @param meanPrecision2 average precision over relevant documents
 * @param precisionNormalization normalised precision
 * @param recallNormalization normalised recall
 * @param evaluatedQueries number of queries averaged
 */
public record MetricRow(
    double precisionAt25,
    double precisionAt50,
    double precisionAt75,
    double precisionAt100,
    double meanPrecision1,
    double meanPrecision2,
    double precisionNormalization,
    double recallNormalization,
    int evaluatedQueries) {

  public MetricRow {
    requireUnit("precisionAt25", precisionAt25);
    requireUnit("precisionAt50", precisionAt50);
    requireUnit("precisionAt75", precisionAt75);
    requireUnit("precisionAt100", precisionAt100);
    requireUnit("meanPrecision1", meanPrecision1);
    requireUnit("meanPrecision2", meanPrecision2);
    requireUnit("precisionNormalization", precisionNormalization);
    requireUnit("recallNormalization", recallNormalization);
    if (evaluatedQueries < 1) {
      throw new IllegalArgumentException("evaluatedQueries must be >= 1");
    }
  }

  /**
   * Averages per-query metrics.
   *
   * @param perQuery metrics of at least one query
   * @return the arithmetic mean of each metric
   */
  public static MetricRow average(List<RetrievalMetrics.QueryMetrics> perQuery) {
    if (perQuery.isEmpty()) {
      throw new IllegalArgumentException("Cannot average metrics of zero queries");
    }
    return new MetricRow(
        avg(perQuery, RetrievalMetrics.QueryMetrics::precisionAt25),
        avg(perQuery, RetrievalMetrics.QueryMetrics::precisionAt50),
        avg(perQuery, RetrievalMetrics.QueryMetrics::precisionAt75),
        avg(perQuery, RetrievalMetrics.QueryMetrics::precisionAt100),
        avg(perQuery, RetrievalMetrics.QueryMetrics::meanPrecision1),
        avg(perQuery, RetrievalMetrics.QueryMetrics::meanPrecision2),
        avg(perQuery, RetrievalMetrics.QueryMetrics::precisionNormalization),
        avg(perQuery, RetrievalMetrics.QueryMetrics::recallNormalization),
        perQuery.size());
  }

  /** The eight metrics in result-table column order. */
  public List<Double> values() {
    return List.of(
        precisionAt25,
        precisionAt50,
        precisionAt75,
        precisionAt100,
        meanPrecision1,
        meanPrecision2,
        precisionNormalization,
        recallNormalization);
  }

  private static double avg(
      List<RetrievalMetrics.QueryMetrics> metrics,
      ToDoubleFunction<RetrievalMetrics.QueryMetrics> fn) {
    double sum = 0.0;
    for (RetrievalMetrics.QueryMetrics m : metrics) {
      sum += fn.applyAsDouble(m);
    }
    // a mean of values in [0, 1] can drift past 1 by an ulp
    return Math.min(1.0, sum / metrics.size());
  }

  private static void requireUnit(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new IllegalArgumentException(name + " must be in [0, 1] but was " + value);
    }
  }
}
