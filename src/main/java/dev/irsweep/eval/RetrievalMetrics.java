package dev.irsweep.eval;

import dev.irsweep.corpus.Query;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes recall-level precision and rank-displacement metrics for one ranked query result.
 *
 * <p>All metric methods are pure functions over a complete ranking (every document of the
 * collection, best first) and a set of relevant document ids. The normalised measures follow
 * Salton &amp; McGill and require every relevant id to occur in the ranking; {@link
 * #evaluate(Query, RankedList)} enforces that by dropping judgments for unknown documents.
 */
public final class RetrievalMetrics {

  private static final Logger log = LoggerFactory.getLogger(RetrievalMetrics.class);

  /** Recall levels reported as precision@r. */
  public static final List<Double> RECALL_LEVELS = List.of(0.25, 0.5, 0.75, 1.0);

  private static final double EPSILON = 1e-12;

  private RetrievalMetrics() {}

  /** The eight per-query metrics. */
  public record QueryMetrics(
      double precisionAt25,
      double precisionAt50,
      double precisionAt75,
      double precisionAt100,
      double meanPrecision1,
      double meanPrecision2,
      double precisionNormalization,
      double recallNormalization) {}

  /**
   * Evaluates one query's ranking. Judgments naming documents that are not in the ranking are
   * ignored.
   *
   * @param query the query with its relevance judgments
   * @param ranking the complete ranking for the query
   * @return the metrics, or empty if the query has no usable judgment
   */
  public static Optional<QueryMetrics> evaluate(Query query, RankedList ranking) {
    List<String> rankedIds = ranking.documentIds();
    Set<String> ranked = new HashSet<>(rankedIds);
    Set<String> relevant = new HashSet<>();
    for (String id : query.relevantDocumentIds()) {
      if (ranked.contains(id)) {
        relevant.add(id);
      }
    }
    if (relevant.size() < query.relevantDocumentIds().size()) {
      log.debug(
          "Query {}: ignoring {} judgments for unknown documents",
          query.id(),
          query.relevantDocumentIds().size() - relevant.size());
    }
    if (relevant.isEmpty()) {
      log.debug("Query {} has no usable judgments, excluded from aggregation", query.id());
      return Optional.empty();
    }
    return Optional.of(computeAll(rankedIds, relevant));
  }

  /**
   * Interpolated precision at a recall level: the highest precision at any rank whose recall is at
   * least {@code recallLevel}. Returns 0 when that recall is never reached or nothing is relevant.
   */
  public static double precisionAtRecall(
      List<String> rankedIds, Set<String> relevantIds, double recallLevel) {
    return precisionAtRecall(relevantRanks(rankedIds, relevantIds), relevantIds.size(), recallLevel);
  }

  /** Arithmetic mean of the interpolated precisions at {@link #RECALL_LEVELS}. */
  public static double meanInterpolatedPrecision(List<String> rankedIds, Set<String> relevantIds) {
    return meanInterpolatedPrecision(relevantRanks(rankedIds, relevantIds), relevantIds.size());
  }

  /** Average precision: mean precision at the rank of each relevant document. */
  public static double averagePrecision(List<String> rankedIds, Set<String> relevantIds) {
    return averagePrecision(relevantRanks(rankedIds, relevantIds), relevantIds.size());
  }

  /**
   * Normalised recall: {@code 1 - (Σ rank_i - Σ i) / (n (N - n))}. 1 for the ideal ranking, 0
   * when all relevant documents come last.
   */
  public static double normalizedRecall(List<String> rankedIds, Set<String> relevantIds) {
    List<Integer> ranks = completeRanks(rankedIds, relevantIds);
    return normalizedRecall(ranks, rankedIds.size());
  }

  /**
   * Normalised precision: {@code 1 - (Σ ln rank_i - Σ ln i) / ln(N! / ((N - n)! n!))}. 1 for the
   * ideal ranking, 0 when all relevant documents come last.
   */
  public static double normalizedPrecision(List<String> rankedIds, Set<String> relevantIds) {
    List<Integer> ranks = completeRanks(rankedIds, relevantIds);
    return normalizedPrecision(ranks, rankedIds.size());
  }

  /** Computes all eight metrics, walking the ranking once. */
  public static QueryMetrics computeAll(List<String> rankedIds, Set<String> relevantIds) {
    List<Integer> ranks = completeRanks(rankedIds, relevantIds);
    int n = relevantIds.size();
    int total = rankedIds.size();
    return new QueryMetrics(
        precisionAtRecall(ranks, n, RECALL_LEVELS.get(0)),
        precisionAtRecall(ranks, n, RECALL_LEVELS.get(1)),
        precisionAtRecall(ranks, n, RECALL_LEVELS.get(2)),
        precisionAtRecall(ranks, n, RECALL_LEVELS.get(3)),
        meanInterpolatedPrecision(ranks, n),
        averagePrecision(ranks, n),
        normalizedPrecision(ranks, total),
        normalizedRecall(ranks, total));
  }

  // --- Internal helpers, all over the ascending 1-based ranks of the relevant documents ---

  private static double precisionAtRecall(List<Integer> ranks, int relevantCount, double level) {
    if (relevantCount == 0) {
      return 0.0;
    }
    double best = 0.0;
    for (int found = 1; found <= ranks.size(); found++) {
      double recall = (double) found / relevantCount;
      if (recall + EPSILON >= level) {
        best = Math.max(best, (double) found / ranks.get(found - 1));
      }
    }
    return clamp(best);
  }

  private static double meanInterpolatedPrecision(List<Integer> ranks, int relevantCount) {
    double sum = 0.0;
    for (double level : RECALL_LEVELS) {
      sum += precisionAtRecall(ranks, relevantCount, level);
    }
    return clamp(sum / RECALL_LEVELS.size());
  }

  private static double averagePrecision(List<Integer> ranks, int relevantCount) {
    if (relevantCount == 0) {
      return 0.0;
    }
    double sum = 0.0;
    for (int found = 1; found <= ranks.size(); found++) {
      sum += (double) found / ranks.get(found - 1);
    }
    return clamp(sum / relevantCount);
  }

  private static double normalizedRecall(List<Integer> ranks, int total) {
    int n = ranks.size();
    if (n == 0) {
      return 0.0;
    }
    if (n == total) {
      return 1.0;
    }
    double rankSum = 0.0;
    for (int rank : ranks) {
      rankSum += rank;
    }
    double idealSum = n * (n + 1) / 2.0;
    return clamp(1.0 - (rankSum - idealSum) / ((double) n * (total - n)));
  }

  private static double normalizedPrecision(List<Integer> ranks, int total) {
    int n = ranks.size();
    if (n == 0) {
      return 0.0;
    }
    if (n == total) {
      return 1.0;
    }
    double logRankSum = 0.0;
    double logIdealSum = 0.0;
    double logBinomial = 0.0;
    for (int i = 1; i <= n; i++) {
      logRankSum += Math.log(ranks.get(i - 1));
      logIdealSum += Math.log(i);
      logBinomial += Math.log((double) (total - n + i) / i);
    }
    return clamp(1.0 - (logRankSum - logIdealSum) / logBinomial);
  }

  /** Ascending ranks of the relevant documents that occur in the ranking. */
  private static List<Integer> relevantRanks(List<String> rankedIds, Set<String> relevantIds) {
    List<Integer> ranks = new ArrayList<>();
    for (int i = 0; i < rankedIds.size(); i++) {
      if (relevantIds.contains(rankedIds.get(i))) {
        ranks.add(i + 1);
      }
    }
    return ranks;
  }

  private static List<Integer> completeRanks(List<String> rankedIds, Set<String> relevantIds) {
    List<Integer> ranks = relevantRanks(rankedIds, relevantIds);
    if (ranks.size() != relevantIds.size()) {
      throw new IllegalArgumentException(
          "Ranking misses "
              + (relevantIds.size() - ranks.size())
              + " of "
              + relevantIds.size()
              + " relevant documents");
    }
    return ranks;
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
