package dev.irsweep.eval;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

class RetrievalMetricsPropertyTest {

  @Property
  void every_metric_lies_in_unit_interval(
      @ForAll @IntRange(min = 1, max = 60) int collectionSize,
      @ForAll @IntRange(min = 1, max = 60) int relevantCount,
      @ForAll long seed) {
    List<String> ranking = shuffledIds(collectionSize, seed);
    Set<String> relevant = firstIds(Math.min(relevantCount, collectionSize));

    RetrievalMetrics.QueryMetrics m = RetrievalMetrics.computeAll(ranking, relevant);

    assertThat(
            List.of(
                m.precisionAt25(),
                m.precisionAt50(),
                m.precisionAt75(),
                m.precisionAt100(),
                m.meanPrecision1(),
                m.meanPrecision2(),
                m.precisionNormalization(),
                m.recallNormalization()))
        .allSatisfy(v -> assertThat(v).isBetween(0.0, 1.0));
  }

  @Property
  void interpolated_precision_never_increases_with_recall(
      @ForAll @IntRange(min = 1, max = 60) int collectionSize,
      @ForAll @IntRange(min = 1, max = 60) int relevantCount,
      @ForAll long seed) {
    List<String> ranking = shuffledIds(collectionSize, seed);
    Set<String> relevant = firstIds(Math.min(relevantCount, collectionSize));

    RetrievalMetrics.QueryMetrics m = RetrievalMetrics.computeAll(ranking, relevant);

    assertThat(m.precisionAt25()).isGreaterThanOrEqualTo(m.precisionAt50());
    assertThat(m.precisionAt50()).isGreaterThanOrEqualTo(m.precisionAt75());
    assertThat(m.precisionAt75()).isGreaterThanOrEqualTo(m.precisionAt100());
  }

  @Property
  void relevant_first_ranking_is_ideal(
      @ForAll @IntRange(min = 2, max = 60) int collectionSize,
      @ForAll @IntRange(min = 1, max = 60) int relevantCount) {
    int n = Math.min(relevantCount, collectionSize);
    List<String> ranking = new ArrayList<>();
    for (int i = 0; i < collectionSize; i++) {
      ranking.add("d" + i);
    }

    RetrievalMetrics.QueryMetrics m = RetrievalMetrics.computeAll(ranking, firstIds(n));

    assertThat(m.precisionNormalization()).isEqualTo(1.0);
    assertThat(m.recallNormalization()).isEqualTo(1.0);
    assertThat(m.meanPrecision2()).isEqualTo(1.0);
  }

  private static List<String> shuffledIds(int size, long seed) {
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      ids.add("d" + i);
    }
    Collections.shuffle(ids, new Random(seed));
    return ids;
  }

  private static Set<String> firstIds(int count) {
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < count; i++) {
      ids.add("d" + i);
    }
    return ids;
  }
}
