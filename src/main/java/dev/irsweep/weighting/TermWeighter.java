package dev.irsweep.weighting;

import dev.irsweep.corpus.Section;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a preprocessed term sequence into a {@link WeightVector}.
 *
 * <p>With {@code L} the sequence length and {@code count(t)} the raw frequency of term {@code t}:
 *
 * <ul>
 *   <li>{@link WeightingScheme#BOOLEAN}: {@code w1} for every distinct term
 *   <li>{@link WeightingScheme#TF}: {@code w1 * count(t)}, divided by {@code w3 * L} when {@code
 *       w3 > 0}
 *   <li>{@link WeightingScheme#TFIDF}: {@code w1 * count(t) * w2 * idf(t)}, divided by {@code w3
 *       * L} when {@code w3 > 0}, then divided by {@code w4 * |v|} when {@code w4 > 0} and the
 *       vector is non-zero
 * </ul>
 *
 * <p>When the terms carry section tags, {@code count(t)} is the sum of {@link
 * WeightProfile#sectionWeight(Section)} over the occurrences of {@code t} instead of the plain
 * frequency; terms whose occurrences all weigh zero are left out. {@code L} stays the number of
 * terms and {@link WeightingScheme#BOOLEAN} ignores the tags.
 *
 * <p>An empty sequence yields an empty vector. All methods are pure.
 */
public final class TermWeighter {

  private TermWeighter() {}

  /**
   * Weighs a term sequence.
   *
   * @param terms preprocessed terms, duplicates retained
   * @param scheme the weighting scheme
   * @param profile the coefficients
   * @param stats statistics of the corpus variant the terms were preprocessed for
   * @return the weight vector
   */
  public static WeightVector weigh(
      List<String> terms, WeightingScheme scheme, WeightProfile profile, CorpusStats stats) {
    return weigh(terms, List.of(), scheme, profile, stats);
  }

  /**
   * Weighs a term sequence whose occurrences count according to their section.
   *
   * @param terms preprocessed terms, duplicates retained
   * @param sections the section of each term, index-aligned with {@code terms}; empty for plain
   *     frequencies
   * @param scheme the weighting scheme
   * @param profile the coefficients
   * @param stats statistics of the corpus variant the terms were preprocessed for
   * @return the weight vector
   */
  public static WeightVector weigh(
      List<String> terms,
      List<Section> sections,
      WeightingScheme scheme,
      WeightProfile profile,
      CorpusStats stats) {
    if (!sections.isEmpty() && sections.size() != terms.size()) {
      throw new IllegalArgumentException(
          terms.size() + " terms but " + sections.size() + " section tags");
    }
    if (terms.isEmpty()) {
      return WeightVector.empty();
    }
    return switch (scheme) {
      case BOOLEAN -> booleanWeights(termCounts(terms).keySet(), profile);
      case TF -> tfWeights(rawCounts(terms, sections, profile), terms.size(), profile);
      case TFIDF ->
          tfidfWeights(rawCounts(terms, sections, profile), terms.size(), profile, stats);
    };
  }

  static Map<String, Integer> termCounts(List<String> terms) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String term : terms) {
      counts.merge(term, 1, Integer::sum);
    }
    return counts;
  }

  private static Map<String, Double> rawCounts(
      List<String> terms, List<Section> sections, WeightProfile profile) {
    Map<String, Double> counts = new LinkedHashMap<>();
    if (sections.isEmpty()) {
      termCounts(terms).forEach((term, count) -> counts.put(term, count.doubleValue()));
      return counts;
    }
    for (int i = 0; i < terms.size(); i++) {
      double weight = profile.sectionWeight(sections.get(i));
      if (weight > 0.0) {
        counts.merge(terms.get(i), weight, Double::sum);
      }
    }
    return counts;
  }

  private static WeightVector booleanWeights(Iterable<String> terms, WeightProfile profile) {
    Map<String, Double> weights = new LinkedHashMap<>();
    for (String term : terms) {
      weights.put(term, profile.w1());
    }
    return WeightVector.of(weights);
  }

  private static WeightVector tfWeights(
      Map<String, Double> counts, int length, WeightProfile profile) {
    double divisor = lengthDivisor(length, profile);
    Map<String, Double> weights = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : counts.entrySet()) {
      weights.put(entry.getKey(), profile.w1() * entry.getValue() / divisor);
    }
    return WeightVector.of(weights);
  }

  private static WeightVector tfidfWeights(
      Map<String, Double> counts, int length, WeightProfile profile, CorpusStats stats) {
    double divisor = lengthDivisor(length, profile);
    Map<String, Double> weights = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : counts.entrySet()) {
      double idf = stats.idf(entry.getKey());
      weights.put(entry.getKey(), profile.w1() * entry.getValue() * (profile.w2() * idf) / divisor);
    }
    WeightVector vector = WeightVector.of(weights);
    if (profile.w4() == 0.0 || vector.norm() == 0.0) {
      return vector;
    }
    double scale = profile.w4() * vector.norm();
    Map<String, Double> normalised = new LinkedHashMap<>();
    vector.asMap().forEach((term, w) -> normalised.put(term, w / scale));
    return WeightVector.of(normalised);
  }

  private static double lengthDivisor(int length, WeightProfile profile) {
    return profile.w3() > 0.0 ? profile.w3() * length : 1.0;
  }
}
