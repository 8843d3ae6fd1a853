package dev.irsweep.weighting;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collection statistics for one preprocessing variant of the corpus: corpus size and document
 * frequency per term. Only documents contribute; queries never do.
 *
 * @param documentCount number of documents N
 * @param documentFrequencies number of documents containing each term
 */
public record CorpusStats(int documentCount, Map<String, Integer> documentFrequencies) {

  public CorpusStats {
    if (documentCount < 0) {
      throw new IllegalArgumentException("documentCount must be >= 0 but was " + documentCount);
    }
    documentFrequencies = Map.copyOf(documentFrequencies);
  }

  /**
   * Counts document frequencies over already preprocessed documents.
   *
   * @param documents the term sequence of every document
   * @return the statistics
   */
  public static CorpusStats from(Collection<List<String>> documents) {
    Map<String, Integer> df = new HashMap<>();
    for (List<String> terms : documents) {
      Set<String> distinct = new HashSet<>(terms);
      for (String term : distinct) {
        df.merge(term, 1, Integer::sum);
      }
    }
    return new CorpusStats(documents.size(), df);
  }

  public int documentFrequency(String term) {
    return documentFrequencies.getOrDefault(term, 0);
  }

  /** {@code ln(N / df(t))}, or 0 for a term no document contains. */
  public double idf(String term) {
    int df = documentFrequency(term);
    if (df == 0 || documentCount == 0) {
      return 0.0;
    }
    return Math.log((double) documentCount / df);
  }
}
