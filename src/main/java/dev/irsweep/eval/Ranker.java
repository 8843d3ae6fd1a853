package dev.irsweep.eval;

import dev.irsweep.corpus.Document;
import dev.irsweep.similarity.SimilarityCalculator;
import dev.irsweep.similarity.SimilarityKind;
import dev.irsweep.weighting.WeightVector;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Scores every document against a query and sorts them into a {@link RankedList}. */
public final class Ranker {

  static final Comparator<RankedList.ScoredDocument> RANK_ORDER =
      Comparator.comparingDouble(RankedList.ScoredDocument::score)
          .reversed()
          .thenComparing(RankedList.ScoredDocument::documentId, Document.ID_ORDER);

  private Ranker() {}

  /**
   * Ranks all documents for one query.
   *
   * @param query the query vector
   * @param documentIds document ids, index-aligned with {@code documentVectors}
   * @param documentVectors the document vectors
   * @param kind the similarity measure
   * @return every document, best first
   */
  public static RankedList rank(
      WeightVector query,
      List<String> documentIds,
      List<WeightVector> documentVectors,
      SimilarityKind kind) {
    if (documentIds.size() != documentVectors.size()) {
      throw new IllegalArgumentException(
          "Got " + documentIds.size() + " ids for " + documentVectors.size() + " vectors");
    }
    List<RankedList.ScoredDocument> scored = new ArrayList<>(documentIds.size());
    for (int i = 0; i < documentIds.size(); i++) {
      double score = SimilarityCalculator.similarity(query, documentVectors.get(i), kind);
      scored.add(new RankedList.ScoredDocument(documentIds.get(i), score));
    }
    scored.sort(RANK_ORDER);
    return new RankedList(scored);
  }
}
