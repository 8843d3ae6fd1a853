package dev.irsweep.eval;

import java.util.List;

/**
 * Documents ordered by descending similarity to one query, ties broken by ascending document id.
 *
 * @param entries the scored documents in rank order
 */
public record RankedList(List<ScoredDocument> entries) {

  public RankedList {
    entries = List.copyOf(entries);
  }

  /**
   * One ranked document.
   *
   * @param documentId the document identifier
   * @param score the query-document similarity
   */
  public record ScoredDocument(String documentId, double score) {}

  /** Document ids in rank order. */
  public List<String> documentIds() {
    return entries.stream().map(ScoredDocument::documentId).toList();
  }

  public int size() {
    return entries.size();
  }
}
