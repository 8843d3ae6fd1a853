package dev.irsweep.corpus;

import java.util.List;
import java.util.Set;

/**
 * An evaluation query with its relevance judgments.
 *
 * @param id the query identifier
 * @param tokens raw tokens, duplicates retained
 * @param sections the section of each token, index-aligned with {@code tokens}; empty when the
 *     source had no sections
 * @param relevantDocumentIds ids of the documents judged relevant; may be empty
 */
public record Query(
    String id, List<String> tokens, List<Section> sections, Set<String> relevantDocumentIds) {

  public Query {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Query id must not be blank");
    }
    tokens = List.copyOf(tokens);
    sections = List.copyOf(sections);
    Section.requireAligned(id, tokens, sections);
    relevantDocumentIds = Set.copyOf(relevantDocumentIds);
  }

  /** A query without section information. */
  public Query(String id, List<String> tokens, Set<String> relevantDocumentIds) {
    this(id, tokens, List.of(), relevantDocumentIds);
  }
}
