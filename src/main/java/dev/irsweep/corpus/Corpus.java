package dev.irsweep.corpus;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The fixed document collection and query set of an evaluation run.
 *
 * @param documents documents in load order, ids unique
 * @param queries queries in load order
 */
public record Corpus(List<Document> documents, List<Query> queries) {

  public Corpus {
    documents = List.copyOf(documents);
    queries = List.copyOf(queries);
    Set<String> seen = new HashSet<>();
    for (Document document : documents) {
      if (!seen.add(document.id())) {
        throw new IllegalArgumentException("Duplicate document id: " + document.id());
      }
    }
  }
}
