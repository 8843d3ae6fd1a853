package dev.irsweep.preprocess;

import dev.irsweep.corpus.Corpus;
import dev.irsweep.corpus.Document;
import dev.irsweep.corpus.Query;
import dev.irsweep.corpus.Section;
import dev.irsweep.weighting.CorpusStats;
import java.util.ArrayList;
import java.util.List;

/**
 * The corpus after preprocessing under one {@link PreprocessingKey}, with the statistics derived
 * from that variant. Term lists are index-aligned with {@link Corpus#documents()} and {@link
 * Corpus#queries()}.
 *
 * @param key the switches this variant was built with
 * @param documentTerms preprocessed terms per document, in corpus order
 * @param queryTerms preprocessed terms per query, in corpus order
 * @param documentSections section tags per document, aligned with {@code documentTerms}; an
 *     inner list is empty when the document had no sections
 * @param querySections section tags per query, aligned with {@code queryTerms}
 * @param stats document frequencies and corpus size of this variant
 */
public record PreprocessedCorpus(
    PreprocessingKey key,
    List<List<String>> documentTerms,
    List<List<String>> queryTerms,
    List<List<Section>> documentSections,
    List<List<Section>> querySections,
    CorpusStats stats) {

  public PreprocessedCorpus {
    documentTerms = List.copyOf(documentTerms);
    queryTerms = List.copyOf(queryTerms);
    documentSections = List.copyOf(documentSections);
    querySections = List.copyOf(querySections);
    if (documentSections.size() != documentTerms.size()
        || querySections.size() != queryTerms.size()) {
      throw new IllegalArgumentException("Section tags must be given for every document and query");
    }
  }

  /** Preprocesses every document and query of {@code corpus}. */
  public static PreprocessedCorpus build(
      Corpus corpus, PreprocessingKey key, Preprocessor preprocessor) {
    List<List<String>> documents = new ArrayList<>(corpus.documents().size());
    List<List<Section>> documentSections = new ArrayList<>(corpus.documents().size());
    for (Document document : corpus.documents()) {
      documents.add(preprocessor.preprocess(document.tokens(), key));
      documentSections.add(
          List.copyOf(preprocessor.keptSections(document.tokens(), document.sections(), key)));
    }
    List<List<String>> queries = new ArrayList<>(corpus.queries().size());
    List<List<Section>> querySections = new ArrayList<>(corpus.queries().size());
    for (Query query : corpus.queries()) {
      queries.add(preprocessor.preprocess(query.tokens(), key));
      querySections.add(
          List.copyOf(preprocessor.keptSections(query.tokens(), query.sections(), key)));
    }
    return new PreprocessedCorpus(
        key, documents, queries, documentSections, querySections, CorpusStats.from(documents));
  }
}
