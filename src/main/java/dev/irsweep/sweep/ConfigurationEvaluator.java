package dev.irsweep.sweep;

import dev.irsweep.corpus.Corpus;
import dev.irsweep.corpus.Document;
import dev.irsweep.corpus.Query;
import dev.irsweep.corpus.Section;
import dev.irsweep.eval.MetricRow;
import dev.irsweep.eval.RankedList;
import dev.irsweep.eval.Ranker;
import dev.irsweep.eval.RetrievalMetrics;
import dev.irsweep.preprocess.PreprocessedCorpus;
import dev.irsweep.weighting.TermWeighter;
import dev.irsweep.weighting.WeightVector;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the weighting, ranking and metric pipeline of one {@link Configuration} over every query.
 * Vectors and rankings live only for the duration of the call. With section weighting on, term
 * occurrences count according to the section they came from, so the weight profile shifts
 * emphasis between author, title, keyword and abstract text.
 */
final class ConfigurationEvaluator {

  private ConfigurationEvaluator() {}

  /** Evaluates a configuration with section weighting on. */
  static Optional<MetricRow> evaluate(
      Configuration configuration, Corpus corpus, PreprocessedCorpus variant) {
    return evaluate(configuration, corpus, variant, true);
  }

  /**
   * Evaluates a configuration.
   *
   * @param configuration the resolved configuration
   * @param corpus the raw corpus, for ids and judgments
   * @param variant the corpus preprocessed with the configuration's switches
   * @param sectionWeighting whether occurrences are weighted by section
   * @return the averaged metrics, or empty if no query had usable judgments
   */
  static Optional<MetricRow> evaluate(
      Configuration configuration,
      Corpus corpus,
      PreprocessedCorpus variant,
      boolean sectionWeighting) {
    if (!variant.key().equals(configuration.preprocessingKey())) {
      throw new IllegalArgumentException(
          "Corpus variant " + variant.key() + " does not match " + configuration);
    }
    List<String> documentIds = corpus.documents().stream().map(Document::id).toList();
    List<WeightVector> documentVectors = new ArrayList<>(documentIds.size());
    for (int d = 0; d < documentIds.size(); d++) {
      documentVectors.add(
          weigh(
              variant.documentTerms().get(d),
              sectionWeighting ? variant.documentSections().get(d) : List.of(),
              configuration,
              variant));
    }

    List<RetrievalMetrics.QueryMetrics> perQuery = new ArrayList<>();
    List<Query> queries = corpus.queries();
    for (int i = 0; i < queries.size(); i++) {
      Query query = queries.get(i);
      if (query.relevantDocumentIds().isEmpty()) {
        continue;
      }
      WeightVector queryVector =
          weigh(
              variant.queryTerms().get(i),
              sectionWeighting ? variant.querySections().get(i) : List.of(),
              configuration,
              variant);
      RankedList ranking =
          Ranker.rank(queryVector, documentIds, documentVectors, configuration.similarity());
      RetrievalMetrics.evaluate(query, ranking).ifPresent(perQuery::add);
    }
    if (perQuery.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(MetricRow.average(perQuery));
  }

  private static WeightVector weigh(
      List<String> terms,
      List<Section> sections,
      Configuration configuration,
      PreprocessedCorpus variant) {
    return TermWeighter.weigh(
        terms, sections, configuration.scheme(), configuration.profile(), variant.stats());
  }
}
