package dev.irsweep.corpus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Loads documents, queries and relevance judgments from the configured locations. */
@Service
public class CorpusLoader {

  private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

  private final CorpusProperties properties;

  public CorpusLoader(CorpusProperties properties) {
    this.properties = properties;
  }

  /**
   * Reads the whole corpus.
   *
   * @return the documents and judged queries
   * @throws IOException if a file cannot be read
   * @throws CorpusFormatException if a file is malformed
   */
  public Corpus load() throws IOException {
    List<Document> documents = CacmReader.readDocuments(Path.of(properties.getDocuments()));
    List<RelevanceJudgment> judgments =
        RelevanceReader.read(Path.of(properties.getRelevance()));
    Map<String, Set<String>> relevance = RelevanceReader.byQuery(judgments);
    List<Query> queries = CacmReader.readQueries(Path.of(properties.getQueries()), relevance);

    long judged = queries.stream().filter(q -> !q.relevantDocumentIds().isEmpty()).count();
    log.info(
        "Loaded {} documents, {} queries ({} with judgments), {} relevance judgments",
        documents.size(),
        queries.size(),
        judged,
        judgments.size());
    return new Corpus(documents, queries);
  }
}
