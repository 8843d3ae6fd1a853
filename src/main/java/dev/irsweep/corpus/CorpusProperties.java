package dev.irsweep.corpus;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Locations of the evaluation inputs, bound from {@code irsweep.corpus.*}.
 *
 * <ul>
 *   <li>{@code documents} - CACM-style document collection
 *   <li>{@code queries} - CACM-style query file
 *   <li>{@code relevance} - relevance judgments, one {@code <queryId> <documentId>} per line
 *   <li>{@code stopwords} - stopword list; {@code classpath:} prefix or file path
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "irsweep.corpus")
public class CorpusProperties {

  private String documents = "data/cacm.raw";
  private String queries = "data/query.raw";
  private String relevance = "data/query.rels";
  private String stopwords = "classpath:stopwords/common_words.txt";

  @PostConstruct
  void validate() {
    requireNotBlank("documents", documents);
    requireNotBlank("queries", queries);
    requireNotBlank("relevance", relevance);
    requireNotBlank("stopwords", stopwords);
  }

  private static void requireNotBlank(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("irsweep.corpus." + name + " must not be blank");
    }
  }

  public String getDocuments() {
    return documents;
  }

  public void setDocuments(String documents) {
    this.documents = documents;
  }

  public String getQueries() {
    return queries;
  }

  public void setQueries(String queries) {
    this.queries = queries;
  }

  public String getRelevance() {
    return relevance;
  }

  public void setRelevance(String relevance) {
    this.relevance = relevance;
  }

  public String getStopwords() {
    return stopwords;
  }

  public void setStopwords(String stopwords) {
    this.stopwords = stopwords;
  }
}
