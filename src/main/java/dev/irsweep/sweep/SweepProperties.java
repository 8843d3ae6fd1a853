package dev.irsweep.sweep;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Sweep dimensions and execution settings, bound from {@code irsweep.sweep.*}.
 *
 * <ul>
 *   <li>{@code schemes} - weighting scheme tags (boolean, tf, tfidf)
 *   <li>{@code similarities} - similarity tags (cosine, jaccard, dice, overlap)
 *   <li>{@code remove-stopwords} - stopword removal choices
 *   <li>{@code stem} - stemming choices
 *   <li>{@code weight-profiles} - coefficient quadruples
 *   <li>{@code section-weighting} - whether the profile coefficients also weigh term occurrences
 *       by section (author, title, keyword, abstract); default true
 *   <li>{@code threads} - worker pool size (default: available processors, bounded [1, 64])
 *   <li>{@code output} - result table path (default output.tsv)
 * </ul>
 *
 * <p>Tags and coefficients are not checked here. An invalid value fails only the configurations
 * that use it and is reported as a failed row. Stopword and stemming choices must not contain
 * blanks, since a missing choice has no configuration to report it against.
 */
@org.springframework.context.annotation.Configuration
@ConfigurationProperties(prefix = "irsweep.sweep")
public class SweepProperties {

  private List<String> schemes = new ArrayList<>(List.of("tf", "tfidf", "boolean"));
  private List<String> similarities =
      new ArrayList<>(List.of("cosine", "jaccard", "dice", "overlap"));
  private List<Boolean> removeStopwords = new ArrayList<>(List.of(false, true));
  private List<Boolean> stem = new ArrayList<>(List.of(false, true));
  private List<List<Double>> weightProfiles =
      new ArrayList<>(
          List.of(
              List.of(1.0, 1.0, 1.0, 1.0), List.of(1.0, 3.0, 4.0, 1.0), List.of(1.0, 1.0, 1.0, 4.0)));
  private boolean sectionWeighting = true;
  private int threads = Runtime.getRuntime().availableProcessors();
  private String output = "output.tsv";

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    requireNotEmpty("schemes", schemes);
    requireNotEmpty("similarities", similarities);
    requireNotEmpty("remove-stopwords", removeStopwords);
    requireNotEmpty("stem", stem);
    requireNoNulls("remove-stopwords", removeStopwords);
    requireNoNulls("stem", stem);
    requireNotEmpty("weight-profiles", weightProfiles);
    if (threads < 1 || threads > 64) {
      throw new IllegalStateException("irsweep.sweep.threads must be in [1, 64], got: " + threads);
    }
    if (output == null || output.isBlank()) {
      throw new IllegalStateException("irsweep.sweep.output must not be blank");
    }
  }

  private static void requireNotEmpty(String name, List<?> values) {
    if (values == null || values.isEmpty()) {
      throw new IllegalStateException("irsweep.sweep." + name + " must not be empty");
    }
  }

  private static void requireNoNulls(String name, List<Boolean> values) {
    if (values.contains(null)) {
      throw new IllegalStateException(
          "irsweep.sweep." + name + " must contain only true or false, got: " + values);
    }
  }

  public List<String> getSchemes() {
    return schemes;
  }

  public void setSchemes(List<String> schemes) {
    this.schemes = schemes;
  }

  public List<String> getSimilarities() {
    return similarities;
  }

  public void setSimilarities(List<String> similarities) {
    this.similarities = similarities;
  }

  public List<Boolean> getRemoveStopwords() {
    return removeStopwords;
  }

  public void setRemoveStopwords(List<Boolean> removeStopwords) {
    this.removeStopwords = removeStopwords;
  }

  public List<Boolean> getStem() {
    return stem;
  }

  public void setStem(List<Boolean> stem) {
    this.stem = stem;
  }

  public List<List<Double>> getWeightProfiles() {
    return weightProfiles;
  }

  public void setWeightProfiles(List<List<Double>> weightProfiles) {
    this.weightProfiles = weightProfiles;
  }

  public boolean isSectionWeighting() {
    return sectionWeighting;
  }

  public void setSectionWeighting(boolean sectionWeighting) {
    this.sectionWeighting = sectionWeighting;
  }

  public int getThreads() {
    return threads;
  }

  public void setThreads(int threads) {
    this.threads = threads;
  }

  public String getOutput() {
    return output;
  }

  public void setOutput(String output) {
    this.output = output;
  }
}
