package dev.irsweep.sweep;

import dev.irsweep.preprocess.PreprocessingKey;
import dev.irsweep.similarity.SimilarityKind;
import dev.irsweep.weighting.InvalidProfileException;
import dev.irsweep.weighting.WeightProfile;
import dev.irsweep.weighting.WeightingScheme;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A point of the sweep as configured, before validation. Keeps the raw tags and coefficients so
 * that a point which fails to resolve can still be reported.
 *
 * @param index position in enumeration order
 * @param scheme the weighting scheme tag
 * @param similarity the similarity tag
 * @param removeStopwords whether stopwords are removed
 * @param stem whether tokens are stemmed
 * @param coefficients the raw weight profile; a missing profile becomes an empty list, which fails
 *     to resolve
 */
public record SweepPoint(
    int index,
    String scheme,
    String similarity,
    boolean removeStopwords,
    boolean stem,
    List<Double> coefficients) {

  public SweepPoint {
    // null entries are reported by WeightProfile.of, so List.copyOf cannot be used here
    coefficients =
        coefficients == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(coefficients));
  }

  public PreprocessingKey preprocessingKey() {
    return new PreprocessingKey(removeStopwords, stem);
  }

  /**
   * Validates the point.
   *
   * @return the typed configuration
   * @throws InvalidConfigurationException if a tag is unknown
   * @throws InvalidProfileException if the coefficients are invalid
   */
  public Configuration resolve() {
    WeightingScheme resolvedScheme;
    SimilarityKind resolvedSimilarity;
    try {
      resolvedScheme = WeightingScheme.fromTag(scheme);
      resolvedSimilarity = SimilarityKind.fromTag(similarity);
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigurationException(e.getMessage(), e);
    }
    return new Configuration(
        resolvedScheme, resolvedSimilarity, removeStopwords, stem, WeightProfile.of(coefficients));
  }

  /** Compact form for log messages. */
  public String describe() {
    return "#"
        + index
        + " ["
        + scheme
        + ", "
        + similarity
        + ", removeStopwords="
        + removeStopwords
        + ", stem="
        + stem
        + ", weights="
        + coefficients
        + "]";
  }
}
