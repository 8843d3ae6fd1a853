package dev.irsweep.sweep;

import dev.irsweep.preprocess.PreprocessingKey;
import dev.irsweep.similarity.SimilarityKind;
import dev.irsweep.weighting.WeightProfile;
import dev.irsweep.weighting.WeightingScheme;

/**
 * One fully resolved point of the sweep.
 *
 * @param scheme the term-weighting scheme
 * @param similarity the similarity measure
 * @param removeStopwords whether stopwords are removed
 * @param stem whether tokens are stemmed
 * @param profile the weighting coefficients
 */
public record Configuration(
    WeightingScheme scheme,
    SimilarityKind similarity,
    boolean removeStopwords,
    boolean stem,
    WeightProfile profile) {

  public PreprocessingKey preprocessingKey() {
    return new PreprocessingKey(removeStopwords, stem);
  }
}
