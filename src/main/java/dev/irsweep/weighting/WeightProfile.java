package dev.irsweep.weighting;

import dev.irsweep.corpus.Section;
import java.util.List;

/**
 * The four scheme-dependent weighting coefficients.
 *
 * <ul>
 *   <li>{@code w1} - raw term-frequency multiplier (boolean weight for {@link
 *       WeightingScheme#BOOLEAN})
 *   <li>{@code w2} - idf multiplier ({@link WeightingScheme#TFIDF} only)
 *   <li>{@code w3} - length-normalisation multiplier; 0 disables length normalisation
 *   <li>{@code w4} - unit-length normalisation multiplier ({@link WeightingScheme#TFIDF} only); 0
 *       disables it
 * </ul>
 *
 * <p>When terms carry {@link Section} tags the same coefficients also act as per-section
 * occurrence weights, in the order author, title, keyword, abstract; see {@link
 * #sectionWeight(Section)}.
 *
 * @param w1 first coefficient
 * @param w2 second coefficient
 * @param w3 third coefficient
 * @param w4 fourth coefficient
 */
public record WeightProfile(double w1, double w2, double w3, double w4) {

  public WeightProfile {
    requireValid("w1", w1);
    requireValid("w2", w2);
    requireValid("w3", w3);
    requireValid("w4", w4);
  }

  /**
   * Builds a profile from a configured coefficient list.
   *
   * @param coefficients exactly four coefficients
   * @return the validated profile
   * @throws InvalidProfileException if the list does not hold four valid coefficients
   */
  public static WeightProfile of(List<Double> coefficients) {
    if (coefficients == null || coefficients.size() != 4) {
      throw new InvalidProfileException(
          "Weight profile needs exactly 4 coefficients but got " + coefficients);
    }
    for (Double c : coefficients) {
      if (c == null) {
        throw new InvalidProfileException("Weight profile contains a null coefficient");
      }
    }
    return new WeightProfile(
        coefficients.get(0), coefficients.get(1), coefficients.get(2), coefficients.get(3));
  }

  /** The coefficients in order w1..w4. */
  public List<Double> coefficients() {
    return List.of(w1, w2, w3, w4);
  }

  /**
   * The amount one occurrence in {@code section} adds to a term's raw count: {@code w1} for
   * author, {@code w2} for title, {@code w3} for keyword and {@code w4} for abstract.
   */
  public double sectionWeight(Section section) {
    return switch (section) {
      case AUTHOR -> w1;
      case TITLE -> w2;
      case KEYWORD -> w3;
      case ABSTRACT -> w4;
    };
  }

  private static void requireValid(String name, double value) {
    if (!Double.isFinite(value) || value < 0.0) {
      throw new InvalidProfileException(
          "Coefficient " + name + " must be a finite value >= 0 but was " + value);
    }
  }
}
