package dev.irsweep.weighting;

import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Term-weighting schemes available to a sweep. */
public enum WeightingScheme {
  BOOLEAN("boolean"),
  TF("tf"),
  TFIDF("tfidf");

  private final String tag;

  WeightingScheme(String tag) {
    this.tag = tag;
  }

  /** The lower-case tag used in configuration and in the result table. */
  public String tag() {
    return tag;
  }

  /**
   * Resolves a configured tag, case-insensitively.
   *
   * @throws IllegalArgumentException if no scheme carries the tag
   */
  public static WeightingScheme fromTag(String tag) {
    return find(tag)
        .orElseThrow(() -> new IllegalArgumentException("Unknown weighting scheme: " + tag));
  }

  /** The scheme carrying {@code tag}, ignoring case; empty for unknown or null tags. */
  public static Optional<WeightingScheme> find(@Nullable String tag) {
    for (WeightingScheme scheme : values()) {
      if (scheme.tag.equalsIgnoreCase(tag)) {
        return Optional.of(scheme);
      }
    }
    return Optional.empty();
  }
}
