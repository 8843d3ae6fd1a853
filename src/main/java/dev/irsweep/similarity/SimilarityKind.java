package dev.irsweep.similarity;

import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Similarity measures available to a sweep. */
public enum SimilarityKind {
  COSINE("cosine"),
  JACCARD("jaccard"),
  DICE("dice"),
  OVERLAP("overlap");

  private final String tag;

  SimilarityKind(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  /**
   * Resolves a configured tag, case-insensitively.
   *
   * @throws IllegalArgumentException if no measure carries the tag
   */
  public static SimilarityKind fromTag(String tag) {
    return find(tag)
        .orElseThrow(() -> new IllegalArgumentException("Unknown similarity measure: " + tag));
  }

  /** The measure carrying {@code tag}, ignoring case; empty for unknown or null tags. */
  public static Optional<SimilarityKind> find(@Nullable String tag) {
    for (SimilarityKind kind : values()) {
      if (kind.tag.equalsIgnoreCase(tag)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
