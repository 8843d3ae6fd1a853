package dev.irsweep.corpus;

import java.util.List;
import java.util.Optional;

/** The indexed sections of a CACM record, in the order weight profiles address them. */
public enum Section {
  AUTHOR('A'),
  TITLE('T'),
  KEYWORD('K'),
  ABSTRACT('W');

  private final char marker;

  Section(char marker) {
    this.marker = marker;
  }

  /** The letter following the dot in the record file, e.g. {@code W} for {@code .W}. */
  public char marker() {
    return marker;
  }

  /** The indexed section introduced by {@code marker}, empty for skipped sections. */
  public static Optional<Section> fromMarker(char marker) {
    for (Section section : values()) {
      if (section.marker == marker) {
        return Optional.of(section);
      }
    }
    return Optional.empty();
  }

  static void requireAligned(String id, List<String> tokens, List<Section> sections) {
    if (!sections.isEmpty() && sections.size() != tokens.size()) {
      throw new IllegalArgumentException(
          "Record "
              + id
              + " has "
              + tokens.size()
              + " tokens but "
              + sections.size()
              + " section tags");
    }
  }
}
