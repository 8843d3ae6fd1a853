package dev.irsweep.corpus;

import java.util.Comparator;
import java.util.List;

/**
 * A corpus document: identifier plus its raw token sequence in reading order.
 *
 * @param id the document identifier
 * @param tokens raw tokens, duplicates retained
 * @param sections the section of each token, index-aligned with {@code tokens}; empty when the
 *     source had no sections
 */
public record Document(String id, List<String> tokens, List<Section> sections) {

  /**
   * Ascending document id. Purely numeric ids compare by value ("2" before "10"), any other pair
   * compares lexically after numeric ids. Equal values ("01", "1") fall back to lexical order, so
   * only identical ids compare as equal.
   */
  public static final Comparator<String> ID_ORDER = Document::compareIds;

  public Document {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Document id must not be blank");
    }
    tokens = List.copyOf(tokens);
    sections = List.copyOf(sections);
    Section.requireAligned(id, tokens, sections);
  }

  /** A document without section information. */
  public Document(String id, List<String> tokens) {
    this(id, tokens, List.of());
  }

  private static int compareIds(String a, String b) {
    boolean aNumeric = isNumeric(a);
    boolean bNumeric = isNumeric(b);
    if (aNumeric && bNumeric) {
      int byLength = Integer.compare(stripZeros(a).length(), stripZeros(b).length());
      if (byLength != 0) {
        return byLength;
      }
      int byValue = stripZeros(a).compareTo(stripZeros(b));
      // "01" and "1" have the same value but are distinct ids
      return byValue != 0 ? byValue : a.compareTo(b);
    }
    if (aNumeric != bNumeric) {
      return aNumeric ? -1 : 1;
    }
    return a.compareTo(b);
  }

  static boolean isNumeric(String id) {
    if (id.isEmpty()) {
      return false;
    }
    for (int i = 0; i < id.length(); i++) {
      if (!Character.isDigit(id.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static String stripZeros(String digits) {
    int i = 0;
    while (i < digits.length() - 1 && digits.charAt(i) == '0') {
      i++;
    }
    return digits.substring(i);
  }
}
