package dev.irsweep.corpus;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads relevance judgments, one {@code <queryId> <documentId>} pair per whitespace-separated
 * line. Extra columns are ignored and blank lines skipped.
 */
public final class RelevanceReader {

  private RelevanceReader() {}

  public static List<RelevanceJudgment> read(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  static List<RelevanceJudgment> parse(BufferedReader reader, String sourceName)
      throws IOException {
    List<RelevanceJudgment> judgments = new ArrayList<>();
    int lineNumber = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      String[] fields = trimmed.split("\\s+");
      if (fields.length < 2) {
        throw new CorpusFormatException(
            sourceName + ":" + lineNumber + ": expected '<queryId> <documentId>' but got '"
                + trimmed + "'");
      }
      judgments.add(new RelevanceJudgment(normalizeId(fields[0]), normalizeId(fields[1])));
    }
    return judgments;
  }

  /** Groups judgments by query id, keeping file order. */
  public static Map<String, Set<String>> byQuery(List<RelevanceJudgment> judgments) {
    Map<String, Set<String>> grouped = new LinkedHashMap<>();
    for (RelevanceJudgment judgment : judgments) {
      grouped.computeIfAbsent(judgment.queryId(), k -> new LinkedHashSet<>())
          .add(judgment.documentId());
    }
    grouped.replaceAll((k, v) -> Collections.unmodifiableSet(v));
    return grouped;
  }

  /** Strips leading zeros from numeric ids so "01" in a judgment file matches ".I 1". */
  static String normalizeId(String id) {
    if (!Document.isNumeric(id)) {
      return id;
    }
    int i = 0;
    while (i < id.length() - 1 && id.charAt(i) == '0') {
      i++;
    }
    return id.substring(i);
  }
}
