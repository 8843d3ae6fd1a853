package dev.irsweep.corpus;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Reads CACM-style collections, used for both documents and queries.
 *
 * <p>Each record starts with {@code .I <id>}. Section markers are a dot plus one letter on their
 * own line. Lines of the title ({@code .T}), author ({@code .A}), keyword ({@code .K}) and
 * abstract ({@code .W}) sections are tokenized in file order; all other sections ({@code .B},
 * {@code .N}, {@code .X}, ...) are skipped. Every token remembers the section it came from.
 */
public final class CacmReader {

  private static final Pattern RECORD_START = Pattern.compile("^\\.I\\s+(\\S+)\\s*$");
  private static final Pattern SECTION_MARKER = Pattern.compile("^\\.([A-Z])\\b.*$");

  private CacmReader() {}

  public static List<Document> readDocuments(Path path) throws IOException {
    List<Document> documents = new ArrayList<>();
    for (ParsedRecord record : read(path)) {
      documents.add(new Document(record.id(), record.tokens(), record.sections()));
    }
    return documents;
  }

  /**
   * Reads queries and attaches their relevance judgments.
   *
   * @param path the query file
   * @param relevance relevant document ids per query id; queries without an entry get none
   */
  public static List<Query> readQueries(Path path, Map<String, Set<String>> relevance)
      throws IOException {
    List<Query> queries = new ArrayList<>();
    for (ParsedRecord record : read(path)) {
      queries.add(
          new Query(
              record.id(),
              record.tokens(),
              record.sections(),
              relevance.getOrDefault(record.id(), Set.of())));
    }
    return queries;
  }

  static List<ParsedRecord> read(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  static List<ParsedRecord> parse(BufferedReader reader, String sourceName) throws IOException {
    List<ParsedRecord> records = new ArrayList<>();
    @Nullable String currentId = null;
    List<String> currentTokens = new ArrayList<>();
    List<Section> currentSections = new ArrayList<>();
    Optional<Section> section = Optional.empty();
    int lineNumber = 0;

    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String trimmed = line.strip();
      Matcher start = RECORD_START.matcher(trimmed);
      if (start.matches()) {
        if (currentId != null) {
          records.add(new ParsedRecord(currentId, currentTokens, currentSections));
        }
        currentId = RelevanceReader.normalizeId(start.group(1));
        currentTokens = new ArrayList<>();
        currentSections = new ArrayList<>();
        section = Optional.empty();
        continue;
      }
      Matcher marker = SECTION_MARKER.matcher(trimmed);
      if (marker.matches()) {
        section = Section.fromMarker(marker.group(1).charAt(0));
        continue;
      }
      if (trimmed.isEmpty() || section.isEmpty()) {
        continue;
      }
      if (currentId == null) {
        throw new CorpusFormatException(
            sourceName + ":" + lineNumber + ": text before the first .I record");
      }
      List<String> tokens = TextTokenizer.tokenize(trimmed);
      currentTokens.addAll(tokens);
      currentSections.addAll(Collections.nCopies(tokens.size(), section.get()));
    }
    if (currentId != null) {
      records.add(new ParsedRecord(currentId, currentTokens, currentSections));
    }
    return records;
  }

  record ParsedRecord(String id, List<String> tokens, List<Section> sections) {}
}
