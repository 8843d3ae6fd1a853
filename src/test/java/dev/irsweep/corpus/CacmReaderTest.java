package dev.irsweep.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CacmReaderTest {

  @Test
  void reads_indexed_sections_in_file_order() throws Exception {
    List<Document> documents = CacmReader.readDocuments(fixture("cacm-sample.raw"));

    assertThat(documents).extracting(Document::id).containsExactly("1", "2", "3");
    assertThat(documents.get(0).tokens())
        .containsExactly(
            "preliminary", "report", "on", "matrix", "computations",
            "algorithms", "for", "computing", "matrices",
            "perlis", "a", "j");
  }

  @Test
  void skips_bibliographic_and_citation_sections() throws Exception {
    List<Document> documents = CacmReader.readDocuments(fixture("cacm-sample.raw"));

    assertThat(documents.get(0).tokens()).doesNotContain("cacm", "1958", "ca581203", "100");
    assertThat(documents.get(2).tokens())
        .containsExactly("techniques", "for", "department", "of", "computer", "science",
            "computers", "curricula");
  }

  @Test
  void every_token_is_tagged_with_its_section() throws Exception {
    Document first = CacmReader.readDocuments(fixture("cacm-sample.raw")).get(0);

    assertThat(first.sections()).hasSameSizeAs(first.tokens());
    assertThat(first.sections().subList(0, 5)).containsOnly(Section.TITLE);
    assertThat(first.sections().subList(5, 9)).containsOnly(Section.ABSTRACT);
    assertThat(first.sections().subList(9, 12)).containsOnly(Section.AUTHOR);
  }

  @Test
  void skipped_section_does_not_leak_its_tag_into_the_next_indexed_one() throws IOException {
    List<CacmReader.ParsedRecord> records = parse(".I 1\n.K\nsorting\n.B\nCACM\n.W\nmerge\n");

    assertThat(records.get(0).tokens()).containsExactly("sorting", "merge");
    assertThat(records.get(0).sections()).containsExactly(Section.KEYWORD, Section.ABSTRACT);
  }

  @Test
  void record_without_indexed_text_has_no_tokens() throws IOException {
    List<CacmReader.ParsedRecord> records = parse(".I 1\n.B\nCACM 1958\n.I 2\n.T\nTitle\n");

    assertThat(records).hasSize(2);
    assertThat(records.get(0).tokens()).isEmpty();
    assertThat(records.get(1).tokens()).containsExactly("title");
  }

  @Test
  void numeric_ids_lose_leading_zeros() throws IOException {
    List<CacmReader.ParsedRecord> records = parse(".I 007\n.W\nagent\n");

    assertThat(records.get(0).id()).isEqualTo("7");
  }

  @Test
  void text_before_first_record_is_rejected() {
    assertThatThrownBy(() -> parse(".T\norphan title\n.I 1\n"))
        .isInstanceOf(CorpusFormatException.class)
        .hasMessageContaining("test:2");
  }

  @Test
  void queries_get_their_judgments() throws Exception {
    Map<String, Set<String>> relevance = Map.of("1", Set.of("1", "3"));

    List<Query> queries = CacmReader.readQueries(fixture("query-sample.raw"), relevance);

    assertThat(queries).extracting(Query::id).containsExactly("1", "2", "3");
    assertThat(queries.get(0).relevantDocumentIds()).containsExactlyInAnyOrder("1", "3");
    assertThat(queries.get(1).relevantDocumentIds()).isEmpty();
    assertThat(queries.get(1).tokens()).containsExactly("roots", "of", "digital", "computers",
        "sugai");
  }

  private static List<CacmReader.ParsedRecord> parse(String content) throws IOException {
    return CacmReader.parse(new BufferedReader(new StringReader(content)), "test");
  }

  static Path fixture(String name) throws URISyntaxException {
    return Path.of(CacmReaderTest.class.getResource("/corpus/" + name).toURI());
  }
}
