package dev.irsweep.weighting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.irsweep.corpus.Section;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TermWeighterTest {

  private static final double TOLERANCE = 1e-9;

  private static final CorpusStats STATS =
      CorpusStats.from(List.of(List.of("a", "b"), List.of("a", "c")));

  @Nested
  class BooleanScheme {

    @Test
    void every_distinct_term_gets_w1() {
      WeightVector vector =
          TermWeighter.weigh(
              List.of("cat", "sat", "mat", "cat"),
              WeightingScheme.BOOLEAN,
              new WeightProfile(1, 0, 0, 0),
              STATS);

      assertThat(vector.asMap()).containsOnlyKeys("cat", "sat", "mat");
      assertThat(vector.weight("cat")).isEqualTo(1.0);
      assertThat(vector.weight("sat")).isEqualTo(1.0);
    }

    @Test
    void zero_w1_yields_empty_vector() {
      WeightVector vector =
          TermWeighter.weigh(
              List.of("cat"), WeightingScheme.BOOLEAN, new WeightProfile(0, 5, 5, 5), STATS);

      assertThat(vector.isEmpty()).isTrue();
    }
  }

  @Nested
  class TfScheme {

    @Test
    void raw_count_scaled_by_w1() {
      WeightVector vector =
          TermWeighter.weigh(
              List.of("a", "b", "a"), WeightingScheme.TF, new WeightProfile(2, 0, 0, 0), STATS);

      assertThat(vector.weight("a")).isCloseTo(4.0, within(TOLERANCE));
      assertThat(vector.weight("b")).isCloseTo(2.0, within(TOLERANCE));
    }

    @Test
    void w3_divides_by_scaled_length() {
      WeightVector vector =
          TermWeighter.weigh(
              List.of("a", "b", "a"), WeightingScheme.TF, new WeightProfile(2, 0, 1, 0), STATS);

      // length 3, divisor 1 * 3
      assertThat(vector.weight("a")).isCloseTo(4.0 / 3.0, within(TOLERANCE));
      assertThat(vector.weight("b")).isCloseTo(2.0 / 3.0, within(TOLERANCE));
    }
  }

  @Nested
  class TfidfScheme {

    @Test
    void count_times_idf_scaled_by_w1_and_w2() {
      WeightVector vector =
          TermWeighter.weigh(
              List.of("a", "b", "b"), WeightingScheme.TFIDF, new WeightProfile(1, 1, 0, 0), STATS);

      // "a" occurs in every document: idf 0, dropped from the support
      assertThat(vector.support()).containsExactly("b");
      assertThat(vector.weight("b")).isCloseTo(2.0 * Math.log(2.0), within(TOLERANCE));
    }

    @Test
    void w4_normalises_to_scaled_unit_length() {
      WeightVector unit =
          TermWeighter.weigh(
              List.of("b", "c", "c"), WeightingScheme.TFIDF, new WeightProfile(1, 1, 0, 1), STATS);
      WeightVector half =
          TermWeighter.weigh(
              List.of("b", "c", "c"), WeightingScheme.TFIDF, new WeightProfile(1, 1, 0, 2), STATS);

      assertThat(unit.norm()).isCloseTo(1.0, within(TOLERANCE));
      assertThat(half.norm()).isCloseTo(0.5, within(TOLERANCE));
      // proportions kept: c occurs twice as often as b with equal idf
      assertThat(unit.weight("c")).isCloseTo(2.0 * unit.weight("b"), within(TOLERANCE));
    }

    @Test
    void unseen_query_term_gets_no_weight() {
      WeightVector vector =
          TermWeighter.weigh(
              List.of("zzz"), WeightingScheme.TFIDF, new WeightProfile(1, 1, 1, 1), STATS);

      assertThat(vector.isEmpty()).isTrue();
    }

    @Test
    void zero_w2_zeroes_all_weights() {
      WeightVector vector =
          TermWeighter.weigh(
              List.of("b", "c"), WeightingScheme.TFIDF, new WeightProfile(1, 0, 0, 0), STATS);

      assertThat(vector.isEmpty()).isTrue();
    }
  }

  @Nested
  class SectionWeighting {

    private final List<String> terms = List.of("sort", "merge", "sort");
    private final List<Section> sections =
        List.of(Section.TITLE, Section.ABSTRACT, Section.ABSTRACT);

    @Test
    void occurrences_count_with_their_section_coefficient() {
      WeightVector vector =
          TermWeighter.weigh(
              terms, sections, WeightingScheme.TF, new WeightProfile(1, 3, 0, 2), STATS);

      // sort: title 3 + abstract 2; merge: abstract 2; then scaled by w1 = 1
      assertThat(vector.weight("sort")).isCloseTo(5.0, within(TOLERANCE));
      assertThat(vector.weight("merge")).isCloseTo(2.0, within(TOLERANCE));
    }

    @Test
    void length_divisor_still_uses_the_term_count() {
      WeightVector vector =
          TermWeighter.weigh(
              terms, sections, WeightingScheme.TF, new WeightProfile(2, 1, 1, 1), STATS);

      // raw counts sort 2, merge 1 (title = abstract = 1); w3 = 1 divides by 1 * 3
      assertThat(vector.weight("sort")).isCloseTo(4.0 / 3.0, within(TOLERANCE));
      assertThat(vector.weight("merge")).isCloseTo(2.0 / 3.0, within(TOLERANCE));
    }

    @Test
    void section_with_zero_coefficient_contributes_nothing() {
      WeightVector vector =
          TermWeighter.weigh(
              terms, sections, WeightingScheme.TF, new WeightProfile(1, 0, 0, 1), STATS);

      assertThat(vector.support()).containsExactlyInAnyOrder("sort", "merge");
      assertThat(vector.weight("sort")).isCloseTo(1.0, within(TOLERANCE));

      WeightVector titleOnly =
          TermWeighter.weigh(
              terms, sections, WeightingScheme.TF, new WeightProfile(1, 1, 0, 0), STATS);

      assertThat(titleOnly.support()).containsExactly("sort");
    }

    @Test
    void different_section_emphasis_changes_the_vector_direction() {
      WeightVector even =
          TermWeighter.weigh(
              terms, sections, WeightingScheme.TF, new WeightProfile(1, 1, 0, 1), STATS);
      WeightVector titleHeavy =
          TermWeighter.weigh(
              terms, sections, WeightingScheme.TF, new WeightProfile(1, 4, 0, 1), STATS);

      double evenRatio = even.weight("sort") / even.weight("merge");
      double titleHeavyRatio = titleHeavy.weight("sort") / titleHeavy.weight("merge");
      assertThat(evenRatio).isCloseTo(2.0, within(TOLERANCE));
      assertThat(titleHeavyRatio).isCloseTo(5.0, within(TOLERANCE));
    }

    @Test
    void boolean_ignores_sections() {
      WeightVector vector =
          TermWeighter.weigh(
              terms, sections, WeightingScheme.BOOLEAN, new WeightProfile(1, 0, 0, 0), STATS);

      assertThat(vector.weight("sort")).isEqualTo(1.0);
      assertThat(vector.weight("merge")).isEqualTo(1.0);
    }

    @Test
    void empty_sections_mean_plain_frequencies() {
      WeightProfile profile = new WeightProfile(1, 7, 0, 3);

      assertThat(TermWeighter.weigh(terms, List.of(), WeightingScheme.TF, profile, STATS))
          .isEqualTo(TermWeighter.weigh(terms, WeightingScheme.TF, profile, STATS));
    }

    @Test
    void misaligned_sections_are_rejected() {
      assertThatThrownBy(
              () ->
                  TermWeighter.weigh(
                      terms,
                      List.of(Section.TITLE),
                      WeightingScheme.TF,
                      new WeightProfile(1, 1, 1, 1),
                      STATS))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("3 terms but 1 section tags");
    }
  }

  @Test
  void empty_term_sequence_yields_empty_vector_for_every_scheme() {
    for (WeightingScheme scheme : WeightingScheme.values()) {
      WeightVector vector =
          TermWeighter.weigh(List.of(), scheme, new WeightProfile(1, 1, 1, 1), STATS);

      assertThat(vector.isEmpty()).as(scheme.tag()).isTrue();
    }
  }

  @Test
  void fromTag_is_case_insensitive() {
    assertThat(WeightingScheme.fromTag("TfIdf")).isEqualTo(WeightingScheme.TFIDF);
  }
}
