package dev.irsweep.corpus;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextTokenizerTest {

  @Test
  void lower_cases_and_drops_punctuation() {
    assertThat(TextTokenizer.tokenize("Matrix Computations, 1958!"))
        .containsExactly("matrix", "computations", "1958");
  }

  @Test
  void keeps_duplicates_in_order() {
    assertThat(TextTokenizer.tokenize("cat sat, cat")).containsExactly("cat", "sat", "cat");
  }

  @Test
  void blank_text_has_no_tokens() {
    assertThat(TextTokenizer.tokenize("   ")).isEmpty();
  }
}
