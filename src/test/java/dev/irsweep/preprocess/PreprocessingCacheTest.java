package dev.irsweep.preprocess;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import dev.irsweep.corpus.Corpus;
import dev.irsweep.corpus.Document;
import dev.irsweep.corpus.Query;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PreprocessingCacheTest {

  private static final Corpus CORPUS =
      new Corpus(
          List.of(
              new Document("1", List.of("the", "cats", "sat")),
              new Document("2", List.of("cats", "and", "dogs"))),
          List.of(new Query("1", List.of("the", "cats"), Set.of("1"))));

  private final Preprocessor preprocessor =
      spy(new Preprocessor(Set.of("the", "and"), new SnowballEnglishStemmer()));

  @Test
  void each_key_is_preprocessed_once() {
    PreprocessingCache cache = new PreprocessingCache(CORPUS, preprocessor);
    PreprocessingKey key = new PreprocessingKey(true, false);

    PreprocessedCorpus first = cache.get(key);
    PreprocessedCorpus second = cache.get(key);

    assertThat(second).isSameAs(first);
    // two documents and one query
    verify(preprocessor, times(3)).preprocess(anyList(), any(PreprocessingKey.class));
  }

  @Test
  void variants_are_kept_apart() {
    PreprocessingCache cache = new PreprocessingCache(CORPUS, preprocessor);

    PreprocessedCorpus raw = cache.get(new PreprocessingKey(false, false));
    PreprocessedCorpus filtered = cache.get(new PreprocessingKey(true, true));

    assertThat(raw.documentTerms().get(0)).containsExactly("the", "cats", "sat");
    assertThat(filtered.documentTerms().get(0)).containsExactly("cat", "sat");
    assertThat(raw.stats().documentFrequency("the")).isEqualTo(1);
    assertThat(filtered.stats().documentFrequency("the")).isZero();
    assertThat(filtered.stats().documentFrequency("cat")).isEqualTo(2);
  }

  @Test
  void populate_builds_every_requested_key() {
    PreprocessingCache cache = new PreprocessingCache(CORPUS, preprocessor);

    cache.populate(List.of(new PreprocessingKey(false, true), new PreprocessingKey(true, true)));

    assertThat(cache.size()).isEqualTo(2);
    assertThat(cache.contains(new PreprocessingKey(false, true))).isTrue();
    assertThat(cache.contains(new PreprocessingKey(false, false))).isFalse();
  }

  @Test
  void query_terms_are_preprocessed_but_do_not_count_in_statistics() {
    PreprocessedCorpus variant =
        PreprocessedCorpus.build(CORPUS, new PreprocessingKey(true, false), preprocessor);

    assertThat(variant.queryTerms()).containsExactly(List.of("cats"));
    assertThat(variant.stats().documentCount()).isEqualTo(2);
    assertThat(variant.stats().documentFrequency("cats")).isEqualTo(2);
  }
}
