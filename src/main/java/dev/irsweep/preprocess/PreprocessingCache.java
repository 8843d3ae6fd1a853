package dev.irsweep.preprocess;

import dev.irsweep.corpus.Corpus;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-run cache of preprocessed corpus variants, one per {@link PreprocessingKey}.
 *
 * <p>Each variant is built at most once ({@link ConcurrentHashMap#computeIfAbsent}) and is
 * immutable afterwards, so any number of workers may read it. A cache belongs to a single corpus;
 * statistics of one variant are never reused for another.
 */
public class PreprocessingCache {

  private static final Logger log = LoggerFactory.getLogger(PreprocessingCache.class);

  private final Corpus corpus;
  private final Preprocessor preprocessor;
  private final ConcurrentHashMap<PreprocessingKey, PreprocessedCorpus> variants =
      new ConcurrentHashMap<>();

  public PreprocessingCache(Corpus corpus, Preprocessor preprocessor) {
    this.corpus = corpus;
    this.preprocessor = preprocessor;
  }

  /** Returns the variant for {@code key}, building it on first access. */
  public PreprocessedCorpus get(PreprocessingKey key) {
    return variants.computeIfAbsent(key, this::build);
  }

  /** Builds every variant in {@code keys} up front. */
  public void populate(Collection<PreprocessingKey> keys) {
    for (PreprocessingKey key : keys) {
      get(key);
    }
  }

  public boolean contains(PreprocessingKey key) {
    return variants.containsKey(key);
  }

  public int size() {
    return variants.size();
  }

  private PreprocessedCorpus build(PreprocessingKey key) {
    PreprocessedCorpus variant = PreprocessedCorpus.build(corpus, key, preprocessor);
    log.debug(
        "Preprocessed corpus for removeStopwords={}, stem={}: {} distinct terms",
        key.removeStopwords(),
        key.stem(),
        variant.stats().documentFrequencies().size());
    return variant;
  }
}
