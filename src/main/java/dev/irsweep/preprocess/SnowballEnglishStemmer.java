package dev.irsweep.preprocess;

import org.tartarus.snowball.ext.EnglishStemmer;

/**
 * Snowball (Porter2) English stemmer. Snowball programs keep their buffer as instance state, so
 * each thread gets its own.
 */
public final class SnowballEnglishStemmer implements Stemmer {

  private final ThreadLocal<EnglishStemmer> stemmers = ThreadLocal.withInitial(EnglishStemmer::new);

  @Override
  public String stem(String token) {
    if (token.isEmpty()) {
      return token;
    }
    EnglishStemmer stemmer = stemmers.get();
    stemmer.setCurrent(token);
    stemmer.stem();
    return stemmer.getCurrent();
  }
}
