package dev.irsweep.preprocess;

/** Maps a token to its stem. Implementations must be pure and thread-safe. */
@FunctionalInterface
public interface Stemmer {

  String stem(String token);
}
