package dev.irsweep.corpus;

/** Thrown when a corpus, query or relevance file cannot be parsed. */
public class CorpusFormatException extends IllegalStateException {

  public CorpusFormatException(String message) {
    super(message);
  }

  public CorpusFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
