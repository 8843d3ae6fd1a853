package dev.irsweep.preprocess;

/**
 * The preprocessing switches of a configuration; identifies one variant of the corpus.
 *
 * @param removeStopwords drop stopwords
 * @param stem stem surviving tokens
 */
public record PreprocessingKey(boolean removeStopwords, boolean stem) {}
