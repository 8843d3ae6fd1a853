package dev.irsweep.preprocess;

import dev.irsweep.corpus.Section;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalises raw tokens into index terms. Stopword removal matches case-insensitively; stemming
 * maps each surviving token through the {@link Stemmer}. Order and duplicates are preserved, and
 * the output depends only on the input and the two flags.
 */
public class Preprocessor {

  private final Set<String> stopwords;
  private final Stemmer stemmer;

  /**
   * @param stopwords lower-case stopwords
   * @param stemmer the stemmer applied when stemming is on
   */
  public Preprocessor(Set<String> stopwords, Stemmer stemmer) {
    this.stopwords = Set.copyOf(stopwords);
    this.stemmer = stemmer;
  }

  public List<String> preprocess(List<String> rawTokens, boolean removeStopwords, boolean stem) {
    List<String> terms = new ArrayList<>(rawTokens.size());
    for (String token : rawTokens) {
      if (removeStopwords && stopwords.contains(token.toLowerCase(Locale.ROOT))) {
        continue;
      }
      terms.add(stem ? stemmer.stem(token) : token);
    }
    return List.copyOf(terms);
  }

  public List<String> preprocess(List<String> rawTokens, PreprocessingKey key) {
    return preprocess(rawTokens, key.removeStopwords(), key.stem());
  }

  /**
   * The section tags of the tokens that survive {@link #preprocess(List, PreprocessingKey)}, so the
   * result stays index-aligned with the preprocessed terms. Stemming never drops a token.
   *
   * @param rawTokens raw tokens
   * @param sections the section of each raw token; empty when the tokens carry none
   * @param key the preprocessing switches
   * @return the surviving tags, or an empty list when {@code sections} is empty
   */
  public List<Section> keptSections(
      List<String> rawTokens, List<Section> sections, PreprocessingKey key) {
    if (sections.isEmpty() || !key.removeStopwords()) {
      return sections;
    }
    List<Section> kept = new ArrayList<>(sections.size());
    for (int i = 0; i < rawTokens.size(); i++) {
      if (!stopwords.contains(rawTokens.get(i).toLowerCase(Locale.ROOT))) {
        kept.add(sections.get(i));
      }
    }
    return List.copyOf(kept);
  }
}
