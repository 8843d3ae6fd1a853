package dev.irsweep.preprocess;

import dev.irsweep.corpus.CorpusProperties;
import java.io.IOException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the {@link Preprocessor} with the configured stopword list and the Snowball stemmer. */
@Configuration
public class PreprocessingConfig {

  private static final Logger log = LoggerFactory.getLogger(PreprocessingConfig.class);

  @Bean
  public Stemmer stemmer() {
    return new SnowballEnglishStemmer();
  }

  @Bean
  public Preprocessor preprocessor(CorpusProperties corpusProperties, Stemmer stemmer)
      throws IOException {
    Set<String> stopwords = StopwordLoader.load(corpusProperties.getStopwords());
    log.info("Loaded {} stopwords from {}", stopwords.size(), corpusProperties.getStopwords());
    return new Preprocessor(stopwords, stemmer);
  }
}
