package dev.irsweep.preprocess;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import org.springframework.core.io.FileSystemResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads a stopword list: one word per line, blank lines and lines starting with {@code #}
 * ignored. Words are lower-cased so lookups can be case-insensitive.
 */
public final class StopwordLoader {

  private static final ResourceLoader RESOURCE_LOADER = new FileSystemResourceLoader();

  private StopwordLoader() {}

  /**
   * Loads stopwords from a {@code classpath:} location or a file path.
   *
   * @throws IOException if the list cannot be read
   */
  public static Set<String> load(String location) throws IOException {
    Resource resource = RESOURCE_LOADER.getResource(location);
    try (InputStream is = resource.getInputStream()) {
      return parse(is);
    }
  }

  static Set<String> parse(InputStream is) throws IOException {
    Set<String> words = new HashSet<>();
    BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    String line;
    while ((line = reader.readLine()) != null) {
      String word = line.strip();
      if (!word.isEmpty() && !word.startsWith("#")) {
        words.add(word.toLowerCase(Locale.ROOT));
      }
    }
    return Set.copyOf(words);
  }
}
