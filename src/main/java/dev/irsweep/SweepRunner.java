package dev.irsweep;

import dev.irsweep.corpus.Corpus;
import dev.irsweep.corpus.CorpusLoader;
import dev.irsweep.export.ResultTableExporter;
import dev.irsweep.sweep.PermutationSweepService;
import dev.irsweep.sweep.RowStatus;
import dev.irsweep.sweep.SweepProperties;
import dev.irsweep.sweep.SweepRow;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one sweep at startup: load corpus, evaluate all configurations, export the table.
 *
 * <p>Disabled with {@code irsweep.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(
    prefix = "irsweep.runner",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SweepRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(SweepRunner.class);

  private final CorpusLoader corpusLoader;
  private final PermutationSweepService sweepService;
  private final ResultTableExporter exporter;
  private final SweepProperties properties;

  public SweepRunner(
      CorpusLoader corpusLoader,
      PermutationSweepService sweepService,
      ResultTableExporter exporter,
      SweepProperties properties) {
    this.corpusLoader = corpusLoader;
    this.sweepService = sweepService;
    this.exporter = exporter;
    this.properties = properties;
  }

  @Override
  public void run(String... args) throws Exception {
    Corpus corpus = corpusLoader.load();
    List<SweepRow> rows = sweepService.runSweep(corpus);
    exporter.export(rows, Path.of(properties.getOutput()));

    Map<RowStatus, Integer> byStatus = new EnumMap<>(RowStatus.class);
    for (SweepRow row : rows) {
      byStatus.merge(row.status(), 1, Integer::sum);
    }
    log.info("Sweep complete: {} rows {}", rows.size(), byStatus);
  }
}
