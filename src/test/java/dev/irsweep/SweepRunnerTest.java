package dev.irsweep;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.irsweep.corpus.Corpus;
import dev.irsweep.corpus.CorpusLoader;
import dev.irsweep.export.ResultTableExporter;
import dev.irsweep.sweep.PermutationSweepService;
import dev.irsweep.sweep.SweepPoint;
import dev.irsweep.sweep.SweepProperties;
import dev.irsweep.sweep.SweepRow;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SweepRunnerTest {

  @Mock private CorpusLoader corpusLoader;

  @Mock private PermutationSweepService sweepService;

  @Mock private ResultTableExporter exporter;

  private SweepRunner runner;

  @BeforeEach
  void setUp() {
    SweepProperties properties = new SweepProperties();
    properties.setOutput("target/sweep/output.tsv");
    runner = new SweepRunner(corpusLoader, sweepService, exporter, properties);
  }

  @Test
  void runs_sweep_and_exports_rows() throws Exception {
    Corpus corpus = new Corpus(List.of(), List.of());
    List<SweepRow> rows =
        List.of(
            SweepRow.skipped(
                new SweepPoint(0, "tf", "cosine", false, false, List.of(1.0, 1.0, 1.0, 1.0)),
                "no judged queries"));
    when(corpusLoader.load()).thenReturn(corpus);
    when(sweepService.runSweep(corpus)).thenReturn(rows);

    runner.run();

    verify(exporter).export(rows, Path.of("target/sweep/output.tsv"));
  }

  @Test
  void unreadable_corpus_stops_before_sweep() throws Exception {
    when(corpusLoader.load()).thenThrow(new IOException("no such file"));

    assertThatThrownBy(() -> runner.run()).isInstanceOf(IOException.class);

    verify(sweepService, never()).runSweep(any(Corpus.class));
    verify(exporter, never()).export(any(), any());
  }
}
