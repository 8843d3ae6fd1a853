package dev.irsweep.export;

import dev.irsweep.eval.MetricRow;
import dev.irsweep.sweep.SweepPoint;
import dev.irsweep.sweep.SweepRow;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes sweep rows as a tab-separated table: one header line, then one line per row in the order
 * given. Column order and names are relied on by downstream analysis and must not change.
 *
 * <p>Metrics are printed with four decimals. Rows without metrics (failed or skipped points) carry
 * {@code NA} in every metric column.
 */
@Service
public class ResultTableExporter {

  private static final Logger log = LoggerFactory.getLogger(ResultTableExporter.class);

  public static final List<String> COLUMNS =
      List.of(
          "scheme",
          "similarity",
          "removeStopwords",
          "stem",
          "w1",
          "w2",
          "w3",
          "w4",
          "precision@0.25",
          "precision@0.5",
          "precision@0.75",
          "precision@1.0",
          "mean_precision_1",
          "mean_precision_2",
          "precision_normalization",
          "recall_normalization");

  static final String MISSING = "NA";

  private static final int METRIC_COLUMNS = 8;
  private static final int COEFFICIENT_COLUMNS = 4;

  /**
   * Writes the table to {@code path}, creating parent directories as needed.
   *
   * @param rows the rows in output order
   * @param path the target file; overwritten if present
   * @throws IOException if writing fails
   */
  public void export(List<SweepRow> rows, Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(rows, writer);
    }
    log.info("Wrote {} result rows to {}", rows.size(), path);
  }

  /** Writes the table to {@code writer} without closing it. */
  public void write(List<SweepRow> rows, Writer writer) throws IOException {
    writeLine(writer, COLUMNS);
    for (SweepRow row : rows) {
      writeLine(writer, cells(row));
    }
    writer.flush();
  }

  static List<String> cells(SweepRow row) {
    SweepPoint point = row.point();
    List<String> cells = new ArrayList<>(COLUMNS.size());
    cells.add(point.scheme());
    cells.add(point.similarity());
    cells.add(Boolean.toString(point.removeStopwords()));
    cells.add(Boolean.toString(point.stem()));
    for (int i = 0; i < COEFFICIENT_COLUMNS; i++) {
      Double c = i < point.coefficients().size() ? point.coefficients().get(i) : null;
      cells.add(c == null ? MISSING : formatCoefficient(c));
    }
    MetricRow metrics = row.metrics();
    if (metrics == null) {
      for (int i = 0; i < METRIC_COLUMNS; i++) {
        cells.add(MISSING);
      }
    } else {
      for (double value : metrics.values()) {
        cells.add(String.format(Locale.US, "%.4f", value));
      }
    }
    return cells;
  }

  /** Shortest plain form: 1.0 prints as "1", 0.25 as "0.25". */
  static String formatCoefficient(double value) {
    if (!Double.isFinite(value)) {
      return Double.toString(value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  private static void writeLine(Writer writer, List<String> cells) throws IOException {
    writer.write(String.join("\t", cells));
    writer.write('\n');
  }
}
