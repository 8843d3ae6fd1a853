package dev.irsweep.sweep;

import dev.irsweep.eval.MetricRow;
import org.jspecify.annotations.Nullable;

/**
 * Result of one sweep point.
 *
 * @param point the configured point
 * @param status the outcome
 * @param metrics the aggregated metrics; present exactly when {@code status} is {@link
 *     RowStatus#OK}
 * @param reason why the point failed or was skipped; null when OK
 */
public record SweepRow(
    SweepPoint point, RowStatus status, @Nullable MetricRow metrics, @Nullable String reason) {

  public SweepRow {
    if ((status == RowStatus.OK) != (metrics != null)) {
      throw new IllegalArgumentException("metrics must be present exactly for OK rows");
    }
  }

  public static SweepRow ok(SweepPoint point, MetricRow metrics) {
    return new SweepRow(point, RowStatus.OK, metrics, null);
  }

  public static SweepRow failed(SweepPoint point, String reason) {
    return new SweepRow(point, RowStatus.FAILED, null, reason);
  }

  public static SweepRow skipped(SweepPoint point, String reason) {
    return new SweepRow(point, RowStatus.SKIPPED, null, reason);
  }
}
