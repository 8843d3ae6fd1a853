package dev.irsweep.sweep;

import java.time.Instant;

/**
 * Immutable snapshot of a running or finished sweep.
 *
 * @param status the sweep state
 * @param total number of points enumerated
 * @param completed points evaluated successfully
 * @param failed points that failed
 * @param skipped points skipped (cancelled or without judged queries)
 * @param startedAt when the sweep started
 */
public record SweepProgress(
    Status status, int total, int completed, int failed, int skipped, Instant startedAt) {

  public enum Status {
    RUNNING,
    CANCELLED,
    COMPLETED
  }

  /** Points that have produced a row so far. */
  public int processed() {
    return completed + failed + skipped;
  }
}
