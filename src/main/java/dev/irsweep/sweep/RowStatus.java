package dev.irsweep.sweep;

/** Outcome of evaluating one sweep point. */
public enum RowStatus {
  /** Metrics were computed. */
  OK,
  /** The point could not be resolved or its evaluation threw. */
  FAILED,
  /** The point was not evaluated: cancelled, or no query had usable judgments. */
  SKIPPED
}
