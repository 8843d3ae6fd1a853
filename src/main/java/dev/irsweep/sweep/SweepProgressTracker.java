package dev.irsweep.sweep;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Thread-safe tracker for the sweep in progress.
 *
 * <p>Holds one immutable {@link SweepProgress} snapshot. Workers report each finished point and
 * every update atomically replaces the snapshot with a copy carrying the incremented counter.
 * Cancellation is cooperative: workers check {@link #isCancelled()} before starting a point.
 */
@Component
public class SweepProgressTracker {

  private final AtomicReference<@Nullable SweepProgress> current = new AtomicReference<>();

  /**
   * Starts tracking a new sweep, replacing any previous snapshot.
   *
   * @param total number of points that will be evaluated
   */
  public void start(int total) {
    current.set(new SweepProgress(SweepProgress.Status.RUNNING, total, 0, 0, 0, Instant.now()));
  }

  public void recordCompleted() {
    update(
        p ->
            new SweepProgress(
                p.status(), p.total(), p.completed() + 1, p.failed(), p.skipped(), p.startedAt()));
  }

  public void recordFailed() {
    update(
        p ->
            new SweepProgress(
                p.status(), p.total(), p.completed(), p.failed() + 1, p.skipped(), p.startedAt()));
  }

  public void recordSkipped() {
    update(
        p ->
            new SweepProgress(
                p.status(), p.total(), p.completed(), p.failed(), p.skipped() + 1, p.startedAt()));
  }

  /** Requests cancellation; points already running still finish. */
  public void cancel() {
    update(p -> withStatus(p, SweepProgress.Status.CANCELLED));
  }

  /** Marks the sweep finished unless it was cancelled. */
  public void finish() {
    update(
        p ->
            p.status() == SweepProgress.Status.RUNNING
                ? withStatus(p, SweepProgress.Status.COMPLETED)
                : p);
  }

  public boolean isCancelled() {
    SweepProgress progress = current.get();
    return progress != null && progress.status() == SweepProgress.Status.CANCELLED;
  }

  public Optional<SweepProgress> getProgress() {
    return Optional.ofNullable(current.get());
  }

  private void update(UnaryOperator<SweepProgress> change) {
    current.updateAndGet(p -> p == null ? null : change.apply(p));
  }

  private static SweepProgress withStatus(SweepProgress p, SweepProgress.Status status) {
    return new SweepProgress(
        status, p.total(), p.completed(), p.failed(), p.skipped(), p.startedAt());
  }
}
