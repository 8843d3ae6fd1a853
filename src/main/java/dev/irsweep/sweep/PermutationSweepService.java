package dev.irsweep.sweep;

import dev.irsweep.corpus.Corpus;
import dev.irsweep.eval.MetricRow;
import dev.irsweep.preprocess.PreprocessingCache;
import dev.irsweep.preprocess.PreprocessingKey;
import dev.irsweep.preprocess.Preprocessor;
import dev.irsweep.similarity.SimilarityKind;
import dev.irsweep.weighting.InvalidProfileException;
import dev.irsweep.weighting.WeightingScheme;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Evaluates the full Cartesian product of sweep dimensions.
 *
 * <p>Enumeration order, outermost first: weighting scheme, similarity, stopword removal, stemming,
 * weight profile, each in the order given. Repeated values of a dimension are dropped after their
 * first occurrence; tags that differ only in case count as one. Every point is evaluated as an
 * independent task on a fixed worker pool and rows are returned in enumeration order whatever
 * order the tasks finish in.
 *
 * <p>All preprocessing variants the points need are built before the first task is submitted;
 * tasks only read them. A point that cannot be resolved or whose evaluation throws yields a {@link
 * RowStatus#FAILED} row and the sweep carries on.
 */
@Service
public class PermutationSweepService {

  private static final Logger log = LoggerFactory.getLogger(PermutationSweepService.class);

  private final Preprocessor preprocessor;
  private final SweepProgressTracker progressTracker;
  private final SweepProperties properties;

  public PermutationSweepService(
      Preprocessor preprocessor,
      SweepProgressTracker progressTracker,
      SweepProperties properties) {
    this.preprocessor = preprocessor;
    this.progressTracker = progressTracker;
    this.properties = properties;
  }

  /** Runs the sweep over the configured dimensions. */
  public List<SweepRow> runSweep(Corpus corpus) {
    return runSweep(
        corpus,
        properties.getSchemes(),
        properties.getSimilarities(),
        properties.getRemoveStopwords(),
        properties.getStem(),
        properties.getWeightProfiles());
  }

  /**
   * Runs the sweep over explicit dimensions.
   *
   * @param corpus documents and judged queries
   * @param schemes weighting scheme tags
   * @param similarities similarity tags
   * @param stopwordChoices stopword removal choices
   * @param stemChoices stemming choices
   * @param weightProfiles coefficient lists
   * @return one row per point, in enumeration order
   */
  public List<SweepRow> runSweep(
      Corpus corpus,
      List<String> schemes,
      List<String> similarities,
      List<Boolean> stopwordChoices,
      List<Boolean> stemChoices,
      List<List<Double>> weightProfiles) {
    List<SweepPoint> points =
        enumerate(schemes, similarities, stopwordChoices, stemChoices, weightProfiles);
    log.info(
        "Starting sweep of {} configurations over {} documents and {} queries ({} threads)",
        points.size(),
        corpus.documents().size(),
        corpus.queries().size(),
        properties.getThreads());
    progressTracker.start(points.size());

    PreprocessingCache cache = new PreprocessingCache(corpus, preprocessor);
    Set<PreprocessingKey> keys = new LinkedHashSet<>();
    for (SweepPoint point : points) {
      keys.add(point.preprocessingKey());
    }
    cache.populate(keys);
    log.info("Preprocessed {} corpus variants", cache.size());

    List<SweepRow> rows = execute(points, corpus, cache);
    progressTracker.finish();

    long ok = rows.stream().filter(r -> r.status() == RowStatus.OK).count();
    log.info(
        "Sweep finished: {} evaluated, {} failed or skipped", ok, rows.size() - ok);
    return rows;
  }

  /** Requests cancellation of the running sweep; started points still complete. */
  public void cancel() {
    log.info("Sweep cancellation requested");
    progressTracker.cancel();
  }

  /**
   * Enumerates the Cartesian product in the fixed nesting order, each dimension reduced to its
   * distinct values. Known tags are replaced by their canonical lower-case form; unknown tags are
   * kept as given so their failed row shows what was configured.
   *
   * @return the points, indexed from 0
   * @throws IllegalArgumentException if a stopword or stemming choice is null
   */
  static List<SweepPoint> enumerate(
      List<String> schemes,
      List<String> similarities,
      List<Boolean> stopwordChoices,
      List<Boolean> stemChoices,
      List<List<Double>> weightProfiles) {
    Set<String> distinctSchemes = new LinkedHashSet<>();
    for (String scheme : schemes) {
      distinctSchemes.add(WeightingScheme.find(scheme).map(WeightingScheme::tag).orElse(scheme));
    }
    Set<String> distinctSimilarities = new LinkedHashSet<>();
    for (String similarity : similarities) {
      distinctSimilarities.add(
          SimilarityKind.find(similarity).map(SimilarityKind::tag).orElse(similarity));
    }
    Set<Boolean> distinctStopwordChoices = distinctChoices("stopword removal", stopwordChoices);
    Set<Boolean> distinctStemChoices = distinctChoices("stemming", stemChoices);
    Set<List<Double>> distinctProfiles = new LinkedHashSet<>(weightProfiles);

    List<SweepPoint> points = new ArrayList<>();
    for (String scheme : distinctSchemes) {
      for (String similarity : distinctSimilarities) {
        for (boolean removeStopwords : distinctStopwordChoices) {
          for (boolean stem : distinctStemChoices) {
            for (List<Double> profile : distinctProfiles) {
              points.add(
                  new SweepPoint(
                      points.size(), scheme, similarity, removeStopwords, stem, profile));
            }
          }
        }
      }
    }
    return points;
  }

  private static Set<Boolean> distinctChoices(String dimension, List<Boolean> choices) {
    Set<Boolean> distinct = new LinkedHashSet<>(choices);
    if (distinct.contains(null)) {
      throw new IllegalArgumentException("Null " + dimension + " choice in " + choices);
    }
    return distinct;
  }

  private List<SweepRow> execute(List<SweepPoint> points, Corpus corpus, PreprocessingCache cache) {
    ExecutorService executor =
        Executors.newFixedThreadPool(properties.getThreads(), new WorkerThreadFactory());
    try {
      List<Future<SweepRow>> futures = new ArrayList<>(points.size());
      for (SweepPoint point : points) {
        futures.add(executor.submit(() -> evaluatePoint(point, corpus, cache)));
      }
      List<SweepRow> rows = new ArrayList<>(points.size());
      for (Future<SweepRow> future : futures) {
        rows.add(future.get());
      }
      return rows;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      progressTracker.cancel();
      throw new IllegalStateException("Sweep interrupted", e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Sweep worker died", e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  SweepRow evaluatePoint(SweepPoint point, Corpus corpus, PreprocessingCache cache) {
    if (progressTracker.isCancelled()) {
      progressTracker.recordSkipped();
      return SweepRow.skipped(point, "cancelled");
    }
    try {
      Configuration configuration = point.resolve();
      Optional<MetricRow> metrics =
          ConfigurationEvaluator.evaluate(
              configuration,
              corpus,
              cache.get(configuration.preprocessingKey()),
              properties.isSectionWeighting());
      if (metrics.isEmpty()) {
        log.warn("Configuration {} has no judged queries", point.describe());
        progressTracker.recordSkipped();
        return SweepRow.skipped(point, "no judged queries");
      }
      log.debug("Configuration {} evaluated", point.describe());
      progressTracker.recordCompleted();
      return SweepRow.ok(point, metrics.get());
    } catch (InvalidConfigurationException | InvalidProfileException e) {
      log.warn("Configuration {} is invalid: {}", point.describe(), e.getMessage());
      progressTracker.recordFailed();
      return SweepRow.failed(point, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Configuration {} failed", point.describe(), e);
      progressTracker.recordFailed();
      return SweepRow.failed(point, e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "sweep-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
