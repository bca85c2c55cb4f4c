package com.radar.anomaly.service;

import com.radar.anomaly.detect.IsolationForestDetector;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import com.radar.anomaly.rules.RuleParameters;
import com.radar.anomaly.scoring.AnomalyScorer;
import com.radar.anomaly.scoring.NormalizedScore;
import com.radar.anomaly.stream.ScoredDetection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Canned detections over workspace activity: credit usage spikes, hourly error patterns and
 * per-user daily behavior. Like {@link OnDemandDetectionService}, results go back to the caller
 * only.
 *
 * <p>Error patterns and user behavior score multivariate buckets with a random cut forest and
 * flag the top {@code contamination} share of buckets whose score reaches
 * {@link #MIN_FOREST_SCORE}. Fewer than {@link #MIN_BUCKETS} buckets yield no anomalies.
 */
@Service
public class WorkloadPatternService {

  private static final Logger log = LoggerFactory.getLogger(WorkloadPatternService.class);

  public static final String USAGE_METRIC = "credits_consumed";
  public static final double DEFAULT_SENSITIVITY = AnomalyScorer.DEFAULT_SENSITIVITY;
  public static final int DEFAULT_WINDOW_HOURS = 24;
  public static final int MAX_WINDOW_HOURS = 168;
  public static final int DEFAULT_USER_LOOKBACK_DAYS = 30;
  public static final int MIN_USER_LOOKBACK_DAYS = 7;
  public static final int MAX_USER_LOOKBACK_DAYS = 365;

  static final double ERROR_CONTAMINATION = 0.05;
  static final double USER_CONTAMINATION = 0.1;
  static final int MIN_BUCKETS = 10;
  static final double MIN_FOREST_SCORE = 1.0;

  private static final List<String> ERROR_FEATURES = List.of("error_rate", "failed_count", "avg_duration");
  private static final List<String> USER_FEATURES = List.of("executions", "avg_duration", "total_credits");

  private final ExecutionHistoryClient executions;
  private final OnDemandDetectionService onDemand;
  private final IsolationForestDetector forest;
  private final AnomalyScorer scorer;
  private final Clock clock;

  public WorkloadPatternService(ExecutionHistoryClient executions,
                                OnDemandDetectionService onDemand,
                                IsolationForestDetector forest,
                                AnomalyScorer scorer,
                                Clock clock) {
    this.executions = executions;
    this.onDemand = onDemand;
    this.forest = forest;
    this.scorer = scorer;
    this.clock = clock;
  }

  /** Z-score over credit consumption; the window is rounded down to whole days, at least one. */
  public List<WorkloadAnomaly> usageSpikes(String workspaceId, Double sensitivity, Integer windowHours) {
    requireWorkspace(workspaceId);
    double s = sensitivity == null ? DEFAULT_SENSITIVITY : sensitivity;
    if (s < 1.0 || s > 5.0) {
      throw new IllegalArgumentException("sensitivity must be between 1 and 5");
    }
    int hours = windowHours(windowHours);
    int lookbackDays = Math.max(1, hours / 24);

    OnDemandResult result = onDemand.detect(workspaceId,
        new OnDemandRequest(USAGE_METRIC, lookbackDays, DetectionMethod.ZSCORE, s, null));
    List<WorkloadAnomaly> out = new ArrayList<>(result.anomalies().size());
    for (ScoredDetection d : result.anomalies()) {
      Map<String, Object> context = new LinkedHashMap<>();
      context.put("value", d.value());
      context.putAll(d.expectedRange());
      context.put("lookback_days", lookbackDays);
      context.put("sensitivity", s);
      out.add(new WorkloadAnomaly(USAGE_METRIC, workspaceId, null, d.detectedAt(), d.rawScore(),
          d.normalizedScore(), d.severity(), d.method(), context));
    }
    log.info("Usage spike detection for {} over {} day(s): {} anomalies", workspaceId, lookbackDays, out.size());
    return out;
  }

  public List<WorkloadAnomaly> errorPatterns(String workspaceId, Integer windowHours) {
    requireWorkspace(workspaceId);
    int hours = windowHours(windowHours);
    Instant to = clock.instant();
    Instant from = to.minus(Duration.ofHours(hours));

    List<ExecutionBucket> buckets = fetch(workspaceId, () -> executions.hourly(workspaceId, from, to));
    List<WorkloadAnomaly> out = scoreBuckets(buckets, ERROR_FEATURES, ERROR_CONTAMINATION,
        b -> new double[] {b.errorRate(), b.failed(), b.avgDuration()},
        (b, score, features) -> {
          Map<String, Object> context = new LinkedHashMap<>();
          context.put("features", features);
          context.put("window_hours", hours);
          return anomaly("error_rate", workspaceId, null, b, score, context);
        });
    log.info("Error pattern detection for {} over {} hourly bucket(s): {} anomalies",
        workspaceId, buckets.size(), out.size());
    return out;
  }

  public List<WorkloadAnomaly> userBehavior(String workspaceId, String userId, Integer lookbackDays) {
    requireWorkspace(workspaceId);
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("user_id is required");
    }
    int days = lookbackDays == null ? DEFAULT_USER_LOOKBACK_DAYS : lookbackDays;
    if (days < MIN_USER_LOOKBACK_DAYS || days > MAX_USER_LOOKBACK_DAYS) {
      throw new IllegalArgumentException("lookback_days must be between " + MIN_USER_LOOKBACK_DAYS
          + " and " + MAX_USER_LOOKBACK_DAYS);
    }
    Instant to = clock.instant();
    Instant from = to.minus(Duration.ofDays(days));

    List<ExecutionBucket> buckets = fetch(workspaceId,
        () -> executions.dailyForUser(workspaceId, userId, from, to));
    List<WorkloadAnomaly> out = scoreBuckets(buckets, USER_FEATURES, USER_CONTAMINATION,
        b -> new double[] {b.executions(), b.avgDuration(), b.credits()},
        (b, score, features) -> {
          Map<String, Object> context = new LinkedHashMap<>();
          context.put("features", features);
          context.put("lookback_days", days);
          return anomaly("user_behavior", workspaceId, userId, b, score, context);
        });
    log.info("User behavior detection for {}/{} over {} daily bucket(s): {} anomalies",
        workspaceId, userId, buckets.size(), out.size());
    return out;
  }

  private interface AnomalyFactory {
    WorkloadAnomaly build(ExecutionBucket bucket, double score, Map<String, Object> features);
  }

  private List<WorkloadAnomaly> scoreBuckets(List<ExecutionBucket> buckets, List<String> names,
                                             double contamination, Function<ExecutionBucket, double[]> row,
                                             AnomalyFactory factory) {
    if (buckets.size() < MIN_BUCKETS) {
      return List.of();
    }
    double[][] rows = new double[buckets.size()][];
    for (int i = 0; i < rows.length; i++) {
      rows[i] = row.apply(buckets.get(i));
    }
    double[] scores = forest.scoreRows(rows, MIN_BUCKETS);
    double cutoff = cutoff(scores, contamination);

    List<WorkloadAnomaly> out = new ArrayList<>();
    for (int i = 0; i < scores.length; i++) {
      if (scores[i] < cutoff) continue;
      Map<String, Object> features = new LinkedHashMap<>();
      for (int j = 0; j < names.size(); j++) {
        if (!Double.isNaN(rows[i][j])) features.put(names.get(j), rows[i][j]);
      }
      out.add(factory.build(buckets.get(i), scores[i], features));
    }
    return out;
  }

  /** Score of the k-th highest bucket, k being the contamination share (at least one). */
  static double cutoff(double[] scores, double contamination) {
    int k = Math.max(1, (int) Math.floor(contamination * scores.length));
    double[] sorted = scores.clone();
    Arrays.sort(sorted);
    return Math.max(sorted[sorted.length - k], MIN_FOREST_SCORE);
  }

  private WorkloadAnomaly anomaly(String metricType, String workspaceId, String userId, ExecutionBucket bucket,
                                  double score, Map<String, Object> context) {
    NormalizedScore normalized = scorer.normalize(DetectionMethod.ISOLATION_FOREST, score,
        RuleParameters.of(Map.of()));
    Severity severity = normalized.severity();
    return new WorkloadAnomaly(metricType, workspaceId, userId, bucket.start(), score, normalized.score(),
        severity, DetectionMethod.ISOLATION_FOREST, context);
  }

  private static List<ExecutionBucket> fetch(String workspaceId, Supplier<List<ExecutionBucket>> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      throw new DataUnavailableException("execution history unavailable for " + workspaceId, e);
    }
  }

  private static int windowHours(Integer windowHours) {
    int hours = windowHours == null ? DEFAULT_WINDOW_HOURS : windowHours;
    if (hours < 1 || hours > MAX_WINDOW_HOURS) {
      throw new IllegalArgumentException("window_hours must be between 1 and " + MAX_WINDOW_HOURS);
    }
    return hours;
  }

  private static void requireWorkspace(String workspaceId) {
    if (workspaceId == null || workspaceId.isBlank()) {
      throw new IllegalArgumentException("workspace id must not be blank");
    }
  }
}
