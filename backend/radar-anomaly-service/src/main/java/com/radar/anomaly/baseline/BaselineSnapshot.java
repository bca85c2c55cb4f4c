package com.radar.anomaly.baseline;

import com.radar.anomaly.model.BaselineModel;
import com.radar.anomaly.model.BaselineStatus;
import com.radar.anomaly.model.MetricKey;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable copy of a baseline handed to detectors. Never mutated after publication.
 */
public record BaselineSnapshot(
    MetricKey key,
    String modelType,
    double mean,
    double variance,
    long sampleCount,
    Map<String, Double> percentiles,
    Double min,
    Double max,
    Instant trainingStart,
    Instant trainingEnd,
    Instant lastUpdated,
    BaselineStatus status,
    int consecutiveFailures
) {
  public static final String MODEL_TYPE = "statistical";

  public BaselineSnapshot {
    percentiles = percentiles == null ? Map.of() : Map.copyOf(percentiles);
    variance = Math.max(0.0, variance);
  }

  public double std() {
    return Math.sqrt(variance);
  }

  public boolean degraded() {
    return status == BaselineStatus.DEGRADED;
  }

  /** Ad-hoc baseline from a window of values, used when no trained model exists yet. */
  public static BaselineSnapshot fromValues(MetricKey key, double[] values, Instant start, Instant end) {
    BaselineStatistics.Summary s = BaselineStatistics.summarize(values);
    return new BaselineSnapshot(key, "window", s.mean(), s.variance(), s.count(), s.percentiles(),
        s.min(), s.max(), start, end, end, BaselineStatus.FRESH, 0);
  }

  static BaselineSnapshot fromEntity(BaselineModel m) {
    Map<String, Double> pct = new LinkedHashMap<>();
    m.getPercentiles().forEach((k, v) -> {
      if (v instanceof Number n) pct.put(k, n.doubleValue());
    });
    return new BaselineSnapshot(new MetricKey(m.getWorkspaceId(), m.getMetricType()), m.getModelType(),
        m.getMean(), m.getVariance(), m.getSampleCount(), pct, m.getMinValue(), m.getMaxValue(),
        m.getTrainingStart(), m.getTrainingEnd(), m.getLastUpdated(), m.getStatus(),
        m.getConsecutiveFailures());
  }
}
