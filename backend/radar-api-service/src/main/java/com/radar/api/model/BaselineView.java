package com.radar.api.model;

import com.radar.anomaly.baseline.BaselineSnapshot;
import com.radar.anomaly.model.BaselineStatus;
import java.time.Instant;
import java.util.Map;

public record BaselineView(
    String workspaceId,
    String metricType,
    String modelType,
    double mean,
    double std,
    double variance,
    long sampleCount,
    Double min,
    Double max,
    Map<String, Double> percentiles,
    Instant trainingStart,
    Instant trainingEnd,
    Instant lastUpdated,
    BaselineStatus status,
    int consecutiveFailures
) {
  public static BaselineView from(BaselineSnapshot s) {
    return new BaselineView(s.key().workspaceId(), s.key().metricType(), s.modelType(), s.mean(), s.std(),
        s.variance(), s.sampleCount(), s.min(), s.max(), s.percentiles(), s.trainingStart(), s.trainingEnd(),
        s.lastUpdated(), s.status(), s.consecutiveFailures());
  }
}
