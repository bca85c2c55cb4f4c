package com.radar.anomaly.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record MetricEvent(
    String workspaceId,
    String metricType,
    double value,
    Instant timestamp,
    Map<String, String> tags
) {
  public MetricEvent {
    Objects.requireNonNull(workspaceId, "workspaceId");
    Objects.requireNonNull(metricType, "metricType");
    Objects.requireNonNull(timestamp, "timestamp");
    tags = tags == null ? Map.of() : Map.copyOf(tags);
  }

  public MetricKey key() {
    return new MetricKey(workspaceId, metricType);
  }

  public MetricPoint point() {
    return new MetricPoint(timestamp, value);
  }
}
