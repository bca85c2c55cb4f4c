package com.radar.anomaly.model;

import java.util.Objects;

public record MetricKey(String workspaceId, String metricType) {
  public MetricKey {
    Objects.requireNonNull(workspaceId, "workspaceId");
    Objects.requireNonNull(metricType, "metricType");
  }

  @Override
  public String toString() {
    return workspaceId + "/" + metricType;
  }
}
