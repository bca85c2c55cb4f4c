package com.radar.api.model;

import com.radar.anomaly.model.AnomalyRule;
import com.radar.anomaly.model.DetectionMethod;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record RuleView(
    String id,
    String workspaceId,
    String ruleName,
    String metricType,
    DetectionMethod method,
    Map<String, Object> parameters,
    boolean active,
    boolean autoAlert,
    List<String> alertChannels,
    String createdBy,
    Instant createdAt,
    Instant updatedAt
) {
  public static RuleView from(AnomalyRule r) {
    return new RuleView(r.getId(), r.getWorkspaceId(), r.getRuleName(), r.getMetricType(), r.getMethod(),
        r.getParameters(), r.isActive(), r.isAutoAlert(), r.getAlertChannels(), r.getCreatedBy(),
        r.getCreatedAt(), r.getUpdatedAt());
  }
}
