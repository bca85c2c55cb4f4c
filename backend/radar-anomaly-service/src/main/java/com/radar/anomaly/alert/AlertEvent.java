package com.radar.anomaly.alert;

import com.radar.anomaly.model.Severity;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Payload handed to the alert dispatcher. {@code anomalyId} is null for internal alerts.
 */
public record AlertEvent(
    AlertType type,
    String workspaceId,
    String anomalyId,
    String metricType,
    Severity severity,
    double normalizedScore,
    List<String> channels,
    Instant timestamp
) {
  public AlertEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(workspaceId, "workspaceId");
    Objects.requireNonNull(metricType, "metricType");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(timestamp, "timestamp");
    channels = channels == null ? List.of() : List.copyOf(channels);
  }
}
