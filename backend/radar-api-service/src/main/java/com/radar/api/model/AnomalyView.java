package com.radar.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.radar.anomaly.model.AnomalyDetection;
import com.radar.anomaly.model.AnomalyStatus;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import java.time.Instant;
import java.util.Map;

public record AnomalyView(
    String id,
    String workspaceId,
    String metricType,
    DetectionMethod method,
    String ruleId,
    Instant detectedAt,
    Instant lastSeen,
    long occurrenceCount,
    double value,
    Map<String, Object> expectedRange,
    double rawScore,
    double normalizedScore,
    double confidence,
    Severity severity,
    AnomalyStatus status,
    Map<String, Object> context,
    String acknowledgedBy,
    Instant acknowledgedAt,
    String notes,
    @JsonProperty("is_false_positive") boolean isFalsePositive,
    String resolvedBy,
    Instant resolvedAt
) {
  public static AnomalyView from(AnomalyDetection a) {
    return new AnomalyView(a.getId(), a.getWorkspaceId(), a.getMetricType(), a.getMethod(), a.getRuleId(),
        a.getDetectedAt(), a.getLastSeen(), a.getOccurrenceCount(), a.getValue(), a.getExpectedRange(),
        a.getRawScore(), a.getNormalizedScore(), a.getConfidence(), a.getSeverity(), a.getStatus(),
        a.getContext(), a.getAcknowledgedBy(), a.getAcknowledgedAt(), a.getNotes(), a.isFalsePositive(),
        a.getResolvedBy(), a.getResolvedAt());
  }
}
