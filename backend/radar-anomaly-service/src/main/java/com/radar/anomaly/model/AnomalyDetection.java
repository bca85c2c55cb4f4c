package com.radar.anomaly.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One incident: every detection sharing a fingerprint is folded into a single row.
 */
@Entity
@Table(
  name = "anomaly_detections",
  indexes = {
    @Index(name = "ix_anomaly_detections_ws_detected_at", columnList = "workspace_id,detected_at DESC"),
    @Index(name = "ix_anomaly_detections_metric_type", columnList = "metric_type"),
    @Index(name = "ix_anomaly_detections_status", columnList = "status")
  }
)
public class AnomalyDetection {
  public static final int MAX_NOTES_LENGTH = 1000;

  @Id
  @Column(length = 36)
  private String id;

  @Column(nullable = false, unique = true, length = 64) private String fingerprint;
  @Column(name = "workspace_id", nullable = false) private String workspaceId;
  @Column(name = "metric_type", nullable = false, length = 100) private String metricType;
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32) private DetectionMethod method;
  private String ruleId;

  @Column(name = "detected_at", nullable = false) private Instant detectedAt;
  @Column(nullable = false) private Instant lastSeen;
  @Column(nullable = false) private long occurrenceCount;

  @Column(name = "observed_value", nullable = false) private double value;
  @Convert(converter = JsonMapConverter.class)
  @Column(length = 2000) private Map<String, Object> expectedRange = new LinkedHashMap<>();
  @Column(nullable = false) private double rawScore;
  @Column(nullable = false) private double normalizedScore;
  @Column(nullable = false) private double confidence;
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16) private Severity severity;
  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16) private AnomalyStatus status;
  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "text") private Map<String, Object> context = new LinkedHashMap<>();

  private String acknowledgedBy;
  private Instant acknowledgedAt;
  @Column(length = MAX_NOTES_LENGTH) private String notes;
  @Column(nullable = false) private boolean falsePositive;
  private String resolvedBy;
  private Instant resolvedAt;
  @Column(nullable = false) private Instant createdAt;

  protected AnomalyDetection() {}

  public static AnomalyDetection open(String fingerprint, String workspaceId, String metricType,
                                      DetectionMethod method, String ruleId, Instant detectedAt, Instant now) {
    AnomalyDetection a = new AnomalyDetection();
    a.id = UUID.randomUUID().toString();
    a.fingerprint = fingerprint;
    a.workspaceId = workspaceId;
    a.metricType = metricType;
    a.method = method;
    a.ruleId = ruleId;
    a.detectedAt = detectedAt;
    a.lastSeen = detectedAt;
    a.occurrenceCount = 1;
    a.status = AnomalyStatus.NEW;
    a.createdAt = now;
    return a;
  }

  /** Writes the scores of the peak occurrence. */
  public void recordPeak(double value, double rawScore, double normalizedScore, double confidence,
                         Severity severity, Map<String, Object> expectedRange, Map<String, Object> context) {
    this.value = value;
    this.rawScore = rawScore;
    this.normalizedScore = normalizedScore;
    this.confidence = confidence;
    this.severity = severity;
    this.expectedRange = expectedRange == null ? new LinkedHashMap<>() : new LinkedHashMap<>(expectedRange);
    this.context = context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context);
  }

  public void recordOccurrence(Instant seenAt) {
    occurrenceCount++;
    if (seenAt.isAfter(lastSeen)) lastSeen = seenAt;
  }

  public void acknowledge(String actor, String notes, Instant at) {
    this.status = AnomalyStatus.ACKNOWLEDGED;
    this.acknowledgedBy = actor;
    this.acknowledgedAt = at;
    if (notes != null) this.notes = notes;
  }

  public void investigate(String actor, String notes, Instant at) {
    if (acknowledgedAt == null) {
      this.acknowledgedBy = actor;
      this.acknowledgedAt = at;
    }
    this.status = AnomalyStatus.INVESTIGATING;
    if (notes != null) this.notes = notes;
  }

  public void close(AnomalyStatus closedStatus, String actor, String notes, boolean falsePositive, Instant at) {
    this.status = closedStatus;
    this.resolvedBy = actor;
    this.resolvedAt = at;
    this.notes = notes;
    this.falsePositive = falsePositive;
  }

  public String getId() { return id; }
  public String getFingerprint() { return fingerprint; }
  public String getWorkspaceId() { return workspaceId; }
  public String getMetricType() { return metricType; }
  public DetectionMethod getMethod() { return method; }
  public String getRuleId() { return ruleId; }
  public Instant getDetectedAt() { return detectedAt; }
  public Instant getLastSeen() { return lastSeen; }
  public long getOccurrenceCount() { return occurrenceCount; }
  public double getValue() { return value; }
  public Map<String, Object> getExpectedRange() { return expectedRange; }
  public double getRawScore() { return rawScore; }
  public double getNormalizedScore() { return normalizedScore; }
  public double getConfidence() { return confidence; }
  public Severity getSeverity() { return severity; }
  public AnomalyStatus getStatus() { return status; }
  public Map<String, Object> getContext() { return context; }
  public String getAcknowledgedBy() { return acknowledgedBy; }
  public Instant getAcknowledgedAt() { return acknowledgedAt; }
  public String getNotes() { return notes; }
  public boolean isFalsePositive() { return falsePositive; }
  public String getResolvedBy() { return resolvedBy; }
  public Instant getResolvedAt() { return resolvedAt; }
  public Instant getCreatedAt() { return createdAt; }
}
