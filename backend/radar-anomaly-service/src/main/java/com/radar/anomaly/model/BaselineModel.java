package com.radar.anomaly.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
  name = "baseline_models",
  uniqueConstraints = {
    @UniqueConstraint(name = "uq_baseline_ws_metric", columnNames = {"workspace_id", "metric_type"})
  }
)
public class BaselineModel {
  @Id
  @Column(length = 36)
  private String id;

  @Column(name = "workspace_id", nullable = false) private String workspaceId;
  @Column(name = "metric_type", nullable = false, length = 100) private String metricType;
  @Column(nullable = false, length = 32) private String modelType;

  @Column(nullable = false) private double mean;
  @Column(nullable = false) private double variance;
  @Column(nullable = false) private double m2;
  @Column(nullable = false) private long sampleCount;
  private Double minValue;
  private Double maxValue;
  @Convert(converter = JsonMapConverter.class)
  @Column(length = 1000) private Map<String, Object> percentiles = new LinkedHashMap<>();

  private Instant trainingStart;
  private Instant trainingEnd;
  @Column(nullable = false) private Instant lastUpdated;
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16) private BaselineStatus status;
  @Column(nullable = false) private int consecutiveFailures;
  @Version private Long version;

  protected BaselineModel() {}

  public BaselineModel(String workspaceId, String metricType, String modelType) {
    this.id = UUID.randomUUID().toString();
    this.workspaceId = workspaceId;
    this.metricType = metricType;
    this.modelType = modelType;
    this.status = BaselineStatus.FRESH;
  }

  public String getId() { return id; }
  public String getWorkspaceId() { return workspaceId; }
  public String getMetricType() { return metricType; }
  public String getModelType() { return modelType; }
  public double getMean() { return mean; }
  public void setMean(double mean) { this.mean = mean; }
  public double getVariance() { return variance; }
  public void setVariance(double variance) { this.variance = variance; }
  public double getM2() { return m2; }
  public void setM2(double m2) { this.m2 = m2; }
  public long getSampleCount() { return sampleCount; }
  public void setSampleCount(long sampleCount) { this.sampleCount = sampleCount; }
  public Double getMinValue() { return minValue; }
  public void setMinValue(Double minValue) { this.minValue = minValue; }
  public Double getMaxValue() { return maxValue; }
  public void setMaxValue(Double maxValue) { this.maxValue = maxValue; }
  public Map<String, Object> getPercentiles() { return percentiles; }
  public void setPercentiles(Map<String, Object> percentiles) {
    this.percentiles = percentiles == null ? new LinkedHashMap<>() : new LinkedHashMap<>(percentiles);
  }
  public Instant getTrainingStart() { return trainingStart; }
  public void setTrainingStart(Instant trainingStart) { this.trainingStart = trainingStart; }
  public Instant getTrainingEnd() { return trainingEnd; }
  public void setTrainingEnd(Instant trainingEnd) { this.trainingEnd = trainingEnd; }
  public Instant getLastUpdated() { return lastUpdated; }
  public void setLastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; }
  public BaselineStatus getStatus() { return status; }
  public void setStatus(BaselineStatus status) { this.status = status; }
  public int getConsecutiveFailures() { return consecutiveFailures; }
  public void setConsecutiveFailures(int consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }
  public Long getVersion() { return version; }
}
