package com.radar.anomaly.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
  name = "anomaly_rules",
  indexes = {
    @Index(name = "ix_anomaly_rules_ws_metric", columnList = "workspace_id,metric_type")
  }
)
public class AnomalyRule {
  @Id
  @Column(length = 36)
  private String id;

  // null = global default for every workspace
  @Column(name = "workspace_id")
  private String workspaceId;
  @Column(name = "metric_type", nullable = false, length = 100) private String metricType;
  @Column(nullable = false) private String ruleName;
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32) private DetectionMethod method;
  @Convert(converter = JsonMapConverter.class)
  @Column(length = 4000) private Map<String, Object> parameters = new LinkedHashMap<>();
  @Column(nullable = false) private boolean active;
  // set only while active; unique, so at most one active rule per (workspace, metric, method)
  @Column(name = "active_key", unique = true, length = 200) private String activeKey;
  @Column(nullable = false) private boolean autoAlert;
  @Convert(converter = StringListConverter.class)
  @Column(length = 1000) private List<String> alertChannels = new ArrayList<>();
  private String createdBy;
  @Column(nullable = false) private Instant createdAt;
  @Column(nullable = false) private Instant updatedAt;

  protected AnomalyRule() {}

  public static AnomalyRule create(String workspaceId, String metricType, String ruleName, DetectionMethod method,
                                   String createdBy, Instant now) {
    AnomalyRule r = new AnomalyRule();
    r.id = UUID.randomUUID().toString();
    r.workspaceId = workspaceId;
    r.metricType = metricType;
    r.ruleName = ruleName;
    r.method = method;
    r.setActive(true);
    r.createdBy = createdBy;
    r.createdAt = now;
    r.updatedAt = now;
    return r;
  }

  public String getId() { return id; }
  public String getWorkspaceId() { return workspaceId; }
  public String getMetricType() { return metricType; }
  public String getRuleName() { return ruleName; }
  public void setRuleName(String ruleName) { this.ruleName = ruleName; }
  public DetectionMethod getMethod() { return method; }
  public Map<String, Object> getParameters() { return parameters; }
  public void setParameters(Map<String, Object> parameters) {
    this.parameters = parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters);
  }
  public boolean isActive() { return active; }
  public void setActive(boolean active) {
    this.active = active;
    this.activeKey = active ? activeKey(workspaceId, metricType, method) : null;
  }
  public String getActiveKey() { return activeKey; }

  public static String activeKey(String workspaceId, String metricType, DetectionMethod method) {
    return (workspaceId == null ? "*" : workspaceId) + "|" + metricType + "|" + method.name();
  }
  public boolean isAutoAlert() { return autoAlert; }
  public void setAutoAlert(boolean autoAlert) { this.autoAlert = autoAlert; }
  public List<String> getAlertChannels() { return alertChannels; }
  public void setAlertChannels(List<String> alertChannels) {
    this.alertChannels = alertChannels == null ? new ArrayList<>() : new ArrayList<>(alertChannels);
  }
  public String getCreatedBy() { return createdBy; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
