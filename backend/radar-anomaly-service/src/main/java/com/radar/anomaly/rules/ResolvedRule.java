package com.radar.anomaly.rules;

import com.radar.anomaly.model.AnomalyRule;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, validated rule as the detection path sees it.
 */
public record ResolvedRule(
    String id,
    String workspaceId,
    String metricType,
    String name,
    DetectionMethod method,
    RuleParameters parameters,
    boolean autoAlert,
    List<String> alertChannels
) {
  public ResolvedRule {
    Objects.requireNonNull(metricType, "metricType");
    Objects.requireNonNull(method, "method");
    parameters = parameters == null ? RuleParameters.EMPTY : parameters;
    alertChannels = alertChannels == null ? List.of() : List.copyOf(alertChannels);
  }

  public static ResolvedRule from(AnomalyRule row) {
    return new ResolvedRule(row.getId(), row.getWorkspaceId(), row.getMetricType(), row.getRuleName(),
        row.getMethod(), RuleParameters.of(row.getParameters()), row.isAutoAlert(), row.getAlertChannels());
  }

  /** Unsaved rule for on-demand runs; never alerts. */
  public static ResolvedRule adHoc(String workspaceId, String metricType, DetectionMethod method,
                                   RuleParameters parameters) {
    return new ResolvedRule(null, workspaceId, metricType, "ad-hoc " + method.wireName(), method,
        parameters, false, List.of());
  }

  public boolean isGlobal() {
    return workspaceId == null;
  }

  public Severity alertMinSeverity() {
    return parameters.alertMinSeverity();
  }
}
