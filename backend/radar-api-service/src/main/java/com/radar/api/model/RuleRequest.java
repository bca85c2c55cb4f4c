package com.radar.api.model;

import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.rules.RuleDraft;
import java.util.List;
import java.util.Map;

public record RuleRequest(
    String ruleName,
    String metricType,
    String method,
    Map<String, Object> parameters,
    Boolean active,
    Boolean autoAlert,
    List<String> alertChannels,
    Boolean global
) {
  public RuleDraft toDraft() {
    DetectionMethod m = method == null ? null : DetectionMethod.fromWire(method);
    return new RuleDraft(ruleName, metricType, m, parameters, active, autoAlert, alertChannels,
        Boolean.TRUE.equals(global));
  }
}
