package com.radar.anomaly.rules;

import com.radar.anomaly.model.DetectionMethod;
import java.util.List;
import java.util.Map;

/**
 * Create or update request for a rule. Null fields keep the stored value on update.
 */
public record RuleDraft(
    String ruleName,
    String metricType,
    DetectionMethod method,
    Map<String, Object> parameters,
    Boolean active,
    Boolean autoAlert,
    List<String> alertChannels,
    boolean global
) {}
