package com.radar.api.model;

import java.util.List;
import java.util.Map;

public record SummaryResponse(
    String workspaceId,
    int days,
    long total,
    Map<String, Long> bySeverity,
    Map<String, Long> byMetricType,
    Map<String, Long> byMethod,
    Map<String, Long> byStatus,
    long falsePositives,
    List<AnomalyView> recent
) {}
