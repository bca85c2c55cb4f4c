package com.radar.anomaly.service;

import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import java.time.Instant;
import java.util.Map;

/** One anomalous bucket found by a workload pattern detection. {@code userId} is set for user behavior only. */
public record WorkloadAnomaly(
    String metricType,
    String workspaceId,
    String userId,
    Instant detectedAt,
    double anomalyScore,
    double normalizedScore,
    Severity severity,
    DetectionMethod detectionMethod,
    Map<String, Object> context
) {}
