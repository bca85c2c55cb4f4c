package com.radar.anomaly.service;

import com.radar.anomaly.stream.MethodWarning;
import com.radar.anomaly.stream.ScoredDetection;
import java.time.Instant;
import java.util.List;

public record OnDemandResult(
    String workspaceId,
    String metricType,
    Instant from,
    Instant to,
    int pointsEvaluated,
    List<ScoredDetection> anomalies,
    List<MethodWarning> warnings
) {}
