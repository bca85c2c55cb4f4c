package com.radar.anomaly.service;

import com.radar.anomaly.model.DetectionMethod;
import java.util.Map;

/**
 * On-demand detection over a lookback window. {@code method} and {@code sensitivity} are optional;
 * when a method is given an unsaved rule is built from it instead of the configured rules.
 */
public record OnDemandRequest(
    String metricType,
    Integer lookbackDays,
    DetectionMethod method,
    Double sensitivity,
    Map<String, Object> parameters
) {}
