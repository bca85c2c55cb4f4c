package com.radar.api.model;

import java.util.Map;

public record DetectRequest(
    String metricType,
    Integer lookbackDays,
    String method,
    Double sensitivity,
    Map<String, Object> parameters
) {}
