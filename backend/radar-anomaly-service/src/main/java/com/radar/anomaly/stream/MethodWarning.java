package com.radar.anomaly.stream;

import com.radar.anomaly.model.DetectionMethod;

/** A method that was skipped or failed for one evaluation. */
public record MethodWarning(String ruleId, DetectionMethod method, String reason) {}
