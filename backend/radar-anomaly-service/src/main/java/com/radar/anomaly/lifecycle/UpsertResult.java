package com.radar.anomaly.lifecycle;

import com.radar.anomaly.model.AnomalyDetection;

public record UpsertResult(AnomalyDetection detection, boolean created, boolean severityRaised) {}
