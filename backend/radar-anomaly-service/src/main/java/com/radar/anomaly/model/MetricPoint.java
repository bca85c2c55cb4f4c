package com.radar.anomaly.model;

import java.time.Instant;

public record MetricPoint(Instant timestamp, double value) {}
