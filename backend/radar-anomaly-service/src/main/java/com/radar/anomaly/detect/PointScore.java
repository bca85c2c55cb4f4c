package com.radar.anomaly.detect;

import com.radar.anomaly.model.MetricPoint;

public record PointScore(MetricPoint point, RawScore score) {}
