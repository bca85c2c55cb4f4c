package com.radar.anomaly.scoring;

import com.radar.anomaly.model.Severity;

public record NormalizedScore(double score, Severity severity) {}
