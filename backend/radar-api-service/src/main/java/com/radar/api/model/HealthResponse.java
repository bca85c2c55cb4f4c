package com.radar.api.model;

import java.time.Instant;

public record HealthResponse(
    String status,
    long activeRules,
    long baselineModels,
    long degradedBaselines,
    long detectionsLast24h,
    Instant timestamp
) {}
