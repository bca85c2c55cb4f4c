package com.radar.anomaly.service;

import java.time.Instant;

/** Aggregated executions in one time bucket. Averages with no underlying values are {@code NaN}. */
public record ExecutionBucket(
    Instant start,
    long executions,
    long failed,
    double avgDuration,
    double credits
) {
  public double errorRate() {
    return executions == 0 ? Double.NaN : failed / (double) executions;
  }
}
