package com.radar.anomaly.detect;

import java.util.Map;

/**
 * Method-specific score before normalization. {@code value} is never negative.
 */
public record RawScore(double value, double confidence, Map<String, Object> expectedRange,
                       Map<String, Object> details) {
  public RawScore {
    if (Double.isNaN(value) || value < 0) {
      throw new IllegalArgumentException("raw score must be a non-negative number: " + value);
    }
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    expectedRange = expectedRange == null ? Map.of() : Map.copyOf(expectedRange);
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
