package com.radar.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Closed set of detection methods. Adding a method means adding a constant here and a
 * {@link com.radar.anomaly.detect.Detector} for it.
 */
public enum DetectionMethod {
  ZSCORE("zscore", true, false),
  THRESHOLD("threshold", false, false),
  ISOLATION_FOREST("isolation_forest", false, true),
  AUTOENCODER("autoencoder", false, true);

  private final String wireName;
  private final boolean needsBaseline;
  private final boolean batch;

  DetectionMethod(String wireName, boolean needsBaseline, boolean batch) {
    this.wireName = wireName;
    this.needsBaseline = needsBaseline;
    this.batch = batch;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Scores against the baseline model and is skipped on cold start. */
  public boolean needsBaseline() {
    return needsBaseline;
  }

  /** Scores a window of recent points on its own cadence instead of per event. */
  public boolean isBatch() {
    return batch;
  }

  @JsonCreator
  public static DetectionMethod fromWire(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("detection method must not be blank");
    }
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (DetectionMethod m : values()) {
      if (m.wireName.equals(v) || m.name().equalsIgnoreCase(v)) return m;
    }
    // older rule payloads used "lstm" for the sequence model
    if (v.equals("lstm") || v.equals("sequence")) return AUTOENCODER;
    throw new IllegalArgumentException("unknown detection method: " + value);
  }
}
