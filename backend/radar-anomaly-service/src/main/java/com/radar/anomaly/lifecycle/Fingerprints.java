package com.radar.anomaly.lifecycle;

import com.radar.anomaly.model.DetectionMethod;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Dedup key: SHA-256 hex of {@code workspace|metric|method|bucket}, where bucket is the epoch
 * second of detection divided by the debounce window. Pure function of its inputs.
 */
public final class Fingerprints {

  private Fingerprints() {}

  public static long bucket(Instant detectedAt, Duration debounce) {
    long window = debounce.toSeconds();
    if (window <= 0) throw new IllegalArgumentException("debounce window must be at least one second");
    return Math.floorDiv(detectedAt.getEpochSecond(), window);
  }

  public static String of(String workspaceId, String metricType, DetectionMethod method,
                          Instant detectedAt, Duration debounce) {
    String material = workspaceId + "|" + metricType + "|" + method.wireName() + "|" + bucket(detectedAt, debounce);
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
