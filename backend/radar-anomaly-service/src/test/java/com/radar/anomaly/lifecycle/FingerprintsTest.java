package com.radar.anomaly.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;

import com.radar.anomaly.model.DetectionMethod;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class FingerprintsTest {

  private static final Duration WINDOW = Duration.ofMinutes(15);

  @Test
  void sameBucketSameFingerprint() {
    Instant a = Instant.parse("2024-05-01T10:00:00Z");
    Instant b = Instant.parse("2024-05-01T10:14:59Z");
    assertThat(Fingerprints.of("ws", "error_rate", DetectionMethod.ZSCORE, a, WINDOW))
        .isEqualTo(Fingerprints.of("ws", "error_rate", DetectionMethod.ZSCORE, b, WINDOW))
        .hasSize(64)
        .matches("[0-9a-f]{64}");
  }

  @Test
  void nextBucketDiffers() {
    Instant a = Instant.parse("2024-05-01T10:00:00Z");
    Instant b = Instant.parse("2024-05-01T10:20:00Z");
    assertThat(Fingerprints.of("ws", "error_rate", DetectionMethod.ZSCORE, a, WINDOW))
        .isNotEqualTo(Fingerprints.of("ws", "error_rate", DetectionMethod.ZSCORE, b, WINDOW));
  }

  @Test
  void methodAndWorkspaceArePartOfTheKey() {
    Instant t = Instant.parse("2024-05-01T10:00:00Z");
    String base = Fingerprints.of("ws", "error_rate", DetectionMethod.ZSCORE, t, WINDOW);
    assertThat(Fingerprints.of("ws", "error_rate", DetectionMethod.THRESHOLD, t, WINDOW)).isNotEqualTo(base);
    assertThat(Fingerprints.of("ws2", "error_rate", DetectionMethod.ZSCORE, t, WINDOW)).isNotEqualTo(base);
  }

  @Test
  void bucketIsFloorOfEpochSeconds() {
    assertThat(Fingerprints.bucket(Instant.ofEpochSecond(1799), WINDOW)).isEqualTo(1);
    assertThat(Fingerprints.bucket(Instant.ofEpochSecond(1800), WINDOW)).isEqualTo(2);
    assertThat(Fingerprints.bucket(Instant.ofEpochSecond(-1), WINDOW)).isEqualTo(-1);
  }
}
