package com.radar.anomaly.repo;

import static org.assertj.core.api.Assertions.assertThat;

import com.radar.anomaly.model.AnomalyDetection;
import com.radar.anomaly.model.AnomalyStatus;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class AnomalyDetectionRepositoryTest {

  private static final Instant NOW = Instant.parse("2024-05-20T12:00:00Z");
  private static final Instant SINCE = NOW.minus(Duration.ofDays(7));

  @Autowired
  private AnomalyDetectionRepository repo;

  private int seq;

  private AnomalyDetection row(String ws, String metric, DetectionMethod method, Severity severity,
                               Instant at, boolean falsePositive) {
    AnomalyDetection a = AnomalyDetection.open("fp-" + (seq++), ws, metric, method, null, at, at);
    a.recordPeak(1.0, 4.0, 0.5, 0.9, severity, Map.of(), Map.of());
    if (falsePositive) {
      a.close(AnomalyStatus.RESOLVED, "alice", "noise", true, at);
    }
    return repo.save(a);
  }

  @BeforeEach
  void seed() {
    row("ws-1", "latency_ms", DetectionMethod.ZSCORE, Severity.HIGH, NOW.minus(Duration.ofHours(1)), false);
    row("ws-1", "latency_ms", DetectionMethod.THRESHOLD, Severity.HIGH, NOW.minus(Duration.ofHours(2)), true);
    row("ws-1", "error_rate", DetectionMethod.ZSCORE, Severity.LOW, NOW.minus(Duration.ofDays(1)), false);
    row("ws-1", "error_rate", DetectionMethod.ZSCORE, Severity.CRITICAL, NOW.minus(Duration.ofDays(30)), false);
    row("ws-2", "latency_ms", DetectionMethod.ZSCORE, Severity.HIGH, NOW.minus(Duration.ofHours(1)), false);
  }

  private static Map<Object, Long> asMap(List<Object[]> rows) {
    Map<Object, Long> out = new HashMap<>();
    for (Object[] r : rows) {
      out.put(r[0], ((Number) r[1]).longValue());
    }
    return out;
  }

  @Test
  void groupedCountsStayInsideWorkspaceAndWindow() {
    assertThat(repo.countByWorkspaceIdAndDetectedAtGreaterThanEqual("ws-1", SINCE)).isEqualTo(3);
    assertThat(repo.countByWorkspaceIdAndDetectedAtGreaterThanEqualAndFalsePositiveTrue("ws-1", SINCE))
        .isEqualTo(1);
    assertThat(asMap(repo.countBySeverity("ws-1", SINCE)))
        .containsEntry(Severity.HIGH, 2L)
        .containsEntry(Severity.LOW, 1L)
        .doesNotContainKey(Severity.CRITICAL);
    assertThat(asMap(repo.countByMetricType("ws-1", SINCE)))
        .containsEntry("latency_ms", 2L)
        .containsEntry("error_rate", 1L);
    assertThat(asMap(repo.countByMethod("ws-1", SINCE)))
        .containsEntry(DetectionMethod.ZSCORE, 2L)
        .containsEntry(DetectionMethod.THRESHOLD, 1L);
    assertThat(asMap(repo.countByStatus("ws-1", SINCE)))
        .containsEntry(AnomalyStatus.NEW, 2L)
        .containsEntry(AnomalyStatus.RESOLVED, 1L);
  }

  @Test
  void recentRowsAreNewestFirst() {
    List<AnomalyDetection> recent =
        repo.findTop10ByWorkspaceIdAndDetectedAtGreaterThanEqualOrderByDetectedAtDesc("ws-1", SINCE);

    assertThat(recent).extracting(AnomalyDetection::getDetectedAt)
        .containsExactly(NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofHours(2)),
            NOW.minus(Duration.ofDays(1)));
  }
}
