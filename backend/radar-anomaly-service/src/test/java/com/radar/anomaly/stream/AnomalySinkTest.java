package com.radar.anomaly.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.radar.anomaly.MutableClock;
import com.radar.anomaly.alert.AlertDispatcher;
import com.radar.anomaly.alert.AlertEvent;
import com.radar.anomaly.alert.AlertType;
import com.radar.anomaly.error.PersistenceUnavailableException;
import com.radar.anomaly.lifecycle.AnomalyLifecycleManager;
import com.radar.anomaly.lifecycle.UpsertResult;
import com.radar.anomaly.model.AnomalyDetection;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

class AnomalySinkTest {

  private static final Instant NOW = Instant.parse("2024-04-02T09:07:00Z");

  private AnomalyLifecycleManager lifecycle;
  private AlertDispatcher alerts;
  private SimpleMeterRegistry metrics;
  private AnomalySink sink;

  @BeforeEach
  void setUp() {
    lifecycle = mock(AnomalyLifecycleManager.class);
    alerts = mock(AlertDispatcher.class);
    metrics = new SimpleMeterRegistry();
    sink = new AnomalySink(lifecycle, alerts, new MutableClock(NOW), 3, 1, metrics);
  }

  private static ScoredDetection detection(Severity severity, boolean autoAlert, Severity minSeverity) {
    return new ScoredDetection("fp-1", new MetricKey("ws-1", "error_rate"), DetectionMethod.ZSCORE, "r1", NOW,
        0.4, 6.0, 1.0, 0.8, severity, Map.of(), Map.of(), autoAlert, List.of("pagerduty"), minSeverity);
  }

  private static AnomalyDetection stored(Severity severity) {
    AnomalyDetection a = AnomalyDetection.open("fp-1", "ws-1", "error_rate", DetectionMethod.ZSCORE, "r1", NOW, NOW);
    a.recordPeak(0.4, 6.0, 0.8, 1.0, severity, Map.of(), Map.of());
    return a;
  }

  @Test
  void newAnomalyAlertsOnce() {
    when(lifecycle.upsert(any())).thenReturn(new UpsertResult(stored(Severity.HIGH), true, false));

    ProcessingStage stage = sink.record(detection(Severity.HIGH, true, Severity.LOW));

    assertThat(stage).isEqualTo(ProcessingStage.ALERTED);
    ArgumentCaptor<AlertEvent> alert = ArgumentCaptor.forClass(AlertEvent.class);
    verify(alerts).dispatch(alert.capture());
    assertThat(alert.getValue().type()).isEqualTo(AlertType.ANOMALY_DETECTED);
    assertThat(alert.getValue().channels()).containsExactly("pagerduty");
    assertThat(alert.getValue().timestamp()).isEqualTo(NOW);
  }

  @Test
  void dedupedOccurrenceDoesNotAlert() {
    when(lifecycle.upsert(any())).thenReturn(new UpsertResult(stored(Severity.HIGH), false, false));

    assertThat(sink.record(detection(Severity.HIGH, true, Severity.LOW))).isEqualTo(ProcessingStage.SUPPRESSED);
    verify(alerts, never()).dispatch(any());
  }

  @Test
  void severityIncreaseAlertsAsEscalation() {
    when(lifecycle.upsert(any())).thenReturn(new UpsertResult(stored(Severity.CRITICAL), false, true));

    sink.record(detection(Severity.CRITICAL, true, Severity.LOW));

    ArgumentCaptor<AlertEvent> alert = ArgumentCaptor.forClass(AlertEvent.class);
    verify(alerts).dispatch(alert.capture());
    assertThat(alert.getValue().type()).isEqualTo(AlertType.ANOMALY_ESCALATED);
    assertThat(alert.getValue().severity()).isEqualTo(Severity.CRITICAL);
  }

  @Test
  void belowPolicySeverityIsSuppressed() {
    when(lifecycle.upsert(any())).thenReturn(new UpsertResult(stored(Severity.MEDIUM), true, false));

    assertThat(sink.record(detection(Severity.MEDIUM, true, Severity.HIGH))).isEqualTo(ProcessingStage.SUPPRESSED);
    verify(alerts, never()).dispatch(any());
    assertThat(metrics.counter("radar_alerts_suppressed_total").count()).isEqualTo(1.0);
  }

  @Test
  void rulesWithoutAutoAlertNeverAlert() {
    when(lifecycle.upsert(any())).thenReturn(new UpsertResult(stored(Severity.CRITICAL), true, false));

    assertThat(sink.record(detection(Severity.CRITICAL, false, Severity.LOW))).isEqualTo(ProcessingStage.SUPPRESSED);
    verify(alerts, never()).dispatch(any());
  }

  @Test
  void transientStoreFailureIsRetried() {
    when(lifecycle.upsert(any()))
        .thenThrow(new QueryTimeoutException("slow"))
        .thenReturn(new UpsertResult(stored(Severity.HIGH), true, false));

    assertThat(sink.record(detection(Severity.HIGH, true, Severity.LOW))).isEqualTo(ProcessingStage.ALERTED);
    verify(lifecycle, times(2)).upsert(any());
  }

  @Test
  void exhaustedRetriesRaisePersistenceUnavailable() {
    when(lifecycle.upsert(any())).thenThrow(new QueryTimeoutException("down"));

    assertThatThrownBy(() -> sink.record(detection(Severity.HIGH, true, Severity.LOW)))
        .isInstanceOf(PersistenceUnavailableException.class);
    verify(lifecycle, times(3)).upsert(any());
    verify(alerts, never()).dispatch(any());
  }

  @Test
  void rejectedRowIsNotRetried() {
    when(lifecycle.upsert(any())).thenThrow(new DataIntegrityViolationException("value too long"));

    assertThatThrownBy(() -> sink.record(detection(Severity.HIGH, true, Severity.LOW)))
        .isInstanceOf(PersistenceUnavailableException.class)
        .hasCauseInstanceOf(DataIntegrityViolationException.class);
    verify(lifecycle, times(1)).upsert(any());
  }
}
