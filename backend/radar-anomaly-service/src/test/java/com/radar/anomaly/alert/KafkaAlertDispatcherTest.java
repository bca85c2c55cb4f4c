package com.radar.anomaly.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.radar.anomaly.model.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.DecoderFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaAlertDispatcherTest {

  private KafkaTemplate<String, byte[]> kafka;
  private SimpleMeterRegistry metrics;
  private KafkaAlertDispatcher dispatcher;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    kafka = mock(KafkaTemplate.class);
    metrics = new SimpleMeterRegistry();
    dispatcher = new KafkaAlertDispatcher(kafka, "alerts-test", metrics);
  }

  private static AlertEvent event() {
    return new AlertEvent(AlertType.ANOMALY_DETECTED, "ws-9", "a-1", "credits_consumed", Severity.HIGH, 0.81,
        List.of("slack", "email"), Instant.parse("2024-06-01T08:00:00Z"));
  }

  @Test
  void publishesAvroRecordKeyedByWorkspace() throws Exception {
    when(kafka.send(anyString(), anyString(), any(byte[].class)))
        .thenReturn(CompletableFuture.<SendResult<String, byte[]>>completedFuture(null));

    dispatcher.dispatch(event());

    ArgumentCaptor<byte[]> payload = ArgumentCaptor.forClass(byte[].class);
    verify(kafka).send(eq("alerts-test"), eq("ws-9"), payload.capture());
    GenericRecord decoded = new GenericDatumReader<GenericRecord>(dispatcher.schema())
        .read(null, DecoderFactory.get().binaryDecoder(payload.getValue(), null));
    assertThat(decoded.get("type").toString()).isEqualTo("anomaly_detected");
    assertThat(decoded.get("anomaly_id").toString()).isEqualTo("a-1");
    assertThat(decoded.get("severity").toString()).isEqualTo("high");
    assertThat((Double) decoded.get("normalized_score")).isEqualTo(0.81);
    assertThat((Long) decoded.get("timestamp")).isEqualTo(Instant.parse("2024-06-01T08:00:00Z").toEpochMilli());
    assertThat(((List<?>) decoded.get("channels")).stream().map(Object::toString)).containsExactly("slack", "email");
    assertThat(metrics.counter("radar_alerts_emitted_total", "type", "anomaly_detected").count()).isEqualTo(1.0);
  }

  @Test
  void internalAlertsCarryNoAnomalyId() {
    AlertEvent degraded = new AlertEvent(AlertType.BASELINE_DEGRADED, "ws-9", null, "credits_consumed",
        Severity.MEDIUM, 0, List.of(), Instant.parse("2024-06-01T08:00:00Z"));

    GenericRecord record = dispatcher.toRecord(degraded);

    assertThat(record.get("anomaly_id")).isNull();
    assertThat(record.get("type")).isEqualTo("baseline_degraded");
  }

  @Test
  void brokerFailureIsCountedNotThrown() {
    when(kafka.send(anyString(), anyString(), any(byte[].class)))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

    dispatcher.dispatch(event());

    assertThat(metrics.counter("radar_alerts_failed_total", "type", "anomaly_detected").count()).isEqualTo(1.0);
  }

  @Test
  void synchronousSendErrorIsSwallowedAndCounted() {
    when(kafka.send(anyString(), anyString(), any(byte[].class))).thenThrow(new RuntimeException("metadata timeout"));

    dispatcher.dispatch(event());

    assertThat(metrics.counter("radar_alerts_failed_total", "type", "anomaly_detected").count()).isEqualTo(1.0);
    assertThat(metrics.counter("radar_alerts_emitted_total", "type", "anomaly_detected").count()).isZero();
  }
}
