package com.radar.anomaly.alert;

import io.micrometer.core.instrument.MeterRegistry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.EncoderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes alerts as Avro binary records keyed by workspace.
 */
@Component
public class KafkaAlertDispatcher implements AlertDispatcher {

  private static final Logger log = LoggerFactory.getLogger(KafkaAlertDispatcher.class);

  private final KafkaTemplate<String, byte[]> kafka;
  private final String topic;
  private final Schema schema;
  private final GenericDatumWriter<GenericRecord> writer;
  private final MeterRegistry metrics;

  public KafkaAlertDispatcher(KafkaTemplate<String, byte[]> kafka,
                              @Value("${radar.alerts.topic:radar.anomaly-alerts}") String topic,
                              MeterRegistry metrics) {
    this.kafka = kafka;
    this.topic = topic;
    this.schema = loadSchema("/avro/anomaly_alert.avsc");
    this.writer = new GenericDatumWriter<>(schema);
    this.metrics = metrics;
  }

  private Schema loadSchema(String path) {
    try (InputStream in = Objects.requireNonNull(getClass().getResourceAsStream(path))) {
      return new Schema.Parser().parse(in);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load Avro schema: " + path, e);
    }
  }

  @Override
  public void dispatch(AlertEvent event) {
    try {
      kafka.send(topic, event.workspaceId(), encode(event)).whenComplete((result, ex) -> {
        if (ex != null) {
          metrics.counter("radar_alerts_failed_total", "type", event.type().wireName()).increment();
          log.warn("Alert delivery to '{}' failed type={} ws={}: {}", topic, event.type().wireName(),
              event.workspaceId(), ex.getMessage());
        }
      });
      metrics.counter("radar_alerts_emitted_total", "type", event.type().wireName()).increment();
      log.info("Alert emitted: type={} ws={} metric={} anomaly={} severity={}", event.type().wireName(),
          event.workspaceId(), event.metricType(), event.anomalyId(), event.severity().wireName());
    } catch (Exception ex) {
      metrics.counter("radar_alerts_failed_total", "type", event.type().wireName()).increment();
      log.warn("Alert publish failed (non-fatal) type={} ws={}: {}", event.type().wireName(),
          event.workspaceId(), ex.getMessage());
    }
  }

  GenericRecord toRecord(AlertEvent event) {
    GenericData.Record record = new GenericData.Record(schema);
    record.put("type", event.type().wireName());
    record.put("workspace_id", event.workspaceId());
    record.put("anomaly_id", event.anomalyId());
    record.put("metric_type", event.metricType());
    record.put("severity", event.severity().wireName());
    record.put("normalized_score", event.normalizedScore());
    record.put("channels", event.channels());
    record.put("timestamp", event.timestamp().toEpochMilli());
    return record;
  }

  byte[] encode(AlertEvent event) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
    writer.write(toRecord(event), encoder);
    encoder.flush();
    return out.toByteArray();
  }

  Schema schema() {
    return schema;
  }
}
