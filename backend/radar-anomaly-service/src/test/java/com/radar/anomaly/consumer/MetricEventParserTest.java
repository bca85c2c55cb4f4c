package com.radar.anomaly.consumer;

import static org.assertj.core.api.Assertions.assertThat;

import com.radar.anomaly.model.MetricEvent;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MetricEventParserTest {

  private final MetricEventParser parser = new MetricEventParser();

  @Test
  void parsesIsoTimestampAndTags() {
    MetricEvent e = parser.parse("""
        {"workspace_id":"ws-1","metric_type":"runtime_seconds","value":42.5,
         "timestamp":"2024-03-01T12:00:00Z","tags":{"pipeline":"nightly","retries":3}}
        """).orElseThrow();

    assertThat(e.workspaceId()).isEqualTo("ws-1");
    assertThat(e.metricType()).isEqualTo("runtime_seconds");
    assertThat(e.value()).isEqualTo(42.5);
    assertThat(e.timestamp()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    assertThat(e.tags()).containsEntry("pipeline", "nightly").containsEntry("retries", "3");
  }

  @Test
  void acceptsEpochMillis() {
    MetricEvent e = parser.parse(
        "{\"workspace_id\":\"ws-1\",\"metric_type\":\"executions\",\"value\":3,\"timestamp\":1709294400000}")
        .orElseThrow();

    assertThat(e.timestamp()).isEqualTo(Instant.ofEpochMilli(1709294400000L));
    assertThat(e.tags()).isEmpty();
  }

  @Test
  void rejectsIncompleteOrMalformedEvents() {
    assertThat(parser.parse(null)).isEmpty();
    assertThat(parser.parse("  ")).isEmpty();
    assertThat(parser.parse("not json")).isEmpty();
    assertThat(parser.parse("{\"metric_type\":\"executions\",\"value\":1,\"timestamp\":1}")).isEmpty();
    assertThat(parser.parse("{\"workspace_id\":\"ws\",\"metric_type\":\"executions\",\"value\":\"1\","
        + "\"timestamp\":1}")).isEmpty();
    assertThat(parser.parse("{\"workspace_id\":\"ws\",\"metric_type\":\"executions\",\"value\":1,"
        + "\"timestamp\":\"yesterday\"}")).isEmpty();
    assertThat(parser.parse("{\"workspace_id\":\" \",\"metric_type\":\"executions\",\"value\":1,"
        + "\"timestamp\":1}")).isEmpty();
  }
}
