package com.radar.anomaly.stream;

import static org.assertj.core.api.Assertions.assertThat;

import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.MetricPoint;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RecentPointsBufferTest {

  private static final MetricKey KEY = new MetricKey("ws-1", "executions");
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  void keepsOnlyTheNewestPoints() {
    RecentPointsBuffer buffer = new RecentPointsBuffer(3);
    for (int i = 0; i < 5; i++) {
      buffer.append(KEY, new MetricPoint(T0.plusSeconds(i), i));
    }

    assertThat(buffer.snapshot(KEY)).extracting(MetricPoint::value).containsExactly(2.0, 3.0, 4.0);
  }

  @Test
  void snapshotIsOrderedByTimestamp() {
    RecentPointsBuffer buffer = new RecentPointsBuffer(10);
    buffer.append(KEY, new MetricPoint(T0.plusSeconds(20), 2));
    buffer.append(KEY, new MetricPoint(T0.plusSeconds(10), 1));

    assertThat(buffer.snapshot(KEY)).extracting(MetricPoint::value).containsExactly(1.0, 2.0);
  }

  @Test
  void unknownKeyHasEmptyWindow() {
    RecentPointsBuffer buffer = new RecentPointsBuffer(10);

    assertThat(buffer.snapshot(KEY)).isEmpty();
    assertThat(buffer.keys()).isEmpty();
  }

  @Test
  void windowMarksPointsArrivedAfterTheMark() {
    RecentPointsBuffer buffer = new RecentPointsBuffer(10);
    buffer.append(KEY, new MetricPoint(T0.plusSeconds(20), 2));
    long mark = buffer.window(KEY, 0).lastArrival();
    MetricPoint late = new MetricPoint(T0.plusSeconds(10), 1);
    buffer.append(KEY, late);

    RecentPointsBuffer.Window window = buffer.window(KEY, mark);

    assertThat(window.points()).extracting(MetricPoint::value).containsExactly(1.0, 2.0);
    assertThat(window.arrivedAfterMark()).containsExactly(late);
    assertThat(window.lastArrival()).isGreaterThan(mark);
  }
}
