package com.radar.anomaly.baseline;

import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.MetricPoint;
import java.time.Instant;
import java.util.List;

/**
 * Bounded read of historical metric values, oldest first.
 */
public interface MetricHistoryClient {

  List<MetricPoint> fetch(MetricKey key, Instant from, Instant to);
}
