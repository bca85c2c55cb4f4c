package com.radar.anomaly.baseline;

import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.MetricPoint;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/** Reads {@code metric_samples}, the table the ingestion pipeline writes raw values to. */
@Component
public class JdbcMetricHistoryClient implements MetricHistoryClient {

  private static final String QUERY =
      "SELECT recorded_at, metric_value FROM ("
          + " SELECT recorded_at, metric_value FROM metric_samples"
          + " WHERE workspace_id = ? AND metric_type = ? AND recorded_at >= ? AND recorded_at < ?"
          + " ORDER BY recorded_at DESC LIMIT ?"
          + ") recent ORDER BY recorded_at ASC";

  private final JdbcTemplate jdbc;
  private final int maxPoints;

  public JdbcMetricHistoryClient(JdbcTemplate jdbc,
                                 @Value("${radar.history.max-points:50000}") int maxPoints) {
    this.jdbc = jdbc;
    this.maxPoints = maxPoints;
  }

  @Override
  public List<MetricPoint> fetch(MetricKey key, Instant from, Instant to) {
    return jdbc.query(QUERY,
        (rs, i) -> new MetricPoint(rs.getTimestamp("recorded_at").toInstant(), rs.getDouble("metric_value")),
        key.workspaceId(), key.metricType(), Timestamp.from(from), Timestamp.from(to), maxPoints);
  }
}
