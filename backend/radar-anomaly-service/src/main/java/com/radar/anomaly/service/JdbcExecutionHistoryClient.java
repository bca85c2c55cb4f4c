package com.radar.anomaly.service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/** Reads {@code execution_logs}, written by the workflow runner for every execution. */
@Component
public class JdbcExecutionHistoryClient implements ExecutionHistoryClient {

  private static final String HOURLY =
      "SELECT DATE_TRUNC('hour', started_at) AS bucket, COUNT(*) AS executions,"
          + " SUM(CASE WHEN status = 'failed' THEN 1 ELSE 0 END) AS failed,"
          + " AVG(duration) AS avg_duration, SUM(credits_used) AS credits"
          + " FROM execution_logs"
          + " WHERE workspace_id = ? AND started_at >= ? AND started_at <= ?"
          + " GROUP BY DATE_TRUNC('hour', started_at) ORDER BY bucket";

  private static final String DAILY_FOR_USER =
      "SELECT DATE_TRUNC('day', started_at) AS bucket, COUNT(*) AS executions,"
          + " SUM(CASE WHEN status = 'failed' THEN 1 ELSE 0 END) AS failed,"
          + " AVG(duration) AS avg_duration, SUM(credits_used) AS credits"
          + " FROM execution_logs"
          + " WHERE workspace_id = ? AND user_id = ? AND started_at >= ? AND started_at <= ?"
          + " GROUP BY DATE_TRUNC('day', started_at) ORDER BY bucket";

  private final JdbcTemplate jdbc;

  public JdbcExecutionHistoryClient(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public List<ExecutionBucket> hourly(String workspaceId, Instant from, Instant to) {
    return jdbc.query(HOURLY, (rs, i) -> bucket(rs), workspaceId, Timestamp.from(from), Timestamp.from(to));
  }

  @Override
  public List<ExecutionBucket> dailyForUser(String workspaceId, String userId, Instant from, Instant to) {
    return jdbc.query(DAILY_FOR_USER, (rs, i) -> bucket(rs),
        workspaceId, userId, Timestamp.from(from), Timestamp.from(to));
  }

  private static ExecutionBucket bucket(ResultSet rs) throws SQLException {
    return new ExecutionBucket(rs.getTimestamp("bucket").toInstant(), rs.getLong("executions"),
        rs.getLong("failed"), nullableDouble(rs, "avg_duration"), nullableDouble(rs, "credits"));
  }

  private static double nullableDouble(ResultSet rs, String column) throws SQLException {
    double v = rs.getDouble(column);
    return rs.wasNull() ? Double.NaN : v;
  }
}
