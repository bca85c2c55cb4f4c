package com.radar.anomaly.service;

import java.time.Instant;
import java.util.List;

/** Read access to per-execution logs, aggregated into time buckets in ascending order. */
public interface ExecutionHistoryClient {

  List<ExecutionBucket> hourly(String workspaceId, Instant from, Instant to);

  List<ExecutionBucket> dailyForUser(String workspaceId, String userId, Instant from, Instant to);
}
