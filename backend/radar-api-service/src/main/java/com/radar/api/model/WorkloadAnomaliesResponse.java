package com.radar.api.model;

import com.radar.anomaly.service.WorkloadAnomaly;
import java.util.List;

public record WorkloadAnomaliesResponse(List<WorkloadAnomaly> anomalies, int count) {

  public static WorkloadAnomaliesResponse of(List<WorkloadAnomaly> anomalies) {
    return new WorkloadAnomaliesResponse(anomalies, anomalies.size());
  }
}
