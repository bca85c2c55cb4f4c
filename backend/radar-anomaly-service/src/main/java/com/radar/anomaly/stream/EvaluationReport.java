package com.radar.anomaly.stream;

import java.util.List;

public record EvaluationReport(List<ScoredDetection> detections, List<MethodWarning> warnings) {
  public EvaluationReport {
    detections = List.copyOf(detections);
    warnings = List.copyOf(warnings);
  }

  public boolean hasDetections() {
    return !detections.isEmpty();
  }
}
