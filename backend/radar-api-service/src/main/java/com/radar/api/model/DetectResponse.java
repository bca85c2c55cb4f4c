package com.radar.api.model;

import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import com.radar.anomaly.service.OnDemandResult;
import com.radar.anomaly.stream.MethodWarning;
import com.radar.anomaly.stream.ScoredDetection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record DetectResponse(
    String workspaceId,
    String metricType,
    Instant from,
    Instant to,
    int pointsEvaluated,
    List<DetectedPoint> anomalies,
    List<Warning> warnings
) {
  public record DetectedPoint(
      Instant timestamp,
      double value,
      DetectionMethod method,
      String ruleId,
      double rawScore,
      double normalizedScore,
      double confidence,
      Severity severity,
      Map<String, Object> expectedRange
  ) {
    static DetectedPoint from(ScoredDetection d) {
      return new DetectedPoint(d.detectedAt(), d.value(), d.method(), d.ruleId(), d.rawScore(),
          d.normalizedScore(), d.confidence(), d.severity(), d.expectedRange());
    }
  }

  public record Warning(String ruleId, DetectionMethod method, String reason) {
    static Warning from(MethodWarning w) {
      return new Warning(w.ruleId(), w.method(), w.reason());
    }
  }

  public static DetectResponse from(OnDemandResult r) {
    return new DetectResponse(r.workspaceId(), r.metricType(), r.from(), r.to(), r.pointsEvaluated(),
        r.anomalies().stream().map(DetectedPoint::from).toList(),
        r.warnings().stream().map(Warning::from).toList());
  }
}
