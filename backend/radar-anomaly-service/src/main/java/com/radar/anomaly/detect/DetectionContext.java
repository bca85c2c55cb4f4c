package com.radar.anomaly.detect;

import com.radar.anomaly.baseline.BaselineSnapshot;
import com.radar.anomaly.model.MetricPoint;
import com.radar.anomaly.rules.RuleParameters;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only inputs for one detector call.
 *
 * @param baseline snapshot for the key, or null on cold start
 * @param window recent points, oldest first; empty for realtime calls
 */
public record DetectionContext(BaselineSnapshot baseline, RuleParameters parameters,
                               List<MetricPoint> window, Instant timestamp) {
  public DetectionContext {
    parameters = parameters == null ? RuleParameters.EMPTY : parameters;
    window = window == null ? List.of() : List.copyOf(window);
  }

  public static DetectionContext realtime(BaselineSnapshot baseline, RuleParameters parameters, Instant timestamp) {
    return new DetectionContext(baseline, parameters, List.of(), timestamp);
  }

  public Optional<BaselineSnapshot> findBaseline() {
    return Optional.ofNullable(baseline);
  }
}
