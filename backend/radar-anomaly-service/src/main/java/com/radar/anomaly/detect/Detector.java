package com.radar.anomaly.detect;

import com.radar.anomaly.model.DetectionMethod;

/**
 * Scoring contract shared by every detection method. Implementations hold no mutable state
 * across calls; all inputs come through the {@link DetectionContext}.
 */
public interface Detector {

  DetectionMethod method();

  /**
   * @throws com.radar.anomaly.error.DataUnavailableException when the method cannot score
   *     without a baseline or more history
   */
  RawScore score(double value, DetectionContext context);
}
