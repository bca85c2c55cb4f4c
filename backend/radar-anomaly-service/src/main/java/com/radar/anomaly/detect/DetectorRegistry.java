package com.radar.anomaly.detect;

import com.radar.anomaly.model.DetectionMethod;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class DetectorRegistry {

  private final Map<DetectionMethod, Detector> detectors = new EnumMap<>(DetectionMethod.class);

  public DetectorRegistry(List<Detector> all) {
    for (Detector d : all) {
      Detector previous = detectors.put(d.method(), d);
      if (previous != null) {
        throw new IllegalStateException("two detectors registered for " + d.method().wireName());
      }
    }
    for (DetectionMethod m : DetectionMethod.values()) {
      if (!detectors.containsKey(m)) {
        throw new IllegalStateException("no detector registered for " + m.wireName());
      }
      if (m.isBatch() != (detectors.get(m) instanceof BatchDetector)) {
        throw new IllegalStateException("detector for " + m.wireName() + " does not match its batch flag");
      }
    }
  }

  public Detector get(DetectionMethod method) {
    return detectors.get(method);
  }

  public BatchDetector batch(DetectionMethod method) {
    if (!(detectors.get(method) instanceof BatchDetector batch)) {
      throw new IllegalArgumentException(method.wireName() + " is not a batch method");
    }
    return batch;
  }
}
