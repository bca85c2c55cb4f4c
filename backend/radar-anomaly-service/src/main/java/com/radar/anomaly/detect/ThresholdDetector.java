package com.radar.anomaly.detect;

import com.radar.anomaly.error.InvalidRuleConfigException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.rules.RuleParameters;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * Proportional breach of fixed bounds. Works without a baseline.
 */
@Component
public class ThresholdDetector implements Detector {

  @Override
  public DetectionMethod method() {
    return DetectionMethod.THRESHOLD;
  }

  /**
   * {@code max(0, (value - max) / max, (min - value) / min)}. A zero bound uses the absolute
   * breach and a negative bound is divided by its magnitude.
   */
  public static double breach(double value, OptionalDouble min, OptionalDouble max) {
    double score = 0.0;
    if (max.isPresent() && value > max.getAsDouble()) {
      score = Math.max(score, relative(value - max.getAsDouble(), max.getAsDouble()));
    }
    if (min.isPresent() && value < min.getAsDouble()) {
      score = Math.max(score, relative(min.getAsDouble() - value, min.getAsDouble()));
    }
    return score;
  }

  private static double relative(double excess, double bound) {
    return bound == 0.0 ? excess : excess / Math.abs(bound);
  }

  @Override
  public RawScore score(double value, DetectionContext context) {
    OptionalDouble min = context.parameters().optionalDouble(RuleParameters.MIN);
    OptionalDouble max = context.parameters().optionalDouble(RuleParameters.MAX);
    if (min.isEmpty() && max.isEmpty()) {
      throw new InvalidRuleConfigException("threshold rule has neither 'min' nor 'max'");
    }
    double score = breach(value, min, max);

    Map<String, Object> range = new LinkedHashMap<>();
    min.ifPresent(v -> range.put("lower", v));
    max.ifPresent(v -> range.put("upper", v));
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("breach", score);
    if (max.isPresent() && value > max.getAsDouble()) details.put("direction", "above");
    else if (min.isPresent() && value < min.getAsDouble()) details.put("direction", "below");
    return new RawScore(score, 1.0, range, details);
  }
}
