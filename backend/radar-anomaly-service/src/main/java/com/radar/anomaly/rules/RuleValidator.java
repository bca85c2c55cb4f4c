package com.radar.anomaly.rules;

import static com.radar.anomaly.rules.RuleParameters.*;

import com.radar.anomaly.error.InvalidRuleConfigException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class RuleValidator {

  public static final Set<String> SUPPORTED_METRICS =
      Set.of("runtime_seconds", "credits_consumed", "executions", "error_rate", "latency_ms");

  public static void requireSupportedMetric(String metricType) {
    if (metricType == null || !SUPPORTED_METRICS.contains(metricType)) {
      throw new InvalidRuleConfigException("unsupported metric_type: " + metricType
          + " (expected one of " + SUPPORTED_METRICS + ")");
    }
  }

  /** Checks a fully merged rule. Throws {@link InvalidRuleConfigException} on the first problem. */
  public void validate(String ruleName, String metricType, DetectionMethod method,
                       RuleParameters params, List<String> alertChannels) {
    if (ruleName == null || ruleName.isBlank()) {
      throw new InvalidRuleConfigException("rule_name must not be blank");
    }
    requireSupportedMetric(metricType);
    if (method == null) {
      throw new InvalidRuleConfigException("method is required");
    }
    switch (method) {
      case ZSCORE -> {
        OptionalDouble s = params.optionalDouble(SENSITIVITY);
        if (s.isPresent() && (s.getAsDouble() < 1.0 || s.getAsDouble() > 5.0)) {
          throw new InvalidRuleConfigException("sensitivity must be within [1, 5]: " + s.getAsDouble());
        }
        positiveInt(params, MIN_SAMPLES);
      }
      case THRESHOLD -> {
        OptionalDouble min = params.optionalDouble(MIN);
        OptionalDouble max = params.optionalDouble(MAX);
        if (min.isEmpty() && max.isEmpty()) {
          throw new InvalidRuleConfigException("threshold rule needs 'min' or 'max'");
        }
        if (min.isPresent() && max.isPresent() && min.getAsDouble() > max.getAsDouble()) {
          throw new InvalidRuleConfigException("threshold 'min' must not exceed 'max'");
        }
      }
      case ISOLATION_FOREST -> {
        positiveInt(params, NUM_TREES);
        positiveInt(params, SAMPLE_SIZE);
        positiveInt(params, MIN_POINTS);
        positive(params, SCORE_THRESHOLD);
      }
      case AUTOENCODER -> {
        int window = positiveInt(params, WINDOW_SIZE);
        int latent = positiveInt(params, LATENT_DIM);
        if (params.has(WINDOW_SIZE) && window < 2) {
          throw new InvalidRuleConfigException("window_size must be at least 2");
        }
        if (params.has(WINDOW_SIZE) && params.has(LATENT_DIM) && latent >= window) {
          throw new InvalidRuleConfigException("latent_dim must be smaller than window_size");
        }
        positive(params, SCORE_THRESHOLD);
      }
    }
    if (params.has(ALERT_MIN_SEVERITY)) {
      try {
        Severity.fromWire(params.getString(ALERT_MIN_SEVERITY).orElseThrow());
      } catch (IllegalArgumentException e) {
        throw new InvalidRuleConfigException(e.getMessage());
      }
    }
    if (alertChannels != null) {
      for (String channel : alertChannels) {
        if (channel == null || channel.isBlank() || channel.contains(",")) {
          throw new InvalidRuleConfigException("invalid alert channel: '" + channel + "'");
        }
      }
    }
  }

  private static int positiveInt(RuleParameters params, String key) {
    int v = params.getInt(key, 1);
    if (v <= 0) throw new InvalidRuleConfigException(key + " must be a positive integer: " + v);
    return v;
  }

  private static void positive(RuleParameters params, String key) {
    double v = params.getDouble(key, 1.0);
    if (!(v > 0)) throw new InvalidRuleConfigException(key + " must be positive: " + v);
  }
}
