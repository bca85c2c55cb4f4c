package com.radar.anomaly.rules;

import com.radar.anomaly.error.InvalidRuleConfigException;
import com.radar.anomaly.model.Severity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only view over a rule's JSON parameters with typed accessors.
 */
public final class RuleParameters {

  public static final String SENSITIVITY = "sensitivity";
  public static final String MIN = "min";
  public static final String MAX = "max";
  public static final String MIN_SAMPLES = "min_samples";
  public static final String SCORE_THRESHOLD = "score_threshold";
  public static final String NUM_TREES = "num_trees";
  public static final String SAMPLE_SIZE = "sample_size";
  public static final String MIN_POINTS = "min_points";
  public static final String WINDOW_SIZE = "window_size";
  public static final String LATENT_DIM = "latent_dim";
  public static final String ALERT_MIN_SEVERITY = "alert_min_severity";

  public static final RuleParameters EMPTY = new RuleParameters(Map.of());

  private final Map<String, Object> values;

  private RuleParameters(Map<String, Object> values) {
    this.values = values;
  }

  public static RuleParameters of(Map<String, Object> values) {
    if (values == null || values.isEmpty()) return EMPTY;
    return new RuleParameters(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
  }

  public RuleParameters with(String key, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.put(key, value);
    return new RuleParameters(Collections.unmodifiableMap(copy));
  }

  public boolean has(String key) {
    return values.get(key) != null;
  }

  public OptionalDouble optionalDouble(String key) {
    Object raw = values.get(key);
    if (raw == null) return OptionalDouble.empty();
    if (raw instanceof Number n) return OptionalDouble.of(n.doubleValue());
    if (raw instanceof String s && !s.isBlank()) {
      try {
        return OptionalDouble.of(Double.parseDouble(s.trim()));
      } catch (NumberFormatException e) {
        throw new InvalidRuleConfigException("parameter '" + key + "' is not a number: " + s);
      }
    }
    throw new InvalidRuleConfigException("parameter '" + key + "' is not a number: " + raw);
  }

  public double getDouble(String key, double defaultValue) {
    OptionalDouble v = optionalDouble(key);
    return v.isPresent() ? v.getAsDouble() : defaultValue;
  }

  public int getInt(String key, int defaultValue) {
    OptionalDouble v = optionalDouble(key);
    if (v.isEmpty()) return defaultValue;
    double d = v.getAsDouble();
    if (d != Math.rint(d)) {
      throw new InvalidRuleConfigException("parameter '" + key + "' must be an integer: " + d);
    }
    if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
      throw new InvalidRuleConfigException("parameter '" + key + "' is out of range: " + d);
    }
    return (int) d;
  }

  public Optional<String> getString(String key) {
    Object raw = values.get(key);
    return raw == null ? Optional.empty() : Optional.of(raw.toString());
  }

  public Severity alertMinSeverity() {
    return getString(ALERT_MIN_SEVERITY).map(Severity::fromWire).orElse(Severity.LOW);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RuleParameters other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
