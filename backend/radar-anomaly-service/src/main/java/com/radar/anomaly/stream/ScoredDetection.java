package com.radar.anomaly.stream;

import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.Severity;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An anomalous result ready for the lifecycle manager, carrying the alert policy of the rule(s)
 * that produced it.
 */
public record ScoredDetection(
    String fingerprint,
    MetricKey key,
    DetectionMethod method,
    String ruleId,
    Instant detectedAt,
    double value,
    double rawScore,
    double confidence,
    double normalizedScore,
    Severity severity,
    Map<String, Object> expectedRange,
    Map<String, Object> context,
    boolean autoAlert,
    List<String> alertChannels,
    Severity alertMinSeverity
) {
  public ScoredDetection {
    expectedRange = expectedRange == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(expectedRange));
    context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    alertChannels = alertChannels == null ? List.of() : List.copyOf(alertChannels);
    alertMinSeverity = alertMinSeverity == null ? Severity.LOW : alertMinSeverity;
  }

  /**
   * Combines two results for the same fingerprint: scores come from the higher normalized score,
   * alerting is the union of both policies.
   */
  public ScoredDetection mergeWith(ScoredDetection other) {
    ScoredDetection peak = other.normalizedScore > normalizedScore ? other : this;
    Set<String> channels = new LinkedHashSet<>(alertChannels);
    channels.addAll(other.alertChannels);
    Severity minSeverity;
    if (autoAlert && other.autoAlert) {
      minSeverity = alertMinSeverity.compareTo(other.alertMinSeverity) <= 0 ? alertMinSeverity : other.alertMinSeverity;
    } else if (other.autoAlert) {
      minSeverity = other.alertMinSeverity;
    } else {
      minSeverity = alertMinSeverity;
    }
    return new ScoredDetection(peak.fingerprint, peak.key, peak.method, peak.ruleId, peak.detectedAt, peak.value,
        peak.rawScore, peak.confidence, peak.normalizedScore, peak.severity, peak.expectedRange, peak.context,
        autoAlert || other.autoAlert, List.copyOf(channels), minSeverity);
  }
}
