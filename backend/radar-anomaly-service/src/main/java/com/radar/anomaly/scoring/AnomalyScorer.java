package com.radar.anomaly.scoring;

import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import com.radar.anomaly.rules.RuleParameters;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps method-specific raw scores onto a common [0, 1] scale and buckets them into severities.
 * The curve is linear per method: {@code min(raw / (reference * multiplier), 1)} where the
 * reference is the rule's sensitivity or score threshold. Multipliers and cutoffs are configurable.
 */
@Component
public class AnomalyScorer {

  public static final double DEFAULT_SENSITIVITY = 2.5;
  public static final double DEFAULT_ISOLATION_THRESHOLD = 1.5;
  public static final double DEFAULT_AUTOENCODER_THRESHOLD = 3.0;

  private final double zscoreMultiplier;
  private final double isolationMultiplier;
  private final double autoencoderMultiplier;
  private final double mediumCutoff;
  private final double highCutoff;
  private final double criticalCutoff;

  public AnomalyScorer(@Value("${radar.scoring.zscore-multiplier:3.0}") double zscoreMultiplier,
                       @Value("${radar.scoring.isolation-multiplier:2.0}") double isolationMultiplier,
                       @Value("${radar.scoring.autoencoder-multiplier:3.0}") double autoencoderMultiplier,
                       @Value("${radar.scoring.medium-cutoff:0.3}") double mediumCutoff,
                       @Value("${radar.scoring.high-cutoff:0.6}") double highCutoff,
                       @Value("${radar.scoring.critical-cutoff:0.85}") double criticalCutoff) {
    if (!(mediumCutoff < highCutoff && highCutoff < criticalCutoff)) {
      throw new IllegalArgumentException("severity cutoffs must be increasing");
    }
    this.zscoreMultiplier = zscoreMultiplier;
    this.isolationMultiplier = isolationMultiplier;
    this.autoencoderMultiplier = autoencoderMultiplier;
    this.mediumCutoff = mediumCutoff;
    this.highCutoff = highCutoff;
    this.criticalCutoff = criticalCutoff;
  }

  public static AnomalyScorer withDefaults() {
    return new AnomalyScorer(3.0, 2.0, 3.0, 0.3, 0.6, 0.85);
  }

  public NormalizedScore normalize(DetectionMethod method, double raw, RuleParameters params) {
    double scaled = switch (method) {
      case ZSCORE -> raw / (sensitivity(params) * zscoreMultiplier);
      case THRESHOLD -> raw;
      case ISOLATION_FOREST -> raw / (scoreThreshold(method, params) * isolationMultiplier);
      case AUTOENCODER -> raw / (scoreThreshold(method, params) * autoencoderMultiplier);
    };
    double score = Math.max(0.0, Math.min(scaled, 1.0));
    return new NormalizedScore(score, severityOf(score));
  }

  public boolean isAnomalous(DetectionMethod method, double raw, RuleParameters params) {
    return switch (method) {
      case ZSCORE -> raw >= sensitivity(params);
      case THRESHOLD -> raw > 0.0;
      case ISOLATION_FOREST, AUTOENCODER -> raw >= scoreThreshold(method, params);
    };
  }

  public Severity severityOf(double normalized) {
    if (normalized < mediumCutoff) return Severity.LOW;
    if (normalized < highCutoff) return Severity.MEDIUM;
    if (normalized < criticalCutoff) return Severity.HIGH;
    return Severity.CRITICAL;
  }

  private static double sensitivity(RuleParameters params) {
    return params.getDouble(RuleParameters.SENSITIVITY, DEFAULT_SENSITIVITY);
  }

  private static double scoreThreshold(DetectionMethod method, RuleParameters params) {
    double fallback = method == DetectionMethod.AUTOENCODER
        ? DEFAULT_AUTOENCODER_THRESHOLD
        : DEFAULT_ISOLATION_THRESHOLD;
    return params.getDouble(RuleParameters.SCORE_THRESHOLD, fallback);
  }
}
