package com.radar.anomaly.detect;

import com.radar.anomaly.baseline.BaselineSnapshot;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.rules.RuleParameters;
import com.radar.anomaly.scoring.AnomalyScorer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Distance from the baseline mean in standard deviations. Sensitivity is left to the scorer.
 */
@Component
public class ZScoreDetector implements Detector {

  /** Score for any deviation from a constant baseline. */
  public static final double ZERO_VARIANCE_SCORE = 1e6;

  private final int defaultMinSamples;
  private final int fullConfidenceSamples;

  public ZScoreDetector(@Value("${radar.detect.zscore.min-samples:10}") int defaultMinSamples,
                        @Value("${radar.detect.zscore.full-confidence-samples:30}") int fullConfidenceSamples) {
    this.defaultMinSamples = defaultMinSamples;
    this.fullConfidenceSamples = fullConfidenceSamples;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.ZSCORE;
  }

  public static double zScore(double value, double mean, double std) {
    if (std > 0) return Math.abs(value - mean) / std;
    return value == mean ? 0.0 : ZERO_VARIANCE_SCORE;
  }

  @Override
  public RawScore score(double value, DetectionContext context) {
    BaselineSnapshot baseline = context.findBaseline()
        .orElseThrow(() -> new DataUnavailableException("zscore needs a baseline (cold start)"));
    RuleParameters params = context.parameters();
    int minSamples = params.getInt(RuleParameters.MIN_SAMPLES, defaultMinSamples);
    if (baseline.sampleCount() < minSamples) {
      throw new DataUnavailableException("zscore needs " + minSamples + " samples, baseline has "
          + baseline.sampleCount());
    }
    double mean = baseline.mean();
    double std = baseline.std();
    double z = zScore(value, mean, std);

    double confidence = Math.min(1.0, baseline.sampleCount() / (double) fullConfidenceSamples);
    if (baseline.degraded()) confidence /= 2;

    double sensitivity = params.getDouble(RuleParameters.SENSITIVITY, AnomalyScorer.DEFAULT_SENSITIVITY);
    Map<String, Object> range = new LinkedHashMap<>();
    range.put("lower", mean - sensitivity * std);
    range.put("upper", mean + sensitivity * std);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("z_score", z);
    details.put("direction", value >= mean ? "above" : "below");
    details.put("baseline_mean", mean);
    details.put("baseline_std", std);
    details.put("sample_count", baseline.sampleCount());
    details.put("baseline_status", baseline.status().wireName());
    return new RawScore(z, confidence, range, details);
  }
}
