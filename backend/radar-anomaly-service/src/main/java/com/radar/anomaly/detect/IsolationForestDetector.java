package com.radar.anomaly.detect;

import com.amazon.randomcutforest.RandomCutForest;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricPoint;
import com.radar.anomaly.rules.RuleParameters;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Multivariate outlier score over {@code (value, rate_of_change, hour_of_day)} using a random cut
 * forest streamed over the window in time order. Each point after warm-up is scored before the
 * forest is updated with it; warm-up points are scored once the whole window has been seen.
 * Features are standardized per window.
 */
@Component
public class IsolationForestDetector implements BatchDetector {

  static final int DEFAULT_NUM_TREES = 50;
  static final int DEFAULT_SAMPLE_SIZE = 256;
  static final int DEFAULT_MIN_POINTS = 32;

  private final long randomSeed;

  public IsolationForestDetector(@Value("${radar.detect.isolation.random-seed:42}") long randomSeed) {
    this.randomSeed = randomSeed;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.ISOLATION_FOREST;
  }

  @Override
  public List<PointScore> scoreWindow(DetectionContext context) {
    RuleParameters params = context.parameters();
    int minPoints = params.getInt(RuleParameters.MIN_POINTS, DEFAULT_MIN_POINTS);
    int numTrees = params.getInt(RuleParameters.NUM_TREES, DEFAULT_NUM_TREES);
    int sampleSize = params.getInt(RuleParameters.SAMPLE_SIZE, DEFAULT_SAMPLE_SIZE);

    List<MetricPoint> points = new ArrayList<>(context.window());
    points.sort(Comparator.comparing(MetricPoint::timestamp));
    int n = points.size();
    if (n < Math.max(minPoints, 2)) {
      throw new DataUnavailableException("isolation_forest needs " + minPoints + " points, window has " + n);
    }

    int warmup = Math.min(Math.min(minPoints, sampleSize), n);
    double[] scores = forestScores(standardize(features(points)), numTrees, sampleSize, warmup);

    double confidence = Math.min(1.0, n / (double) Math.max(minPoints * 2, 1));
    List<PointScore> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("forest_score", scores[i]);
      details.put("window_points", n);
      details.put("num_trees", numTrees);
      details.put("warmup", i < warmup);
      out.add(new PointScore(points.get(i), new RawScore(scores[i], confidence, Map.of(), details)));
    }
    return out;
  }

  /**
   * Scores arbitrary feature rows with the default forest shape. Rows are standardized and
   * missing values are filled from the nearest earlier row, then the nearest later one.
   */
  public double[] scoreRows(double[][] rows, int minPoints) {
    double[][] filled = fillGaps(rows);
    int warmup = Math.min(Math.min(minPoints, DEFAULT_SAMPLE_SIZE), filled.length);
    return forestScores(standardize(filled), DEFAULT_NUM_TREES, DEFAULT_SAMPLE_SIZE, warmup);
  }

  private double[] forestScores(double[][] features, int numTrees, int sampleSize, int warmup) {
    int n = features.length;
    RandomCutForest forest = RandomCutForest.builder()
        .dimensions(features[0].length)
        .numberOfTrees(numTrees)
        .sampleSize(sampleSize)
        .outputAfter(Math.max(1, warmup))
        .randomSeed(randomSeed)
        .parallelExecutionEnabled(false)
        .build();
    double[] scores = new double[n];
    for (int i = 0; i < n; i++) {
      if (i >= warmup) {
        scores[i] = Math.max(0.0, forest.getAnomalyScore(features[i]));
      }
      forest.update(features[i]);
    }
    for (int i = 0; i < warmup; i++) {
      scores[i] = Math.max(0.0, forest.getAnomalyScore(features[i]));
    }
    return scores;
  }

  static double[][] fillGaps(double[][] rows) {
    int n = rows.length;
    int d = rows[0].length;
    double[][] out = new double[n][];
    for (int i = 0; i < n; i++) out[i] = rows[i].clone();
    for (int j = 0; j < d; j++) {
      double last = Double.NaN;
      for (int i = 0; i < n; i++) {
        if (Double.isNaN(out[i][j])) out[i][j] = last;
        else last = out[i][j];
      }
      double next = Double.NaN;
      for (int i = n - 1; i >= 0; i--) {
        if (Double.isNaN(out[i][j])) out[i][j] = next;
        else next = out[i][j];
      }
      // a column with no values at all carries no signal
      for (int i = 0; i < n; i++) {
        if (Double.isNaN(out[i][j])) out[i][j] = 0.0;
      }
    }
    return out;
  }

  /** Raw feature rows: value, relative change from the previous point, UTC hour of day. */
  static double[][] features(List<MetricPoint> points) {
    double[][] rows = new double[points.size()][];
    for (int i = 0; i < points.size(); i++) {
      MetricPoint p = points.get(i);
      double rate = 0.0;
      if (i > 0) {
        double prev = points.get(i - 1).value();
        rate = prev == 0.0 ? p.value() - prev : (p.value() - prev) / Math.abs(prev);
      }
      int hour = p.timestamp().atZone(ZoneOffset.UTC).getHour();
      rows[i] = new double[] {p.value(), rate, hour};
    }
    return rows;
  }

  /** Column-wise z-normalization; constant columns become zero. */
  static double[][] standardize(double[][] rows) {
    int n = rows.length;
    int d = rows[0].length;
    double[][] out = new double[n][d];
    for (int j = 0; j < d; j++) {
      double mean = 0.0;
      for (double[] row : rows) mean += row[j];
      mean /= n;
      double var = 0.0;
      for (double[] row : rows) var += (row[j] - mean) * (row[j] - mean);
      double std = Math.sqrt(var / n);
      for (int i = 0; i < n; i++) {
        out[i][j] = std > 0 ? (rows[i][j] - mean) / std : 0.0;
      }
    }
    return out;
  }
}
