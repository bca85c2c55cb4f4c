package com.radar.anomaly.baseline;

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Batch statistics over a training window. Variance is the population variance so it agrees
 * with the streaming {@code m2 / n} estimate.
 */
public final class BaselineStatistics {

  private static final double[] QUANTILES = {25, 50, 75, 95, 99};

  private BaselineStatistics() {}

  public record Summary(long count, double mean, double variance, double min, double max,
                        Map<String, Double> percentiles) {
    public double m2() {
      return variance * count;
    }
  }

  public static Summary summarize(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("cannot summarize an empty sample");
    }
    DescriptiveStatistics stats = new DescriptiveStatistics(values);
    Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
    percentile.setData(values);
    Map<String, Double> pct = new LinkedHashMap<>();
    for (double q : QUANTILES) {
      pct.put("p" + (int) q, percentile.evaluate(q));
    }
    double variance = Math.max(0.0, stats.getPopulationVariance());
    return new Summary(values.length, stats.getMean(), variance, stats.getMin(), stats.getMax(), pct);
  }
}
