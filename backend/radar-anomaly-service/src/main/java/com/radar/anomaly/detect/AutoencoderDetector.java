package com.radar.anomaly.detect;

import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricPoint;
import com.radar.anomaly.rules.RuleParameters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.springframework.stereotype.Component;

/**
 * Linear autoencoder over sliding windows: windows are projected onto their top {@code latent_dim}
 * principal components and reconstructed. A point's raw score is the reconstruction error of the
 * window ending at it, relative to the mean error across the batch.
 */
@Component
public class AutoencoderDetector implements BatchDetector {

  static final int DEFAULT_WINDOW_SIZE = 12;
  static final int DEFAULT_LATENT_DIM = 3;

  @Override
  public DetectionMethod method() {
    return DetectionMethod.AUTOENCODER;
  }

  @Override
  public List<PointScore> scoreWindow(DetectionContext context) {
    RuleParameters params = context.parameters();
    int w = params.getInt(RuleParameters.WINDOW_SIZE, DEFAULT_WINDOW_SIZE);
    int latent = params.getInt(RuleParameters.LATENT_DIM, DEFAULT_LATENT_DIM);

    List<MetricPoint> points = new ArrayList<>(context.window());
    points.sort(Comparator.comparing(MetricPoint::timestamp));
    int n = points.size();
    int rows = n - w + 1;
    if (w < 2 || rows < latent + 1 || rows < 2) {
      throw new DataUnavailableException("autoencoder needs at least " + (w + latent) + " points, window has " + n);
    }

    double[] series = zNormalize(points);
    double[][] data = new double[rows][w];
    for (int i = 0; i < rows; i++) {
      System.arraycopy(series, i, data[i], 0, w);
    }
    RealMatrix x = MatrixUtils.createRealMatrix(data);
    double[] colMeans = new double[w];
    for (int j = 0; j < w; j++) {
      double sum = 0.0;
      for (int i = 0; i < rows; i++) sum += data[i][j];
      colMeans[j] = sum / rows;
      for (int i = 0; i < rows; i++) x.setEntry(i, j, data[i][j] - colMeans[j]);
    }

    int k = Math.min(latent, Math.min(w, rows));
    RealMatrix v = new SingularValueDecomposition(x).getV();
    RealMatrix encoder = v.getSubMatrix(0, w - 1, 0, k - 1);
    RealMatrix reconstructed = x.multiply(encoder).multiply(encoder.transpose());
    RealMatrix residual = x.subtract(reconstructed);

    double[] errors = new double[rows];
    double total = 0.0;
    for (int i = 0; i < rows; i++) {
      double sq = 0.0;
      for (int j = 0; j < w; j++) {
        double r = residual.getEntry(i, j);
        sq += r * r;
      }
      errors[i] = sq / w;
      total += errors[i];
    }
    double meanError = total / rows;

    double confidence = Math.min(1.0, rows / (double) (w * 4));
    List<PointScore> out = new ArrayList<>(rows);
    for (int i = 0; i < rows; i++) {
      double score = meanError > 1e-12 ? errors[i] / meanError : 0.0;
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("reconstruction_error", errors[i]);
      details.put("mean_reconstruction_error", meanError);
      details.put("window_size", w);
      details.put("latent_dim", k);
      out.add(new PointScore(points.get(i + w - 1), new RawScore(score, confidence, Map.of(), details)));
    }
    return out;
  }

  private static double[] zNormalize(List<MetricPoint> points) {
    int n = points.size();
    double mean = 0.0;
    for (MetricPoint p : points) mean += p.value();
    mean /= n;
    double var = 0.0;
    for (MetricPoint p : points) var += (p.value() - mean) * (p.value() - mean);
    double std = Math.sqrt(var / n);
    double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      out[i] = std > 0 ? (points.get(i).value() - mean) / std : 0.0;
    }
    return out;
  }
}
