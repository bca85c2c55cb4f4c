package com.radar.anomaly.detect;

import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.model.MetricPoint;
import java.util.ArrayList;
import java.util.List;

/**
 * Method that needs a window of points. Runs on its own cadence instead of per event.
 */
public interface BatchDetector extends Detector {

  /** Scores every point of {@code context.window()} that has enough history behind it. */
  List<PointScore> scoreWindow(DetectionContext context);

  @Override
  default RawScore score(double value, DetectionContext context) {
    List<MetricPoint> window = new ArrayList<>(context.window());
    MetricPoint current = new MetricPoint(context.timestamp(), value);
    window.add(current);
    List<PointScore> scores = scoreWindow(
        new DetectionContext(context.baseline(), context.parameters(), window, context.timestamp()));
    if (scores.isEmpty() || !scores.get(scores.size() - 1).point().equals(current)) {
      throw new DataUnavailableException(method().wireName() + " could not score the latest point");
    }
    return scores.get(scores.size() - 1).score();
  }
}
