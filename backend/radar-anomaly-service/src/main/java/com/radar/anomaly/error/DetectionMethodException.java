package com.radar.anomaly.error;

import com.radar.anomaly.model.DetectionMethod;

/** One method timed out or failed. Other methods for the same event still run. */
public class DetectionMethodException extends AnomalyDetectionException {

  private final DetectionMethod method;

  public DetectionMethodException(DetectionMethod method, String message, Throwable cause) {
    super(method.wireName() + ": " + message, cause);
    this.method = method;
  }

  public DetectionMethod getMethod() {
    return method;
  }
}
