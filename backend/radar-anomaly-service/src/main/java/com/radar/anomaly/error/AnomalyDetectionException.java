package com.radar.anomaly.error;

/**
 * Root of the anomaly detection error taxonomy.
 */
public class AnomalyDetectionException extends RuntimeException {

  public AnomalyDetectionException(String message) {
    super(message);
  }

  public AnomalyDetectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
