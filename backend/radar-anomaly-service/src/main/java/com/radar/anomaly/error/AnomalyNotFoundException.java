package com.radar.anomaly.error;

public class AnomalyNotFoundException extends AnomalyDetectionException {

  public AnomalyNotFoundException(String message) {
    super(message);
  }

  public AnomalyNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
