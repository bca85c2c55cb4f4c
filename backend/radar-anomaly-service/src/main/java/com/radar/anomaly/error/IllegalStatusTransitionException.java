package com.radar.anomaly.error;

/** Move between two closed states, e.g. resolving an ignored anomaly. */
public class IllegalStatusTransitionException extends AnomalyDetectionException {

  public IllegalStatusTransitionException(String message) {
    super(message);
  }

  public IllegalStatusTransitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
