package com.radar.anomaly.error;

/** Store stayed unreachable after every upsert retry. */
public class PersistenceUnavailableException extends AnomalyDetectionException {

  public PersistenceUnavailableException(String message) {
    super(message);
  }

  public PersistenceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
