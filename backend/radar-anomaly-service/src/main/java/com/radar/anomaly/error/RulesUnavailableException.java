package com.radar.anomaly.error;

/** The active rule index is missing or too old to trust. */
public class RulesUnavailableException extends AnomalyDetectionException {

  public RulesUnavailableException(String message) {
    super(message);
  }
}
