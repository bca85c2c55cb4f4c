package com.radar.anomaly.error;

public class InvalidRuleConfigException extends AnomalyDetectionException {

  public InvalidRuleConfigException(String message) {
    super(message);
  }

  public InvalidRuleConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
