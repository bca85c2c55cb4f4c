package com.radar.anomaly.error;

/** No baseline or no history for the requested key. */
public class DataUnavailableException extends AnomalyDetectionException {

  public DataUnavailableException(String message) {
    super(message);
  }

  public DataUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
