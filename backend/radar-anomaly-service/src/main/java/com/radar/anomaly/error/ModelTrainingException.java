package com.radar.anomaly.error;

/** Retrain could not read history or compute statistics. */
public class ModelTrainingException extends AnomalyDetectionException {

  public ModelTrainingException(String message) {
    super(message);
  }

  public ModelTrainingException(String message, Throwable cause) {
    super(message, cause);
  }
}
