package com.radar.anomaly.alert;

public enum AlertType {
  ANOMALY_DETECTED("anomaly_detected"),
  ANOMALY_ESCALATED("anomaly_escalated"),
  BASELINE_DEGRADED("baseline_degraded");

  private final String wireName;

  AlertType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
