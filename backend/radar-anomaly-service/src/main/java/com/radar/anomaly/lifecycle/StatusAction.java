package com.radar.anomaly.lifecycle;

import com.radar.anomaly.model.AnomalyStatus;

public enum StatusAction {
  ACKNOWLEDGE(AnomalyStatus.ACKNOWLEDGED),
  INVESTIGATE(AnomalyStatus.INVESTIGATING),
  RESOLVE(AnomalyStatus.RESOLVED),
  IGNORE(AnomalyStatus.IGNORED);

  private final AnomalyStatus target;

  StatusAction(AnomalyStatus target) {
    this.target = target;
  }

  public AnomalyStatus target() {
    return target;
  }

  public boolean closes() {
    return !target.isOpen();
  }
}
