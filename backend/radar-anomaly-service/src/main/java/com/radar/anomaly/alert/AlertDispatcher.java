package com.radar.anomaly.alert;

/**
 * Fire-and-forget hand-off to the delivery side. Implementations must not throw.
 */
public interface AlertDispatcher {

  void dispatch(AlertEvent event);
}
