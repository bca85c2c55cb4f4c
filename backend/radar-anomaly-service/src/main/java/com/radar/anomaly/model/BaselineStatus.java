package com.radar.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum BaselineStatus {
  FRESH, STALE, DEGRADED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
