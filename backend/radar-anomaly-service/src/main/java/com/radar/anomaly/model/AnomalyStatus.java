package com.radar.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Incident status. The declaration order is the progression order:
 * {@code new -> acknowledged -> investigating -> resolved | ignored}.
 */
public enum AnomalyStatus {
  NEW, ACKNOWLEDGED, INVESTIGATING, RESOLVED, IGNORED;

  public boolean isOpen() {
    return this == NEW || this == ACKNOWLEDGED || this == INVESTIGATING;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static AnomalyStatus fromWire(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("status must not be blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown status: " + value);
    }
  }
}
