package com.radar.anomaly.stream;

/**
 * Stages of one event against one rule:
 * {@code RECEIVED -> SCORED -> (DEDUPED | NEW_ANOMALY) -> (ALERTED | SUPPRESSED) -> DONE}.
 */
public enum ProcessingStage {
  RECEIVED,
  SCORED,
  DEDUPED,
  NEW_ANOMALY,
  ALERTED,
  SUPPRESSED,
  DONE
}
