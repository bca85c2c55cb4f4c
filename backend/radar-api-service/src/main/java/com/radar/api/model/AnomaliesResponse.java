package com.radar.api.model;

import java.util.List;

public record AnomaliesResponse(List<AnomalyView> anomalies, Meta meta) {
  public record Meta(int page, int pageSize, long total) {}
}
