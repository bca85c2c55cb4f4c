package com.radar.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatusUpdateRequest(String notes, @JsonProperty("is_false_positive") Boolean isFalsePositive) {}
