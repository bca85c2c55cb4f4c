package com.radar.api.model;

public record UsageSpikesRequest(Double sensitivity, Integer windowHours) {}
