package com.radar.api.model;

public record ErrorPatternsRequest(Integer windowHours) {}
