package com.radar.api.model;

public record TrainRequest(String metricType, Integer trainingWindowDays) {}
