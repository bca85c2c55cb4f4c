package com.radar.api.model;

public record UserBehaviorRequest(String userId, Integer lookbackDays) {}
