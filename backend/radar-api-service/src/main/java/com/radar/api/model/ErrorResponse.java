package com.radar.api.model;

import java.time.Instant;

public record ErrorResponse(String error, String message, Instant timestamp) {}
