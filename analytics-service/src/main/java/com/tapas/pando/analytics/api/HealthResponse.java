package com.tapas.pando.analytics.api;

public record HealthResponse(String status, String service) {
}
