package com.tapas.pando.analytics.api;

/**
 * Integer query parameters are read leniently: missing or malformed values
 * fall back to the endpoint default instead of failing the request.
 */
final class QueryParams {

    private QueryParams() {
    }

    static int intOrDefault(String raw, int defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
