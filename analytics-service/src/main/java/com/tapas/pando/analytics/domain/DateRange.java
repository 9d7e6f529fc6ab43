package com.tapas.pando.analytics.domain;

/**
 * Closed interval of calendar dates, kept as the ISO strings bound into SQL.
 */
public record DateRange(String start, String end) {
}
