package com.tapas.pando.analytics.dto;

import java.math.BigDecimal;

public record MetricTotals(
        long clicks,
        long installs,
        long events,
        BigDecimal revenues) {

    public static final MetricTotals ZERO = new MetricTotals(0L, 0L, 0L, BigDecimal.ZERO);
}
