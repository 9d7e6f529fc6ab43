package com.tapas.pando.analytics.dto;

import java.util.List;

/**
 * Everything read from the warehouse for one analytics request.
 */
public record DimensionAnalytics(
        MetricTotals summary,
        List<DimensionAggregate> aggregated,
        List<String> offerIds) {
}
