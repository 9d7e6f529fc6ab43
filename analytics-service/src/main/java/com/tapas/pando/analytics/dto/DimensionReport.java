package com.tapas.pando.analytics.dto;

import com.tapas.pando.analytics.domain.DateRange;

public record DimensionReport(
        String dimension,
        DateRange dateRange,
        DimensionAnalytics analytics) {
}
