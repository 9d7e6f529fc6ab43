package com.tapas.pando.analytics.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tapas.pando.analytics.domain.DateRange;
import com.tapas.pando.analytics.dto.DimensionAggregate;
import com.tapas.pando.analytics.dto.DimensionReport;
import com.tapas.pando.analytics.dto.MetricTotals;

import java.util.List;

public record DimensionAnalyticsResponse(
        String dimension,
        @JsonProperty("date_range") DateRange dateRange,
        MetricTotals summary,
        List<DimensionAggregate> aggregated,
        @JsonProperty("offer_ids") List<String> offerIds
) {
    public static DimensionAnalyticsResponse from(DimensionReport report) {
        return new DimensionAnalyticsResponse(
                report.dimension(),
                report.dateRange(),
                report.analytics().summary(),
                report.analytics().aggregated(),
                report.analytics().offerIds()
        );
    }
}
