package com.tapas.pando.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record DimensionAggregate(
        @JsonProperty("dimension_key") String dimensionKey,
        long clicks,
        long installs,
        long events,
        BigDecimal revenues) {
}
