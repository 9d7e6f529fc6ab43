package com.tapas.pando.analytics.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiMeta(
        @JsonProperty("total_rows") int totalRows,
        String source
) {
    public static final String SOURCE = "doris_pando";
}
