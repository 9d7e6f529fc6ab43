package com.tapas.pando.analytics.api;

import com.tapas.pando.analytics.dto.DimensionReport;
import com.tapas.pando.analytics.service.ClickPostbackQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class AnalyticsController {

    static final int DEFAULT_DAYS = 7;
    static final int DEFAULT_RAW_LIMIT = 5000;
    static final int DEFAULT_ANALYTICS_LIMIT = 500;

    private final ClickPostbackQueryService service;

    public AnalyticsController(ClickPostbackQueryService service) {
        this.service = service;
    }

    @Operation(
            summary = "Raw click/postback rows",
            description = "Rows of click_postback_agg from the last N days (by the warehouse clock), capped at limit."
    )
    @GetMapping("/data")
    public ApiResult<List<Map<String, Object>>> data(
            @Parameter(description = "Look-back window in days", example = "7")
            @RequestParam(required = false) String days,
            @Parameter(description = "Max number of rows to return", example = "5000")
            @RequestParam(required = false) String limit
    ) {
        List<Map<String, Object>> rows = service.recentRows(
                QueryParams.intOrDefault(days, DEFAULT_DAYS),
                QueryParams.intOrDefault(limit, DEFAULT_RAW_LIMIT)
        );
        return ApiResult.success(rows, rows.size());
    }

    @Operation(
            summary = "Metrics aggregated by dimension",
            description = "Summary totals, per-dimension rows ordered by clicks, and the offer ids present in the date range.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Successful response"),
                    @ApiResponse(
                            responseCode = "400",
                            description = "Dimension is not one of publisher, bundle, brand, model, ad_type, bid_floor",
                            content = @Content(
                                    mediaType = "application/json",
                                    examples = @ExampleObject(
                                            name = "unsupportedDimension",
                                            value = "{\n  \"code\": 400,\n  \"message\": \"Unsupported dimension: os\"\n}"
                                    )
                            )
                    ),
                    @ApiResponse(responseCode = "500", description = "Warehouse connection or query failure")
            }
    )
    @GetMapping("/analytics/{dimension}")
    public ApiResult<DimensionAnalyticsResponse> dimensionAnalytics(
            @Parameter(description = "Grouping dimension", example = "publisher")
            @PathVariable String dimension,
            @Parameter(description = "Range start (YYYY-MM-DD), used together with end", example = "2024-01-01")
            @RequestParam(required = false) String start,
            @Parameter(description = "Range end (YYYY-MM-DD), inclusive", example = "2024-01-07")
            @RequestParam(required = false) String end,
            @Parameter(description = "Last N days ending today (UTC) when start/end are absent", example = "7")
            @RequestParam(required = false) String days,
            @Parameter(description = "Restrict to one offer; ALL or absent means every offer", example = "ALL")
            @RequestParam(name = "offer_id", required = false) String offerId,
            @Parameter(description = "Max number of dimension rows", example = "500")
            @RequestParam(required = false) String limit
    ) {
        DimensionReport report = service.dimensionReport(
                dimension,
                start,
                end,
                QueryParams.intOrDefault(days, DEFAULT_DAYS),
                offerId,
                QueryParams.intOrDefault(limit, DEFAULT_ANALYTICS_LIMIT)
        );
        DimensionAnalyticsResponse body = DimensionAnalyticsResponse.from(report);
        return ApiResult.success(body, body.aggregated().size());
    }
}
