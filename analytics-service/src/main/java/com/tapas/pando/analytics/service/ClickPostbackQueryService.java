package com.tapas.pando.analytics.service;

import com.tapas.pando.analytics.domain.DateRange;
import com.tapas.pando.analytics.domain.Dimension;
import com.tapas.pando.analytics.domain.OfferFilter;
import com.tapas.pando.analytics.dto.DimensionAnalytics;
import com.tapas.pando.analytics.dto.DimensionReport;
import com.tapas.pando.analytics.repository.ClickPostbackRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class ClickPostbackQueryService {

    private final ClickPostbackRepository repository;
    private final DateRangeResolver dateRangeResolver;

    public ClickPostbackQueryService(
            ClickPostbackRepository repository,
            DateRangeResolver dateRangeResolver) {
        this.repository = repository;
        this.dateRangeResolver = dateRangeResolver;
    }

    public List<Map<String, Object>> recentRows(int days, int limit) {
        return repository.findRecentRows(days, limit);
    }

    public DimensionReport dimensionReport(
            String dimensionName,
            String start,
            String end,
            int days,
            String offerId,
            int limit) {

        // Validation happens before any connection is opened.
        Dimension dimension = Dimension.fromName(dimensionName)
                .orElseThrow(() -> new UnsupportedDimensionException(dimensionName));

        DateRange range = dateRangeResolver.resolve(start, end, days);
        OfferFilter offerFilter = OfferFilter.of(offerId);

        DimensionAnalytics analytics = repository.findDimensionAnalytics(dimension, range, offerFilter, limit);
        return new DimensionReport(dimensionName, range, analytics);
    }
}
