package com.tapas.pando.analytics.service;

import com.tapas.pando.analytics.domain.DateRange;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Turns request parameters into the inclusive date window for analytics queries.
 */
@Component
public class DateRangeResolver {

    private final Clock clock;

    public DateRangeResolver(Clock clock) {
        this.clock = clock;
    }

    /**
     * An explicit start and end win outright and are passed through unchecked.
     * Otherwise the window is the last {@code days} days ending today in UTC,
     * with non-positive values treated as 1.
     */
    public DateRange resolve(String start, String end, int days) {
        if (StringUtils.hasLength(start) && StringUtils.hasLength(end)) {
            return new DateRange(start, end);
        }

        int window = Math.max(days, 1);
        LocalDate endDate = LocalDate.now(clock);
        LocalDate startDate = endDate.minusDays(window - 1L);
        return new DateRange(startDate.toString(), endDate.toString());
    }
}
