package com.tapas.pando.analytics.service;

import com.tapas.pando.analytics.domain.DateRange;
import com.tapas.pando.analytics.domain.Dimension;
import com.tapas.pando.analytics.domain.OfferFilter;
import com.tapas.pando.analytics.dto.DimensionAnalytics;
import com.tapas.pando.analytics.dto.DimensionReport;
import com.tapas.pando.analytics.dto.MetricTotals;
import com.tapas.pando.analytics.repository.ClickPostbackRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClickPostbackQueryServiceTest {

    @Mock
    private ClickPostbackRepository repository;

    private ClickPostbackQueryService service;

    private final DimensionAnalytics emptyAnalytics = new DimensionAnalytics(MetricTotals.ZERO, List.of(), List.of());

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T08:00:00Z"), ZoneOffset.UTC);
        service = new ClickPostbackQueryService(repository, new DateRangeResolver(clock));
    }

    @Test
    void shouldRejectUnknownDimensionWithoutTouchingWarehouse() {
        assertThatThrownBy(() -> service.dimensionReport("unknown_dim", null, null, 7, null, 500))
                .isInstanceOf(UnsupportedDimensionException.class)
                .hasMessage("Unsupported dimension: unknown_dim");

        verifyNoInteractions(repository);
    }

    @Test
    void shouldResolveRangeAndFilterBeforeQuerying() {
        when(repository.findDimensionAnalytics(any(), any(), any(), anyInt())).thenReturn(emptyAnalytics);

        DimensionReport report = service.dimensionReport("ad_type", null, null, 3, "offer-9", 50);

        ArgumentCaptor<OfferFilter> filter = ArgumentCaptor.forClass(OfferFilter.class);
        verify(repository).findDimensionAnalytics(
                eq(Dimension.AD_TYPE),
                eq(new DateRange("2024-03-13", "2024-03-15")),
                filter.capture(),
                eq(50));
        assertThat(filter.getValue().args()).containsExactly("offer-9");
        assertThat(report.dimension()).isEqualTo("ad_type");
        assertThat(report.dateRange()).isEqualTo(new DateRange("2024-03-13", "2024-03-15"));
        assertThat(report.analytics()).isSameAs(emptyAnalytics);
    }

    @Test
    void shouldPreferExplicitRangeOverDays() {
        when(repository.findDimensionAnalytics(any(), any(), any(), anyInt())).thenReturn(emptyAnalytics);

        DimensionReport report = service.dimensionReport("brand", "2024-01-01", "2024-01-07", 90, "ALL", 500);

        ArgumentCaptor<OfferFilter> filter = ArgumentCaptor.forClass(OfferFilter.class);
        verify(repository).findDimensionAnalytics(
                eq(Dimension.BRAND),
                eq(new DateRange("2024-01-01", "2024-01-07")),
                filter.capture(),
                eq(500));
        assertThat(filter.getValue().isEmpty()).isTrue();
        assertThat(report.dateRange().start()).isEqualTo("2024-01-01");
    }

    @Test
    void shouldHandRawRowRequestStraightToRepository() {
        List<Map<String, Object>> rows = List.of(Map.of("dt", "2024-03-15", "clicks", 4L));
        when(repository.findRecentRows(0, 10)).thenReturn(rows);

        assertThat(service.recentRows(0, 10)).isSameAs(rows);
    }
}
