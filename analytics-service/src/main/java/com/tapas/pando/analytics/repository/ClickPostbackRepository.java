package com.tapas.pando.analytics.repository;

import com.tapas.pando.analytics.domain.DateRange;
import com.tapas.pando.analytics.domain.Dimension;
import com.tapas.pando.analytics.domain.OfferFilter;
import com.tapas.pando.analytics.dto.DimensionAggregate;
import com.tapas.pando.analytics.dto.DimensionAnalytics;
import com.tapas.pando.analytics.dto.MetricTotals;
import com.tapas.pando.analytics.repository.ClickPostbackQueries.BoundSql;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to pando.click_postback_agg.
 * Each public method runs on its own connection, released before returning.
 */
@Repository
public class ClickPostbackRepository {

    private static final Logger logger = LoggerFactory.getLogger(ClickPostbackRepository.class);

    private static final RowMapper<MetricTotals> TOTALS_MAPPER = (rs, rowNum) -> new MetricTotals(
            rs.getLong("clicks"),
            rs.getLong("installs"),
            rs.getLong("events"),
            orZero(rs.getBigDecimal("revenues")));

    private static final RowMapper<DimensionAggregate> AGGREGATE_MAPPER = (rs, rowNum) -> new DimensionAggregate(
            rs.getString("dimension_key"),
            rs.getLong("clicks"),
            rs.getLong("installs"),
            rs.getLong("events"),
            orZero(rs.getBigDecimal("revenues")));

    private final WarehouseConnectionTemplate warehouse;

    public ClickPostbackRepository(WarehouseConnectionTemplate warehouse) {
        this.warehouse = warehouse;
    }

    /**
     * Rows from the last {@code days} days, measured from the warehouse's current date.
     */
    public List<Map<String, Object>> findRecentRows(int days, int limit) {
        BoundSql query = ClickPostbackQueries.recentRows(days, limit);
        logger.info("Executing raw data query with params: days={}, limit={}", days, limit);
        logger.debug("SQL: {}", query.sql());

        ColumnMapRowMapper columnMapper = new ColumnMapRowMapper();
        return warehouse.execute(jdbc -> jdbc.query(query.sql(),
                (rs, rowNum) -> normalizeTemporalValues(columnMapper.mapRow(rs, rowNum)),
                query.argArray()));
    }

    /**
     * Summary, per-dimension aggregation and offer id list for one date range,
     * all read over the same connection.
     */
    public DimensionAnalytics findDimensionAnalytics(
            Dimension dimension,
            DateRange range,
            OfferFilter offerFilter,
            int limit) {

        BoundSql summarySql = ClickPostbackQueries.summary(range, offerFilter);
        BoundSql aggregatedSql = ClickPostbackQueries.aggregatedBy(dimension, range, offerFilter, limit);
        BoundSql offerIdsSql = ClickPostbackQueries.offerIds(range);

        logger.info("Executing {} analytics for {}..{} with offer params {} and limit {}",
                dimension.externalName(), range.start(), range.end(), offerFilter.args(), limit);

        return warehouse.execute(jdbc -> {
            logger.debug("Summary SQL: {}", summarySql.sql());
            List<MetricTotals> totals = jdbc.query(summarySql.sql(), TOTALS_MAPPER, summarySql.argArray());
            MetricTotals summary = totals.isEmpty() ? MetricTotals.ZERO : totals.get(0);

            logger.debug("Aggregated SQL: {}", aggregatedSql.sql());
            List<DimensionAggregate> aggregated =
                    jdbc.query(aggregatedSql.sql(), AGGREGATE_MAPPER, aggregatedSql.argArray());

            logger.debug("Offer ids SQL: {}", offerIdsSql.sql());
            List<String> offerIds = jdbc.queryForList(offerIdsSql.sql(), String.class, offerIdsSql.argArray());

            return new DimensionAnalytics(summary, aggregated, offerIds);
        });
    }

    // Dates and timestamps are handed to Jackson as plain strings.
    private static Map<String, Object> normalizeTemporalValues(Map<String, Object> row) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        row.forEach((column, value) -> {
            if (value instanceof java.util.Date || value instanceof java.time.temporal.Temporal) {
                normalized.put(column, value.toString());
            } else {
                normalized.put(column, value);
            }
        });
        return normalized;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
