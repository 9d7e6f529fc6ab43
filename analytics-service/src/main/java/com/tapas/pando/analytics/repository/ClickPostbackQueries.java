package com.tapas.pando.analytics.repository;

import com.tapas.pando.analytics.domain.DateRange;
import com.tapas.pando.analytics.domain.Dimension;
import com.tapas.pando.analytics.domain.OfferFilter;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL for the click_postback_agg table. Values are always bound; the only
 * interpolated identifier is the column of a {@link Dimension}.
 */
public final class ClickPostbackQueries {

    public static final String TABLE = "click_postback_agg";

    public record BoundSql(String sql, List<Object> args) {
        public Object[] argArray() {
            return args.toArray();
        }
    }

    private ClickPostbackQueries() {
    }

    public static BoundSql recentRows(int days, int limit) {
        String sql = """
                SELECT
                    dt,
                    offer_id,
                    publisher,
                    bundle,
                    brand,
                    model,
                    ad_type,
                    bid_floor,
                    clicks,
                    installs,
                    events,
                    revenues
                FROM %s
                WHERE dt >= date_sub(current_date(), interval ? day)
                LIMIT ?
                """.formatted(TABLE);
        return new BoundSql(sql, List.of(days, limit));
    }

    public static BoundSql summary(DateRange range, OfferFilter offerFilter) {
        String sql = """
                SELECT
                    COALESCE(SUM(clicks), 0) AS clicks,
                    COALESCE(SUM(installs), 0) AS installs,
                    COALESCE(SUM(events), 0) AS events,
                    COALESCE(SUM(revenues), 0) AS revenues
                FROM %s
                WHERE dt >= ? AND dt <= ?%s
                """.formatted(TABLE, offerFilter.clause());

        List<Object> args = new ArrayList<>();
        args.add(range.start());
        args.add(range.end());
        args.addAll(offerFilter.args());
        return new BoundSql(sql, args);
    }

    public static BoundSql aggregatedBy(Dimension dimension, DateRange range, OfferFilter offerFilter, int limit) {
        String column = dimension.column();
        String sql = """
                SELECT
                    %1$s AS dimension_key,
                    SUM(clicks) AS clicks,
                    SUM(installs) AS installs,
                    SUM(events) AS events,
                    SUM(revenues) AS revenues
                FROM %2$s
                WHERE dt >= ? AND dt <= ?%3$s
                GROUP BY %1$s
                ORDER BY SUM(clicks) DESC
                LIMIT ?
                """.formatted(column, TABLE, offerFilter.clause());

        List<Object> args = new ArrayList<>();
        args.add(range.start());
        args.add(range.end());
        args.addAll(offerFilter.args());
        args.add(limit);
        return new BoundSql(sql, args);
    }

    /**
     * Offer ids seen in the range. Never narrowed by the offer filter.
     */
    public static BoundSql offerIds(DateRange range) {
        String sql = """
                SELECT DISTINCT offer_id
                FROM %s
                WHERE dt >= ? AND dt <= ?
                ORDER BY offer_id
                """.formatted(TABLE);
        return new BoundSql(sql, List.of(range.start(), range.end()));
    }
}
