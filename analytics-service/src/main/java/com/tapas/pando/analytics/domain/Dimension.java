package com.tapas.pando.analytics.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Columns of click_postback_agg that callers may group by.
 * <p>
 * The column identifier returned by {@link #column()} is the only piece of SQL
 * text ever derived from a request, and it can only be reached through
 * {@link #fromName(String)}.
 */
public enum Dimension {
    PUBLISHER("publisher", "publisher"),
    BUNDLE("bundle", "bundle"),
    BRAND("brand", "brand"),
    MODEL("model", "model"),
    AD_TYPE("ad_type", "ad_type"),
    BID_FLOOR("bid_floor", "bid_floor");

    private final String externalName;
    private final String column;

    Dimension(String externalName, String column) {
        this.externalName = externalName;
        this.column = column;
    }

    public String externalName() {
        return externalName;
    }

    public String column() {
        return column;
    }

    /**
     * Exact, case-sensitive match on the name used in URLs.
     */
    public static Optional<Dimension> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(d -> d.externalName.equals(name))
                .findFirst();
    }
}
