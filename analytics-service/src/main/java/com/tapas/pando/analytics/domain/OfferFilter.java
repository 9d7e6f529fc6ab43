package com.tapas.pando.analytics.domain;

import java.util.List;

/**
 * Optional offer_id restriction appended to a WHERE clause.
 */
public record OfferFilter(String clause, List<Object> args) {

    public static final String ALL_OFFERS = "ALL";

    private static final OfferFilter NONE = new OfferFilter("", List.of());

    public static OfferFilter of(String offerId) {
        if (offerId == null || offerId.isEmpty() || ALL_OFFERS.equals(offerId)) {
            return NONE;
        }
        return new OfferFilter(" AND offer_id = ?", List.of(offerId));
    }

    public boolean isEmpty() {
        return args.isEmpty();
    }
}
