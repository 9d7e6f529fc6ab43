package com.tapas.pando.analytics.service;

public class UnsupportedDimensionException extends RuntimeException {

    private final String dimension;

    public UnsupportedDimensionException(String dimension) {
        super("Unsupported dimension: " + dimension);
        this.dimension = dimension;
    }

    public String getDimension() {
        return dimension;
    }
}
