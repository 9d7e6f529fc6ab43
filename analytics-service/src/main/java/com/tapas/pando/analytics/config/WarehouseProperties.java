package com.tapas.pando.analytics.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings for the Doris warehouse, bound once at startup.
 * The database and table are fixed; only the endpoint and credentials vary per environment.
 */
@ConfigurationProperties("warehouse")
public record WarehouseProperties(
        @DefaultValue("127.0.0.1") String host,
        @DefaultValue("9030") int port,
        @DefaultValue("root") String user,
        String password
) {
    public static final String DATABASE = "pando";

    public String jdbcUrl() {
        return String.format("jdbc:mysql://%s:%d/%s?characterEncoding=UTF-8&useSSL=false", host, port, DATABASE);
    }
}
