package com.tapas.pando.analytics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

/**
 * Configuration for the Doris DataSource.
 * Doris FE speaks the MySQL protocol, so the MySQL driver is used. Every
 * getConnection() opens a fresh session; nothing is pooled.
 */
@Configuration
public class WarehouseConfig {

    private static final Logger log = LoggerFactory.getLogger(WarehouseConfig.class);

    @Bean
    public DataSource warehouseDataSource(WarehouseProperties properties) {
        String url = properties.jdbcUrl();
        log.info("Creating Doris DataSource for {}:{} with URL: {}", properties.host(), properties.port(), url);
        DriverManagerDataSource dataSource = new DriverManagerDataSource(url, properties.user(), properties.password());
        dataSource.setDriverClassName("com.mysql.cj.jdbc.Driver");
        return dataSource;
    }
}
