package com.tapas.pando.analytics.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs a unit of work against exactly one warehouse connection.
 * The connection is opened on entry and closed before {@link #execute} returns,
 * whether the callback succeeds or throws.
 */
@Component
public class WarehouseConnectionTemplate {

    private static final Logger log = LoggerFactory.getLogger(WarehouseConnectionTemplate.class);

    @FunctionalInterface
    public interface WarehouseCallback<T> {
        T doInConnection(JdbcTemplate jdbc);
    }

    private final DataSource dataSource;

    public WarehouseConnectionTemplate(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public <T> T execute(WarehouseCallback<T> callback) {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            log.error("Error connecting to Doris: {}", e.getMessage());
            throw new WarehouseConnectionException(e);
        }

        try {
            // All statements of the callback share this one session.
            JdbcTemplate jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
            return callback.doInConnection(jdbc);
        } catch (RuntimeException e) {
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
            String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
            log.error("Query error: {}", message);
            throw new WarehouseQueryException(message, e);
        } finally {
            JdbcUtils.closeConnection(connection);
        }
    }
}
