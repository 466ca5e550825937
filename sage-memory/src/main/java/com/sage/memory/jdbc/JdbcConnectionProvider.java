package com.sage.memory.jdbc;

import com.sage.config.SageConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.TimeZone;

/**
 * JDBC connections to the memory database (PostgreSQL, UTC).
 */
public final class JdbcConnectionProvider implements MemorySchemaBootstrapper.ConnectionProvider {

    private final SageConfig config;

    public JdbcConnectionProvider(SageConfig config) {
        this.config = Objects.requireNonNull(config, "SageConfig");
    }

    public String url() {
        return "jdbc:postgresql://" + config.getDbHost() + ":" + config.getDbPort() + "/" + config.getDbName();
    }

    @Override
    public Connection getConnection() throws SQLException {
        TimeZone prev = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
            return DriverManager.getConnection(url(), config.getDbUser(),
                    config.getDbPassword() != null ? config.getDbPassword() : "");
        } finally {
            TimeZone.setDefault(prev);
        }
    }
}
