package com.sage.memory.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Loads and executes {@code schema/sage-memory.sql}. Idempotent; safe to call at bootstrap.
 */
public final class MemorySchemaBootstrapper {

    private static final String SCHEMA_RESOURCE = "schema/sage-memory.sql";
    private static final Logger log = LoggerFactory.getLogger(MemorySchemaBootstrapper.class);

    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public void ensureSchema(ConnectionProvider connectionProvider) {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Memory schema already initialized; skipping");
            return;
        }
        List<String> statements = statements(loadSchemaScript());
        log.info("Memory schema: executing {} statement(s) from {}", statements.size(), SCHEMA_RESOURCE);
        try (Connection c = connectionProvider.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                try {
                    st.execute(stmt);
                } catch (SQLException e) {
                    schemaInitialized.set(false);
                    log.error("Memory schema: statement {}/{} failed. SQL: {} | SQLState: {}", index, statements.size(), preview, e.getSQLState(), e);
                    throw new IllegalStateException("Memory schema execution failed at statement " + index + ": " + e.getMessage(), e);
                }
            }
            log.info("Memory schema ready; tables sage_documents, sage_source_effectiveness, sage_access_failures, sage_checkpoints");
        } catch (SQLException e) {
            schemaInitialized.set(false);
            throw new IllegalStateException("Memory schema execution failed: " + e.getMessage(), e);
        }
    }

    /** Splits a script on ';', dropping '--' comment lines and empty statements. */
    static List<String> statements(String sql) {
        List<String> out = new ArrayList<>();
        for (String raw : sql.split(";")) {
            String stmt = raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
            if (!stmt.isEmpty()) out.add(stmt);
        }
        return out;
    }

    static String loadSchemaScript() {
        try (InputStream in = MemorySchemaBootstrapper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Memory schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new IllegalStateException("Memory schema load failed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface ConnectionProvider {
        Connection getConnection() throws SQLException;
    }
}
