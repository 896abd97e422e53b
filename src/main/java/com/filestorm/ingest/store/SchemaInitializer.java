package com.filestorm.ingest.store;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies the bundled {@code file_events} schema when {@code app.store.init-schema} is enabled.
 * Every statement is idempotent, so running it against a migrated database is a no-op.
 */
@ApplicationScoped
public class SchemaInitializer {

    private static final Logger LOG = Logger.getLogger(SchemaInitializer.class);

    static final String SCHEMA_RESOURCE = "db/file_events.sql";

    @ConfigProperty(name = "app.store.init-schema", defaultValue = "false")
    boolean initSchema;

    @Inject
    RecordStorePool pool;

    public void initialize() {
        if (!initSchema) {
            LOG.debug("Schema initialization disabled");
            return;
        }
        List<String> statements = loadStatements();
        try (Connection conn = pool.connection(); Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
            LOG.infof("Applied %d schema statements from %s", statements.size(), SCHEMA_RESOURCE);
        } catch (SQLException e) {
            throw new RecordStoreException("Failed to apply schema " + SCHEMA_RESOURCE, e);
        }
    }

    static List<String> loadStatements() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = loader.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new RecordStoreException("Schema resource not found: " + SCHEMA_RESOURCE, null);
            }
            return splitStatements(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RecordStoreException("Failed to read schema resource " + SCHEMA_RESOURCE, e);
        }
    }

    static List<String> splitStatements(String script) {
        List<String> statements = new ArrayList<>();
        for (String part : script.split(";")) {
            String sql = part.trim();
            if (!sql.isEmpty()) {
                statements.add(sql);
            }
        }
        return statements;
    }
}
