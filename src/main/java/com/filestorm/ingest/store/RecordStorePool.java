package com.filestorm.ingest.store;

import com.filestorm.ingest.util.IngestMetrics;
import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Bounded connection pool for the record store.
 * <p>
 * Pool sizing comes from {@code quarkus.datasource.jdbc.min-size} / {@code max-size}.
 * Every caller acquires one connection per operation and releases it with
 * try-with-resources. {@link #reconnect()} drops all pooled connections so the next
 * acquisition opens fresh ones after a store outage.
 */
@ApplicationScoped
public class RecordStorePool {

    private static final Logger LOG = Logger.getLogger(RecordStorePool.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    @Inject
    AgroalDataSource dataSource;

    @Inject
    IngestMetrics metrics;

    private volatile boolean closed;

    public Connection connection() throws SQLException {
        if (closed) {
            throw new SQLException("Record store pool is closed", "08003");
        }
        return dataSource.getConnection();
    }

    /**
     * @return true if a pooled connection can be acquired and validated
     */
    public boolean isReady() {
        if (closed) {
            return false;
        }
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            LOG.debugf("Record store not ready: %s", e.getMessage());
            return false;
        }
    }

    public void reconnect() {
        if (closed) {
            return;
        }
        LOG.warn("Reinitializing record store connection pool");
        try {
            dataSource.flush(AgroalDataSource.FlushMode.ALL);
            dataSource.flush(AgroalDataSource.FlushMode.FILL);
            metrics.incrementStoreReconnects();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to reinitialize record store connection pool");
        }
    }

    /**
     * Releases every pooled connection and refuses new acquisitions.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        dataSource.flush(AgroalDataSource.FlushMode.ALL);
        LOG.info("Record store connection pool closed");
    }

    public boolean isClosed() {
        return closed;
    }
}
