package com.filestorm.ingest.store;

import com.filestorm.ingest.domain.FileEventRecord;
import com.filestorm.ingest.util.AlertLogger;
import com.filestorm.ingest.util.IngestMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes normalized records to {@code file_events} at most once per dedup key.
 * <p>
 * One batch is one transaction on one pooled connection:
 * <ol>
 *   <li>look up which dedup keys already have rows, skipping the lookup only when the
 *       {@code dedup_key} column does not exist yet;</li>
 *   <li>if every record is already present, report the batch as persisted without writing;</li>
 *   <li>insert the rest with {@code ON CONFLICT ... DO NOTHING}, falling back to a plain insert
 *       when the unique index has not been migrated yet;</li>
 *   <li>commit, or roll back, report 0 and reinitialize the pool.</li>
 * </ol>
 * Concurrent batches with overlapping keys are arbitrated by the unique index.
 */
@ApplicationScoped
public class IdempotentPersister implements RecordPersister {

    private static final Logger LOG = Logger.getLogger(IdempotentPersister.class);

    static final String INVALID_COLUMN_REFERENCE = "42P10";
    static final String UNDEFINED_COLUMN = "42703";

    @Inject
    RecordStorePool pool;

    @Inject
    FileEventRepository repository;

    @Inject
    IngestMetrics metrics;

    @Override
    public int persist(List<FileEventRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        try (Connection conn = pool.connection()) {
            return persistInTransaction(conn, records);
        } catch (SQLException e) {
            LOG.errorf(e, "Batch insert failed for %d records, batch left for retry", records.size());
            metrics.incrementPersistFailures();
            AlertLogger.persistenceFailed(records.size(), e.getSQLState(), e.getMessage());
            pool.reconnect();
            return 0;
        }
    }

    private int persistInTransaction(Connection conn, List<FileEventRecord> records) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            Set<String> existing = lookupExistingKeys(conn, records);
            List<FileEventRecord> fresh = selectNew(records, existing);

            if (fresh.isEmpty()) {
                conn.commit();
                LOG.infof("All %d records already exist in database (duplicates skipped)", records.size());
                metrics.incrementDuplicatesSkipped(records.size());
                return records.size();
            }

            LOG.debugf("Inserting %d new records (skipped %d duplicates)",
                    fresh.size(), records.size() - fresh.size());
            int inserted = insertNew(conn, fresh);
            conn.commit();

            int duplicates = records.size() - inserted;
            if (duplicates > 0) {
                metrics.incrementDuplicatesSkipped(duplicates);
            }
            metrics.incrementPersisted(inserted);
            LOG.infof("Batch insert committed: %d inserted, %d already present", inserted, duplicates);
            return records.size();
        } catch (SQLException | RuntimeException e) {
            rollback(conn);
            throw e;
        } finally {
            restoreAutoCommit(conn, autoCommit);
        }
    }

    private Set<String> lookupExistingKeys(Connection conn, List<FileEventRecord> records) throws SQLException {
        Set<String> keys = new LinkedHashSet<>();
        for (FileEventRecord record : records) {
            if (record.getDedupKey() != null) {
                keys.add(record.getDedupKey());
            }
        }
        if (keys.isEmpty()) {
            return Collections.emptySet();
        }
        Savepoint beforeCheck = conn.setSavepoint();
        try {
            return repository.findExistingDedupKeys(conn, keys);
        } catch (SQLException e) {
            if (!UNDEFINED_COLUMN.equals(sqlState(e))) {
                throw e;
            }
            // dedup_key column not migrated yet: rely on the insert alone
            LOG.warnf("Could not check for existing records: %s", e.getMessage());
            conn.rollback(beforeCheck);
            return Collections.emptySet();
        }
    }

    /**
     * Keeps records whose key is null or absent from the store, collapsing repeated keys
     * within the batch to their first occurrence.
     */
    static List<FileEventRecord> selectNew(List<FileEventRecord> records, Set<String> existing) {
        List<FileEventRecord> fresh = new ArrayList<>(records.size());
        Set<String> seen = new HashSet<>();
        for (FileEventRecord record : records) {
            String key = record.getDedupKey();
            if (key == null) {
                fresh.add(record);
            } else if (!existing.contains(key) && seen.add(key)) {
                fresh.add(record);
            }
        }
        return fresh;
    }

    private int insertNew(Connection conn, List<FileEventRecord> fresh) throws SQLException {
        Savepoint beforeInsert = conn.setSavepoint();
        try {
            return repository.insertIgnoringConflicts(conn, fresh);
        } catch (SQLException e) {
            if (!isMissingConflictTarget(e)) {
                throw e;
            }
            LOG.warnf("Unique index not found (SQLSTATE %s), using plain insert (duplicates already filtered)",
                    sqlState(e));
            metrics.incrementSchemaFallbacks();
            conn.rollback(beforeInsert);
            return repository.insert(conn, fresh);
        }
    }

    static boolean isMissingConflictTarget(SQLException e) {
        return INVALID_COLUMN_REFERENCE.equals(sqlState(e));
    }

    /**
     * Batch failures may carry the real SQLSTATE on a chained exception.
     */
    static String sqlState(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (current.getSQLState() != null) {
                return current.getSQLState();
            }
            if (current.getCause() instanceof SQLException) {
                SQLException cause = (SQLException) current.getCause();
                if (cause.getSQLState() != null) {
                    return cause.getSQLState();
                }
            }
        }
        return null;
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.warnf("Rollback failed: %s", e.getMessage());
        }
    }

    private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            LOG.warnf("Failed to restore auto-commit on pooled connection: %s", e.getMessage());
        }
    }
}
