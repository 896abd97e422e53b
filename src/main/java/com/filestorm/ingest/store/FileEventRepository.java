package com.filestorm.ingest.store;

import com.filestorm.ingest.domain.FileEventRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SQL access to the {@code file_events} table. Statements run on the caller's connection
 * so that they join the caller's transaction.
 */
@ApplicationScoped
public class FileEventRepository {

    static final String INSERT_SQL = """
            INSERT INTO file_events (
                event_time, operation, filename, file_size,
                mime_type, storage_url, uploader_id, dedup_key
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)""";

    static final String INSERT_IGNORING_CONFLICTS_SQL = INSERT_SQL
            + " ON CONFLICT (dedup_key, event_time) WHERE dedup_key IS NOT NULL DO NOTHING";

    static final String COUNT_SQL = "SELECT COUNT(*) FROM file_events";

    @Inject
    RecordStorePool pool;

    /**
     * Returns which of the given dedup keys already have a row.
     */
    public Set<String> findExistingDedupKeys(Connection conn, Collection<String> dedupKeys) throws SQLException {
        Set<String> existing = new HashSet<>();
        if (dedupKeys.isEmpty()) {
            return existing;
        }
        String placeholders = dedupKeys.stream().map(k -> "?").collect(Collectors.joining(","));
        String sql = "SELECT dedup_key FROM file_events WHERE dedup_key IN (" + placeholders + ")";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int index = 1;
            for (String key : dedupKeys) {
                ps.setString(index++, key);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String key = rs.getString(1);
                    if (key != null) {
                        existing.add(key);
                    }
                }
            }
        }
        return existing;
    }

    /**
     * Bulk insert that silently discards rows conflicting on {@code (dedup_key, event_time)}.
     * Fails with SQLSTATE {@code 42P10} when the matching unique index does not exist.
     *
     * @return number of rows inserted, as far as the driver reports it
     */
    public int insertIgnoringConflicts(Connection conn, List<FileEventRecord> records) throws SQLException {
        return executeInsert(conn, INSERT_IGNORING_CONFLICTS_SQL, records);
    }

    /**
     * Unguarded bulk insert. Callers must have removed duplicates beforehand.
     */
    public int insert(Connection conn, List<FileEventRecord> records) throws SQLException {
        return executeInsert(conn, INSERT_SQL, records);
    }

    public long count() throws SQLException {
        try (Connection conn = pool.connection();
             PreparedStatement ps = conn.prepareStatement(COUNT_SQL);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private int executeInsert(Connection conn, String sql, List<FileEventRecord> records) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (FileEventRecord record : records) {
                ps.setObject(1, OffsetDateTime.ofInstant(record.getEventTime(), ZoneOffset.UTC));
                ps.setString(2, record.getOperation().name());
                ps.setString(3, record.getFilename());
                ps.setLong(4, record.getFileSize());
                ps.setString(5, record.getMimeType());
                ps.setString(6, record.getStorageUrl());
                ps.setString(7, record.getUploaderId());
                if (record.getDedupKey() != null) {
                    ps.setString(8, record.getDedupKey());
                } else {
                    ps.setNull(8, Types.VARCHAR);
                }
                ps.addBatch();
            }
            return countAffected(ps.executeBatch());
        }
    }

    private static int countAffected(int[] results) {
        int total = 0;
        for (int result : results) {
            if (result > 0) {
                total += result;
            } else if (result == Statement.SUCCESS_NO_INFO) {
                total++;
            }
        }
        return total;
    }
}
