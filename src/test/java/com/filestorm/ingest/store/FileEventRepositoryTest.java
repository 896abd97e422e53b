package com.filestorm.ingest.store;

import com.filestorm.ingest.domain.FileEventRecord;
import com.filestorm.ingest.domain.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FileEventRepositoryTest {

    private static final Instant EVENT_TIME = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    RecordStorePool pool;

    @Mock
    Connection conn;

    @Mock
    PreparedStatement ps;

    @Mock
    ResultSet rs;

    private FileEventRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileEventRepository();
        repository.pool = pool;
    }

    @Test
    void conflictTolerantInsertTargetsDedupIndex() {
        assertThat(FileEventRepository.INSERT_IGNORING_CONFLICTS_SQL)
                .startsWith(FileEventRepository.INSERT_SQL)
                .endsWith("ON CONFLICT (dedup_key, event_time) WHERE dedup_key IS NOT NULL DO NOTHING");
        assertThat(FileEventRepository.INSERT_SQL).doesNotContain("ON CONFLICT");
    }

    @Test
    void insertBindsEveryColumnAndCountsInsertedRows() throws Exception {
        FileEventRecord keyed = new FileEventRecord(EVENT_TIME, Operation.UPLOAD, "a.txt", 42L,
                "text/plain", "s3://uploads/a.txt", "user-1", "1-0");
        FileEventRecord unkeyed = new FileEventRecord(EVENT_TIME, Operation.UPLOAD, "b.txt", 0L,
                "application/octet-stream", "s3://uploads/b.txt", "anonymous", null);
        when(conn.prepareStatement(FileEventRepository.INSERT_IGNORING_CONFLICTS_SQL)).thenReturn(ps);
        when(ps.executeBatch()).thenReturn(new int[]{1, 0});

        int inserted = repository.insertIgnoringConflicts(conn, List.of(keyed, unkeyed));

        assertThat(inserted).isEqualTo(1);
        verify(ps, times(2)).setObject(1, OffsetDateTime.ofInstant(EVENT_TIME, ZoneOffset.UTC));
        verify(ps, times(2)).setString(2, "UPLOAD");
        verify(ps).setString(3, "a.txt");
        verify(ps).setLong(4, 42L);
        verify(ps).setString(6, "s3://uploads/a.txt");
        verify(ps).setString(7, "user-1");
        verify(ps).setString(8, "1-0");
        verify(ps).setNull(8, Types.VARCHAR);
        verify(ps, times(2)).addBatch();
        verify(ps).close();
    }

    @Test
    void driverWithoutRowCountsCountsEachStatementOnce() throws Exception {
        FileEventRecord record = new FileEventRecord(EVENT_TIME, Operation.UPLOAD, "a.txt", 1L,
                null, "s3://uploads/a.txt", null, "1-0");
        when(conn.prepareStatement(FileEventRepository.INSERT_SQL)).thenReturn(ps);
        when(ps.executeBatch()).thenReturn(new int[]{Statement.SUCCESS_NO_INFO, Statement.SUCCESS_NO_INFO});

        assertThat(repository.insert(conn, List.of(record, record))).isEqualTo(2);
    }

    @Test
    void findsExistingKeysWithOnePlaceholderPerKey() throws Exception {
        when(conn.prepareStatement("SELECT dedup_key FROM file_events WHERE dedup_key IN (?,?,?)")).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getString(1)).thenReturn("1-0", "3-0");

        assertThat(repository.findExistingDedupKeys(conn, List.of("1-0", "2-0", "3-0")))
                .containsExactlyInAnyOrder("1-0", "3-0");
        verify(ps).setString(1, "1-0");
        verify(ps).setString(2, "2-0");
        verify(ps).setString(3, "3-0");
        verify(rs).close();
    }

    @Test
    void noKeysMeansNoQuery() throws Exception {
        assertThat(repository.findExistingDedupKeys(conn, List.of())).isEmpty();

        verifyNoInteractions(conn);
    }

    @Test
    void countUsesPooledConnection() throws Exception {
        when(pool.connection()).thenReturn(conn);
        when(conn.prepareStatement(FileEventRepository.COUNT_SQL)).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getLong(1)).thenReturn(42L);

        assertThat(repository.count()).isEqualTo(42L);
        verify(conn).close();
        verify(conn, never()).commit();
    }
}
