package me.christianrobert.spmodernize.journal;

import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.database.service.SqlServerConnectionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class JdbcBackupJournalTest {

    private static final String TABLE = "dbo.SP_Modernization_Backup";
    private static final UnitIdentity UNIT = UnitIdentity.of("dbo", "usp_Orders");

    private SqlServerConnectionService connectionService;
    private Connection mockConnection;
    private Statement mockStatement;
    private JdbcBackupJournal journal;

    @BeforeEach
    void setUp() throws Exception {
        connectionService = mock(SqlServerConnectionService.class);
        mockConnection = mock(Connection.class);
        mockStatement = mock(Statement.class);

        when(connectionService.getConnection()).thenReturn(mockConnection);
        when(mockConnection.createStatement()).thenReturn(mockStatement);

        journal = new JdbcBackupJournal(connectionService, TABLE);
    }

    @Test
    void testRejectsUnsafeTableName() {
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcBackupJournal(connectionService, "dbo.x; DROP TABLE y"));
        assertThrows(IllegalArgumentException.class, () -> new JdbcBackupJournal(connectionService, null));
    }

    @Test
    void testAppendInsertsAndReturnsGeneratedId() throws Exception {
        PreparedStatement insert = mock(PreparedStatement.class);
        ResultSet keys = mock(ResultSet.class);
        when(mockConnection.prepareStatement(startsWith("INSERT INTO " + TABLE), eq(Statement.RETURN_GENERATED_KEYS)))
                .thenReturn(insert);
        when(insert.getGeneratedKeys()).thenReturn(keys);
        when(keys.next()).thenReturn(true);
        when(keys.getLong(1)).thenReturn(7L);

        BackupRecord record = journal.append(UNIT, "CREATE PROCEDURE x", "ALTER PROCEDURE x");

        assertEquals(7L, record.getId());
        assertEquals(BackupStatus.BACKED_UP, record.getStatus());
        verify(insert).setString(1, "dbo");
        verify(insert).setString(2, "usp_Orders");
        verify(insert).setString(3, "CREATE PROCEDURE x");
        verify(insert).setString(6, "BACKED_UP");
        verify(insert).executeUpdate();
        verify(mockStatement).execute(contains("CREATE TABLE " + TABLE));
    }

    @Test
    void testAppendFailureIsWriteException() throws Exception {
        PreparedStatement insert = mock(PreparedStatement.class);
        when(mockConnection.prepareStatement(anyString(), anyInt())).thenReturn(insert);
        when(insert.executeUpdate()).thenThrow(new SQLException("disk full"));

        JournalWriteException e = assertThrows(JournalWriteException.class,
                () -> journal.append(UNIT, "orig", "new"));
        assertTrue(e.getMessage().contains("disk full"));
    }

    @Test
    void testTableIsCreatedOnlyOnce() throws Exception {
        PreparedStatement select = mock(PreparedStatement.class);
        ResultSet empty = mock(ResultSet.class);
        when(mockConnection.prepareStatement(startsWith("SELECT"))).thenReturn(select);
        when(select.executeQuery()).thenReturn(empty);
        when(empty.next()).thenReturn(false);

        journal.findAll();
        journal.findById(1L);

        verify(mockStatement, times(1)).execute(anyString());
    }

    @Test
    void testTransitionUpdatesConditionally() throws Exception {
        PreparedStatement update = mock(PreparedStatement.class);
        when(mockConnection.prepareStatement(startsWith("UPDATE"))).thenReturn(update);
        when(update.executeUpdate()).thenReturn(1);
        stubSelect(recordRow(3L, "UPDATED"));

        BackupRecord record = journal.transition(3L, BackupStatus.UPDATED);

        assertEquals(BackupStatus.UPDATED, record.getStatus());
        verify(update).setString(1, "UPDATED");
        verify(update).setLong(2, 3L);
        verify(update).setString(3, "BACKED_UP");
    }

    @Test
    void testTransitionFromWrongStatus() throws Exception {
        PreparedStatement update = mock(PreparedStatement.class);
        when(mockConnection.prepareStatement(startsWith("UPDATE"))).thenReturn(update);
        when(update.executeUpdate()).thenReturn(0);
        stubSelect(recordRow(3L, "ROLLED_BACK"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> journal.transition(3L, BackupStatus.UPDATED));
        assertTrue(e.getMessage().contains("ROLLED_BACK"));
    }

    @Test
    void testTransitionMissingRecord() throws Exception {
        PreparedStatement update = mock(PreparedStatement.class);
        when(mockConnection.prepareStatement(startsWith("UPDATE"))).thenReturn(update);
        when(update.executeUpdate()).thenReturn(0);
        ResultSet empty = mock(ResultSet.class);
        when(empty.next()).thenReturn(false);
        stubSelect(empty);

        assertThrows(IllegalArgumentException.class, () -> journal.transition(99L, BackupStatus.UPDATED));
    }

    @Test
    void testTransitionToBackedUpIsRejected() {
        assertThrows(IllegalStateException.class, () -> journal.transition(1L, BackupStatus.BACKED_UP));
    }

    @Test
    void testFindLatestUpdatedQueriesNewestFirst() throws Exception {
        PreparedStatement select = stubSelect(recordRow(12L, "UPDATED"));

        Optional<BackupRecord> latest = journal.findLatestUpdated(UNIT);

        assertTrue(latest.isPresent());
        assertEquals(12L, latest.get().getId());
        assertEquals(UNIT, latest.get().getUnit());
        verify(mockConnection).prepareStatement(argThat((String sql) ->
                sql.startsWith("SELECT TOP 1") && sql.endsWith("ORDER BY BackupId DESC")));
        verify(select).setObject(3, "UPDATED");
    }

    @Test
    void testQueryFailureIsJournalException() throws Exception {
        when(mockConnection.prepareStatement(startsWith("SELECT"))).thenThrow(new SQLException("timeout"));

        JournalException e = assertThrows(JournalException.class, () -> journal.findAll());
        assertFalse(e instanceof JournalWriteException);
    }

    @Test
    void testStatistics() throws Exception {
        PreparedStatement select = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        when(mockConnection.prepareStatement(contains("GROUP BY Status"))).thenReturn(select);
        when(select.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getString(1)).thenReturn("BACKED_UP", "UPDATED");
        when(rs.getInt(2)).thenReturn(2, 5);

        JournalStatistics statistics = journal.statistics();

        assertEquals(7, statistics.getTotalRecords());
        assertEquals(5, statistics.getCount(BackupStatus.UPDATED));
        assertEquals(0, statistics.getCount(BackupStatus.ROLLED_BACK));
    }

    @Test
    void testPurgeAll() throws Exception {
        when(mockStatement.executeUpdate("DELETE FROM " + TABLE)).thenReturn(4);

        assertEquals(4, journal.purgeAll());
    }

    private PreparedStatement stubSelect(ResultSet rs) throws SQLException {
        PreparedStatement select = mock(PreparedStatement.class);
        when(mockConnection.prepareStatement(startsWith("SELECT"))).thenReturn(select);
        when(select.executeQuery()).thenReturn(rs);
        return select;
    }

    private ResultSet recordRow(long id, String status) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true, false);
        when(rs.getLong("BackupId")).thenReturn(id);
        when(rs.getString("SchemaName")).thenReturn("dbo");
        when(rs.getString("ProcedureName")).thenReturn("usp_Orders");
        when(rs.getString("OriginalDefinition")).thenReturn("CREATE PROCEDURE dbo.usp_Orders AS RAISERROR('x', 16, 1)");
        when(rs.getString("ModernizedDefinition")).thenReturn("ALTER PROCEDURE dbo.usp_Orders AS ;THROW 50000, 'x', 1");
        when(rs.getTimestamp("BackupDate")).thenReturn(Timestamp.valueOf(LocalDateTime.of(2024, 3, 1, 10, 0)));
        when(rs.getString("Status")).thenReturn(status);
        return rs;
    }
}
