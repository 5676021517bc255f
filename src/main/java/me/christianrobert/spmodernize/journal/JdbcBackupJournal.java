package me.christianrobert.spmodernize.journal;

import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.database.service.SqlServerConnectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Journal stored in a SQL Server table next to the procedures it protects.
 * The table is created on first use. Every call opens and closes its own connection.
 */
public class JdbcBackupJournal implements BackupJournal {

    private static final Logger log = LoggerFactory.getLogger(JdbcBackupJournal.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final String COLUMNS =
            "BackupId, SchemaName, ProcedureName, OriginalDefinition, ModernizedDefinition, BackupDate, Status";

    private final SqlServerConnectionService connectionService;
    private final String tableName;
    private volatile boolean tableVerified;

    public JdbcBackupJournal(SqlServerConnectionService connectionService, String tableName) {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid journal table name: " + tableName);
        }
        this.connectionService = connectionService;
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public BackupRecord append(UnitIdentity unit, String originalText, String rewrittenText) {
        if (unit == null || originalText == null) {
            throw new JournalWriteException("Unit and original text are required for a backup record");
        }

        String sql = "INSERT INTO " + tableName
                + " (SchemaName, ProcedureName, OriginalDefinition, ModernizedDefinition, BackupDate, Status)"
                + " VALUES (?, ?, ?, ?, ?, ?)";
        LocalDateTime createdAt = LocalDateTime.now();

        try (Connection connection = connectionService.getConnection()) {
            ensureTable(connection);
            try (PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, unit.getSchema());
                ps.setString(2, unit.getName());
                ps.setString(3, originalText);
                ps.setString(4, rewrittenText);
                ps.setTimestamp(5, Timestamp.valueOf(createdAt));
                ps.setString(6, BackupStatus.BACKED_UP.name());
                ps.executeUpdate();

                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new JournalWriteException("No BackupId generated for " + unit);
                    }
                    long id = keys.getLong(1);
                    log.debug("Appended backup record {} for {}", id, unit);
                    return new BackupRecord(id, unit, originalText, rewrittenText, createdAt, BackupStatus.BACKED_UP);
                }
            }
        } catch (SQLException e) {
            log.error("Failed to write backup record for {}", unit, e);
            throw new JournalWriteException("Failed to write backup record for " + unit + ": " + e.getMessage(), e);
        }
    }

    @Override
    public BackupRecord transition(long id, BackupStatus target) {
        BackupStatus expected = target.predecessor();
        if (expected == null) {
            throw new IllegalStateException("Backup record " + id + " cannot move to " + target);
        }

        String sql = "UPDATE " + tableName + " SET Status = ? WHERE BackupId = ? AND Status = ?";
        int updated;
        try (Connection connection = connectionService.getConnection()) {
            ensureTable(connection);
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, target.name());
                ps.setLong(2, id);
                ps.setString(3, expected.name());
                updated = ps.executeUpdate();
            }
        } catch (SQLException e) {
            log.error("Failed to move backup record {} to {}", id, target, e);
            throw new JournalWriteException("Failed to update backup record " + id + ": " + e.getMessage(), e);
        }

        // Conditional update: zero rows means the record is missing or in the wrong status
        Optional<BackupRecord> record = findById(id);
        if (record.isEmpty()) {
            throw new IllegalArgumentException("No backup record with id " + id);
        }
        if (updated == 0) {
            throw new IllegalStateException(String.format(
                    "Backup record %d cannot move from %s to %s", id, record.get().getStatus(), target));
        }

        log.debug("Backup record {} moved from {} to {}", id, expected, target);
        return record.get();
    }

    @Override
    public Optional<BackupRecord> findById(long id) {
        List<BackupRecord> found = query("SELECT " + COLUMNS + " FROM " + tableName + " WHERE BackupId = ?",
                List.of(id));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<BackupRecord> findByUnit(UnitIdentity unit) {
        return find(unit.getSchema(), unit.getName(), null);
    }

    @Override
    public List<BackupRecord> findByStatus(BackupStatus status) {
        return find(null, null, status);
    }

    @Override
    public List<BackupRecord> find(String schema, String name, BackupStatus status) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + tableName + " WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (schema != null) {
            sql.append(" AND SchemaName = ?");
            params.add(schema);
        }
        if (name != null) {
            sql.append(" AND ProcedureName = ?");
            params.add(name);
        }
        if (status != null) {
            sql.append(" AND Status = ?");
            params.add(status.name());
        }
        sql.append(" ORDER BY BackupId");
        return query(sql.toString(), params);
    }

    @Override
    public Optional<BackupRecord> findLatestUpdated(UnitIdentity unit) {
        String sql = "SELECT TOP 1 " + COLUMNS + " FROM " + tableName
                + " WHERE SchemaName = ? AND ProcedureName = ? AND Status = ? ORDER BY BackupId DESC";
        List<BackupRecord> found = query(sql, List.of(unit.getSchema(), unit.getName(), BackupStatus.UPDATED.name()));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public JournalStatistics statistics() {
        String sql = "SELECT Status, COUNT(*) FROM " + tableName + " GROUP BY Status";
        Map<BackupStatus, Integer> counts = new EnumMap<>(BackupStatus.class);

        try (Connection connection = connectionService.getConnection()) {
            ensureTable(connection);
            try (PreparedStatement ps = connection.prepareStatement(sql);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(BackupStatus.fromString(rs.getString(1)), rs.getInt(2));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read journal statistics", e);
            throw new JournalException("Failed to read journal statistics: " + e.getMessage(), e);
        }
        return new JournalStatistics(counts);
    }

    @Override
    public int purgeAll() {
        try (Connection connection = connectionService.getConnection()) {
            ensureTable(connection);
            try (Statement stmt = connection.createStatement()) {
                int removed = stmt.executeUpdate("DELETE FROM " + tableName);
                log.info("Purged {} backup records from {}", removed, tableName);
                return removed;
            }
        } catch (SQLException e) {
            log.error("Failed to purge journal table {}", tableName, e);
            throw new JournalWriteException("Failed to purge journal: " + e.getMessage(), e);
        }
    }

    private List<BackupRecord> query(String sql, List<?> params) {
        List<BackupRecord> result = new ArrayList<>();
        try (Connection connection = connectionService.getConnection()) {
            ensureTable(connection);
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapRecord(rs));
                    }
                }
            }
        } catch (SQLException e) {
            log.error("Failed to query journal table {}", tableName, e);
            throw new JournalException("Failed to query journal: " + e.getMessage(), e);
        }
        return result;
    }

    private BackupRecord mapRecord(ResultSet rs) throws SQLException {
        Timestamp backupDate = rs.getTimestamp("BackupDate");
        return new BackupRecord(
                rs.getLong("BackupId"),
                UnitIdentity.of(rs.getString("SchemaName"), rs.getString("ProcedureName")),
                rs.getString("OriginalDefinition"),
                rs.getString("ModernizedDefinition"),
                backupDate != null ? backupDate.toLocalDateTime() : null,
                BackupStatus.fromString(rs.getString("Status")));
    }

    private void ensureTable(Connection connection) throws SQLException {
        if (tableVerified) {
            return;
        }

        String ddl = """
                IF OBJECT_ID(N'%1$s', N'U') IS NULL
                CREATE TABLE %1$s (
                    BackupId BIGINT IDENTITY(1,1) PRIMARY KEY,
                    SchemaName SYSNAME NOT NULL,
                    ProcedureName SYSNAME NOT NULL,
                    OriginalDefinition NVARCHAR(MAX) NOT NULL,
                    ModernizedDefinition NVARCHAR(MAX) NULL,
                    BackupDate DATETIME2 NOT NULL DEFAULT SYSDATETIME(),
                    Status NVARCHAR(20) NOT NULL
                )
                """.formatted(tableName);

        try (Statement stmt = connection.createStatement()) {
            stmt.execute(ddl);
        }
        tableVerified = true;
        log.info("Journal table {} is available", tableName);
    }
}
