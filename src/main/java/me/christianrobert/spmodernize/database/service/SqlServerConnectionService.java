package me.christianrobert.spmodernize.database.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;

/**
 * Hands out JDBC connections to the SQL Server instance whose procedures are modernized.
 * Every caller gets its own connection and must close it.
 */
@ApplicationScoped
public class SqlServerConnectionService {

    private static final Logger log = LoggerFactory.getLogger(SqlServerConnectionService.class);

    @Inject
    ConfigService configService;

    public Map<String, Object> testConnection() {
        Map<String, Object> result = new HashMap<>();

        try {
            log.info("Testing SQL Server database connection...");

            long startTime = System.currentTimeMillis();

            try (Connection connection = getConnection()) {
                DatabaseMetaData metaData = connection.getMetaData();

                long connectionTime = System.currentTimeMillis() - startTime;

                result.put("status", "success");
                result.put("connected", true);
                result.put("message", "Successfully connected to SQL Server database");
                result.put("connectionTimeMs", connectionTime);
                result.put("databaseProductName", metaData.getDatabaseProductName());
                result.put("databaseProductVersion", metaData.getDatabaseProductVersion());
                result.put("driverVersion", metaData.getDriverVersion());
                result.put("url", metaData.getURL());
                result.put("userName", metaData.getUserName());
                result.put("compatibilityLevel", readCompatibilityLevel(connection));

                log.info("SQL Server connection test successful - Connected in {}ms", connectionTime);
            }

        } catch (SQLException e) {
            log.error("SQL Server connection test failed with SQL error", e);
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", "Database connection failed: " + e.getMessage());
            result.put("errorCode", e.getErrorCode());
            result.put("sqlState", e.getSQLState());
        } catch (Exception e) {
            log.error("SQL Server connection test failed with error", e);
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", "Connection test failed: " + e.getMessage());
        }

        return result;
    }

    public Connection getConnection() throws SQLException {
        if (!isConfigured()) {
            throw new IllegalStateException("SQL Server connection parameters not configured");
        }

        String url = configService.getConfigValueAsString(ConfigService.MSSQL_URL);
        log.debug("Creating SQL Server database connection to: {}", url);
        return DriverManager.getConnection(url,
                configService.getConfigValueAsString(ConfigService.MSSQL_USER),
                configService.getConfigValueAsString(ConfigService.MSSQL_PASSWORD));
    }

    public boolean isConfigured() {
        String url = configService.getConfigValueAsString(ConfigService.MSSQL_URL);
        String user = configService.getConfigValueAsString(ConfigService.MSSQL_USER);
        String password = configService.getConfigValueAsString(ConfigService.MSSQL_PASSWORD);

        return url != null && !url.trim().isEmpty() &&
               user != null && !user.trim().isEmpty() &&
               password != null && !password.trim().isEmpty();
    }

    // THROW needs compatibility level 110 (SQL Server 2012) or higher; reported for information only
    private Integer readCompatibilityLevel(Connection connection) {
        String sql = "SELECT compatibility_level FROM sys.databases WHERE name = DB_NAME()";
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : null;
        } catch (SQLException e) {
            log.warn("Could not read compatibility level: {}", e.getMessage());
            return null;
        }
    }
}
