package me.christianrobert.spmodernize.catalog;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.analysis.LegacySignatures;
import me.christianrobert.spmodernize.core.model.SourceUnit;
import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.database.service.SqlServerConnectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads user stored procedures from {@code sys.procedures} and {@code sys.sql_modules}.
 * Encrypted procedures have no readable definition and are skipped.
 */
@ApplicationScoped
public class SqlServerCatalogProvider implements CatalogProvider {

    private static final Logger log = LoggerFactory.getLogger(SqlServerCatalogProvider.class);

    @Inject
    SqlServerConnectionService connectionService;

    @Override
    public List<SourceUnit> findUnits(CatalogScope scope) {
        try (Connection connection = connectionService.getConnection()) {
            List<SourceUnit> units = findUnits(connection, scope);
            log.info("Found {} stored procedures for {}", units.size(), scope);
            return units;
        } catch (SQLException e) {
            log.error("Failed to read stored procedures for {}", scope, e);
            throw new CatalogException("Failed to read stored procedures: " + e.getMessage(), e);
        }
    }

    List<SourceUnit> findUnits(Connection connection, CatalogScope scope) throws SQLException {
        StringBuilder sql = new StringBuilder("""
            SELECT
                SCHEMA_NAME(p.schema_id) AS schema_name,
                p.name AS procedure_name,
                m.definition AS definition
            FROM sys.procedures p
                JOIN sys.sql_modules m ON p.object_id = m.object_id
            WHERE p.is_ms_shipped = 0
            """);
        List<String> params = new ArrayList<>();
        if (scope.getSchema() != null) {
            sql.append("  AND SCHEMA_NAME(p.schema_id) = ?\n");
            params.add(scope.getSchema());
        }
        if (scope.getName() != null) {
            sql.append("  AND p.name = ?\n");
            params.add(scope.getName());
        }
        sql.append("ORDER BY SCHEMA_NAME(p.schema_id), p.name");

        List<SourceUnit> units = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                ps.setString(i + 1, params.get(i));
            }

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String schema = rs.getString("schema_name");
                    String name = rs.getString("procedure_name");
                    String definition = rs.getString("definition");

                    if (definition == null) {
                        log.warn("Skipping {}.{}: definition is not readable (encrypted?)", schema, name);
                        continue;
                    }
                    if (scope.isLegacyOnly() && !LegacySignatures.matchesAny(definition)) {
                        continue;
                    }
                    units.add(new SourceUnit(UnitIdentity.of(schema, name), definition));
                }
            }
        }
        return units;
    }
}
