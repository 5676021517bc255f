package me.christianrobert.spmodernize.catalog;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.database.service.SqlServerConnectionService;
import me.christianrobert.spmodernize.rewrite.rule.DefinitionKeywordRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * Definition store backed by the live SQL Server database.
 *
 * <p>{@link #setText} runs the text as a single batch. A text starting with a plain
 * {@code CREATE PROCEDURE} (as every stored original does) is deployed as
 * {@code CREATE OR ALTER PROCEDURE}, so restoring an original over the existing procedure works.
 * {@code CREATE OR ALTER} needs SQL Server 2016 SP1.</p>
 */
@ApplicationScoped
public class SqlServerDefinitionStore implements DefinitionStore {

    private static final Logger log = LoggerFactory.getLogger(SqlServerDefinitionStore.class);

    @Inject
    SqlServerConnectionService connectionService;

    @Override
    public Optional<String> getText(UnitIdentity unit) {
        String sql = "SELECT OBJECT_DEFINITION(OBJECT_ID(?)) AS definition";

        try (Connection connection = connectionService.getConnection();
             PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, unit.getQuotedName());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("definition"));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            log.error("Failed to read definition of {}", unit, e);
            throw new CatalogException("Failed to read definition of " + unit + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void setText(UnitIdentity unit, String text) {
        if (text == null || text.isBlank()) {
            throw new CommitException(unit, "Refusing to deploy an empty definition for " + unit);
        }

        String batch = DefinitionKeywordRule.promoteToCreateOrAlter(text);
        log.debug("Deploying new definition of {} ({} chars)", unit, batch.length());
        log.trace("Definition of {}:\n{}", unit, batch);

        try (Connection connection = connectionService.getConnection();
             Statement stmt = connection.createStatement()) {
            stmt.execute(batch);
            log.info("Deployed new definition of {}", unit);
        } catch (SQLException e) {
            log.error("Failed to deploy definition of {}", unit, e);
            throw new CommitException(unit, "Failed to deploy definition of " + unit + ": " + e.getMessage(), e);
        }
    }
}
